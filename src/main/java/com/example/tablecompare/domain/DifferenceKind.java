package com.example.tablecompare.domain;

public enum DifferenceKind {
    ADDED,
    REMOVED,
    MODIFIED
}
