package com.example.tablecompare.domain;

public enum DifferenceStatus {
    PENDING,
    ACCEPTED,
    REJECTED
}
