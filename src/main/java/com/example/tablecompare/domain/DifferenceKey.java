package com.example.tablecompare.domain;

/**
 * Stable identity of a difference inside one comparison run.
 */
public record DifferenceKey(int rowPosition, int columnIndex) {}
