package com.example.tablecompare.domain;

/**
 * Elapsed time of a single comparison step.
 */
public record StepTiming(String label, double durationSeconds) {}
