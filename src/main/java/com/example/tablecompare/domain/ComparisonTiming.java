package com.example.tablecompare.domain;

import java.util.List;

/**
 * Summary of timing information for a comparison run.
 */
public record ComparisonTiming(List<StepTiming> steps, double totalDurationSeconds) {
    public ComparisonTiming {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }
}
