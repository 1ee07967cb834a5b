package com.example.tablecompare.domain;

import lombok.Getter;
import lombok.Setter;

import java.util.List;

/**
 * Output of one comparison run: both parsed tables and the difference batch.
 */
@Getter
@Setter
public class ComparisonResult {
    private String originalName;
    private String updatedName;
    private Table original;
    private Table updated;
    private List<Difference> differences;
    private ComparisonTiming timing;

    public ComparisonResult(
            String originalName,
            String updatedName,
            Table original,
            Table updated,
            List<Difference> differences) {
        this.originalName = originalName;
        this.updatedName = updatedName;
        this.original = original;
        this.updated = updated;
        this.differences = differences;
        this.timing = null;
    }

    public TableSummary getOriginalSummary() {
        return TableSummary.of(originalName, original);
    }

    public TableSummary getUpdatedSummary() {
        return TableSummary.of(updatedName, updated);
    }
}
