package com.example.tablecompare.application;

import com.example.tablecompare.domain.ComparisonResult;
import com.example.tablecompare.domain.ComparisonTiming;
import com.example.tablecompare.domain.Table;
import com.example.tablecompare.domain.TableSummary;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * One comparison run together with the store that owns its decisions.
 */
public class ReconciliationSession {
    private final long id;
    private final String name;
    private final LocalDateTime created;
    private final ReconciliationStore store;
    private volatile ComparisonResult result;

    public ReconciliationSession(long id, String name, ComparisonResult result) {
        this.id = id;
        this.name = name;
        this.created = LocalDateTime.now();
        this.result = Objects.requireNonNull(result, "result");
        this.store = new ReconciliationStore(result.getDifferences());
    }

    /** Swaps in a new comparison run; every decision resets to pending. */
    public synchronized void replaceRun(ComparisonResult newResult) {
        this.result = Objects.requireNonNull(newResult, "newResult");
        store.replaceAll(newResult.getDifferences());
    }

    public long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public LocalDateTime getCreated() {
        return created;
    }

    public ReconciliationStore getStore() {
        return store;
    }

    public ComparisonResult getResult() {
        return result;
    }

    public Table getOriginal() {
        return result.getOriginal();
    }

    public String getOriginalName() {
        return result.getOriginalName();
    }

    public TableSummary getOriginalSummary() {
        return result.getOriginalSummary();
    }

    public TableSummary getUpdatedSummary() {
        return result.getUpdatedSummary();
    }

    public ComparisonTiming getTiming() {
        return result.getTiming();
    }
}
