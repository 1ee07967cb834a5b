package com.example.tablecompare.domain;

import java.util.Objects;

public record ComparisonRequest(TableInput original, TableInput updated) {
    public ComparisonRequest {
        Objects.requireNonNull(original, "original");
        Objects.requireNonNull(updated, "updated");
    }
}
