package com.example.tablecompare.domain;

public record TableSummary(String name, int rowCount, int columnCount) {
    public static TableSummary of(String name, Table table) {
        return new TableSummary(name, table.rowCount(), table.headers().size());
    }
}
