package com.example.tablecompare.domain;

import java.util.List;

/**
 * Parsed delimited table. Row length is not tied to the header count.
 */
public record Table(List<String> headers, List<List<String>> rows) {
    private static final Table EMPTY = new Table(List.of(), List.of());

    public Table {
        headers = headers == null ? List.of() : List.copyOf(headers);
        rows = rows == null ? List.of() : rows.stream().map(List::copyOf).toList();
    }

    public static Table empty() {
        return EMPTY;
    }

    public int rowCount() {
        return rows.size();
    }

    public boolean hasRow(int index) {
        return index >= 0 && index < rows.size();
    }

    /** Header at {@code index}, or an empty string when the header row is shorter. */
    public String header(int index) {
        return index >= 0 && index < headers.size() ? headers.get(index) : "";
    }
}
