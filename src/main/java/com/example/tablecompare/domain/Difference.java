package com.example.tablecompare.domain;

import lombok.Getter;

import java.util.Objects;

/**
 * One discrepancy between two tables, scoped to a single cell or to an entire row.
 * Only {@link #status} changes after creation.
 */
@Getter
public class Difference {
    public static final String ENTIRE_ROW = "Entire Row";
    public static final int WHOLE_ROW_INDEX = -1;

    private final int rowPosition;
    private final String columnKey;
    private final int columnIndex;
    private final String originalValue;
    private final String newValue;
    private final DifferenceKind kind;
    private volatile DifferenceStatus status;

    private Difference(
            int rowPosition,
            String columnKey,
            int columnIndex,
            String originalValue,
            String newValue,
            DifferenceKind kind) {
        this.rowPosition = rowPosition;
        this.columnKey = columnKey;
        this.columnIndex = columnIndex;
        this.originalValue = originalValue != null ? originalValue : "";
        this.newValue = newValue != null ? newValue : "";
        this.kind = Objects.requireNonNull(kind, "kind");
        this.status = DifferenceStatus.PENDING;
    }

    public static Difference wholeRow(
            int rowPosition, DifferenceKind kind, String originalValue, String newValue) {
        return new Difference(
                rowPosition, ENTIRE_ROW, WHOLE_ROW_INDEX, originalValue, newValue, kind);
    }

    public static Difference cell(
            int rowPosition,
            String columnKey,
            int columnIndex,
            String originalValue,
            String newValue,
            DifferenceKind kind) {
        return new Difference(rowPosition, columnKey, columnIndex, originalValue, newValue, kind);
    }

    public boolean isWholeRow() {
        return columnIndex == WHOLE_ROW_INDEX;
    }

    public DifferenceKey key() {
        return new DifferenceKey(rowPosition, columnIndex);
    }

    public void setStatus(DifferenceStatus status) {
        this.status = Objects.requireNonNull(status, "status");
    }

    @Override
    public String toString() {
        return "Difference{row="
                + rowPosition
                + ", column="
                + columnKey
                + "("
                + columnIndex
                + "), "
                + kind
                + " '"
                + originalValue
                + "' -> '"
                + newValue
                + "', "
                + status
                + "}";
    }
}
