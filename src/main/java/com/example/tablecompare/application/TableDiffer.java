package com.example.tablecompare.application;

import com.example.tablecompare.domain.Delimiter;
import com.example.tablecompare.domain.Difference;
import com.example.tablecompare.domain.DifferenceKind;
import com.example.tablecompare.domain.Table;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Positional cell-level diff of two tables. Rows are aligned by index only.
 *
 * <p>Output is ordered by row position; a whole-row difference is the only entry for its
 * row, otherwise column differences follow in column order.
 */
@Component
public class TableDiffer {
    private static final Logger log = LogManager.getLogger(TableDiffer.class);

    private final Delimiter delimiter;

    public TableDiffer(Delimiter delimiter) {
        this.delimiter = delimiter;
    }

    public List<Difference> diff(Table original, Table updated) {
        Table left = original != null ? original : Table.empty();
        Table right = updated != null ? updated : Table.empty();
        List<Difference> differences = new ArrayList<>();

        int maxRows = Math.max(left.rowCount(), right.rowCount());
        for (int rowIndex = 0; rowIndex < maxRows; rowIndex++) {
            int rowPosition = rowIndex + 1;
            boolean inLeft = left.hasRow(rowIndex);
            boolean inRight = right.hasRow(rowIndex);
            if (!inLeft) {
                differences.add(
                        Difference.wholeRow(
                                rowPosition,
                                DifferenceKind.ADDED,
                                "",
                                delimiter.join(right.rows().get(rowIndex))));
                continue;
            }
            if (!inRight) {
                differences.add(
                        Difference.wholeRow(
                                rowPosition,
                                DifferenceKind.REMOVED,
                                delimiter.join(left.rows().get(rowIndex)),
                                ""));
                continue;
            }
            diffRow(rowPosition, left, right, differences);
        }
        log.debug(
                "Compared {} x {} rows, {} differences",
                left.rowCount(),
                right.rowCount(),
                differences.size());
        return differences;
    }

    private void diffRow(int rowPosition, Table left, Table right, List<Difference> out) {
        List<String> leftRow = left.rows().get(rowPosition - 1);
        List<String> rightRow = right.rows().get(rowPosition - 1);
        int maxCols = Math.max(leftRow.size(), rightRow.size());
        for (int columnIndex = 0; columnIndex < maxCols; columnIndex++) {
            String originalValue = cell(leftRow, columnIndex);
            String newValue = cell(rightRow, columnIndex);
            if (originalValue.equals(newValue)) {
                continue;
            }
            out.add(
                    Difference.cell(
                            rowPosition,
                            resolveColumnName(left, right, columnIndex),
                            columnIndex,
                            originalValue,
                            newValue,
                            classify(originalValue, newValue)));
        }
    }

    // An empty header name counts as missing and falls through to the next source.
    static String resolveColumnName(Table left, Table right, int columnIndex) {
        String name = left.header(columnIndex);
        if (name.isEmpty()) {
            name = right.header(columnIndex);
        }
        if (name.isEmpty()) {
            name = "Column " + (columnIndex + 1);
        }
        return name;
    }

    // Original emptiness is checked before new emptiness; equal values never get here.
    static DifferenceKind classify(String originalValue, String newValue) {
        if (originalValue.isEmpty() && !newValue.isEmpty()) {
            return DifferenceKind.ADDED;
        }
        if (!originalValue.isEmpty() && newValue.isEmpty()) {
            return DifferenceKind.REMOVED;
        }
        return DifferenceKind.MODIFIED;
    }

    private static String cell(List<String> row, int index) {
        return index < row.size() ? row.get(index) : "";
    }
}
