package com.example.tablecompare.application;

import com.example.tablecompare.domain.Delimiter;
import com.example.tablecompare.domain.Difference;
import com.example.tablecompare.domain.DifferenceKind;
import com.example.tablecompare.domain.DifferenceStatus;
import com.example.tablecompare.domain.Table;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Builds a corrected table from a base table and its accepted differences.
 *
 * <p>Application order is fixed so the result does not depend on the order decisions were
 * made in:
 *
 * <ol>
 *   <li>cell edits, addressed against the unmodified row positions of the base table;
 *   <li>whole-row removals, highest position first so pending positions stay valid;
 *   <li>whole-row additions, lowest position first, appended at the end.
 * </ol>
 *
 * A row that is removed drops any accepted cell edit on it.
 */
@Component
public class PatchApplier {
    private static final Logger log = LogManager.getLogger(PatchApplier.class);

    private final Delimiter delimiter;

    public PatchApplier(Delimiter delimiter) {
        this.delimiter = delimiter;
    }

    public Table apply(Table base, Collection<Difference> differences) {
        Table source = base != null ? base : Table.empty();
        List<List<String>> rows = new ArrayList<>(source.rowCount());
        for (List<String> row : source.rows()) {
            rows.add(new ArrayList<>(row));
        }

        List<Difference> accepted =
                differences == null
                        ? List.of()
                        : differences.stream()
                                .filter(d -> d.getStatus() == DifferenceStatus.ACCEPTED)
                                .toList();

        Set<Integer> removedPositions = new TreeSet<>(Comparator.reverseOrder());
        for (Difference difference : accepted) {
            if (difference.isWholeRow() && difference.getKind() == DifferenceKind.REMOVED) {
                removedPositions.add(difference.getRowPosition());
            }
        }

        applyCellEdits(rows, accepted, removedPositions);
        int removed = applyRowRemovals(rows, removedPositions);
        int added = applyRowAdditions(rows, accepted);

        log.debug(
                "Applied {} accepted differences: {} rows removed, {} rows added",
                accepted.size(),
                removed,
                added);
        return new Table(source.headers(), rows);
    }

    private void applyCellEdits(
            List<List<String>> rows, List<Difference> accepted, Set<Integer> removedPositions) {
        List<Difference> cellEdits =
                accepted.stream()
                        .filter(d -> !d.isWholeRow())
                        .sorted(
                                Comparator.comparingInt(Difference::getRowPosition)
                                        .thenComparingInt(Difference::getColumnIndex))
                        .toList();
        for (Difference edit : cellEdits) {
            if (removedPositions.contains(edit.getRowPosition())) {
                log.debug("Discarding cell edit on removed row: {}", edit);
                continue;
            }
            int rowIndex = edit.getRowPosition() - 1;
            if (rowIndex < 0 || rowIndex >= rows.size() || edit.getColumnIndex() < 0) {
                continue;
            }
            List<String> row = rows.get(rowIndex);
            while (row.size() <= edit.getColumnIndex()) {
                row.add("");
            }
            row.set(edit.getColumnIndex(), edit.getNewValue());
        }
    }

    private int applyRowRemovals(List<List<String>> rows, Set<Integer> removedPositions) {
        int removed = 0;
        for (int rowPosition : removedPositions) {
            int rowIndex = rowPosition - 1;
            if (rowIndex >= 0 && rowIndex < rows.size()) {
                rows.remove(rowIndex);
                removed++;
            }
        }
        return removed;
    }

    private int applyRowAdditions(List<List<String>> rows, List<Difference> accepted) {
        List<Difference> additions =
                accepted.stream()
                        .filter(d -> d.isWholeRow() && d.getKind() == DifferenceKind.ADDED)
                        .sorted(Comparator.comparingInt(Difference::getRowPosition))
                        .toList();
        for (Difference addition : additions) {
            rows.add(new ArrayList<>(delimiter.split(addition.getNewValue())));
        }
        return additions.size();
    }
}
