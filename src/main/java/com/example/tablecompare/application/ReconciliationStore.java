package com.example.tablecompare.application;

import com.example.tablecompare.domain.Difference;
import com.example.tablecompare.domain.DifferenceFilter;
import com.example.tablecompare.domain.DifferenceKey;
import com.example.tablecompare.domain.DifferenceKind;
import com.example.tablecompare.domain.DifferenceStats;
import com.example.tablecompare.domain.DifferenceStatus;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Working set of one comparison run with a decision per difference.
 *
 * <p>Entries are addressed by {@link DifferenceKey}, never by list position, since callers
 * work from filtered views. The store never creates or drops single entries; the whole
 * batch is swapped by {@link #replaceAll(List)}.
 */
public class ReconciliationStore {
    private static final Logger log = LogManager.getLogger(ReconciliationStore.class);

    private final Map<DifferenceKey, Difference> differences = new LinkedHashMap<>();

    public ReconciliationStore() {}

    public ReconciliationStore(List<Difference> batch) {
        replaceAll(batch);
    }

    public synchronized void replaceAll(List<Difference> batch) {
        differences.clear();
        if (batch == null) {
            return;
        }
        for (Difference difference : batch) {
            differences.put(difference.key(), difference);
        }
    }

    /**
     * Overwrites the status of the difference at the given identity.
     *
     * @return {@code false} when no difference matches; the call is then a no-op
     */
    public synchronized boolean setStatus(
            int rowPosition, int columnIndex, DifferenceStatus status) {
        Difference difference = differences.get(new DifferenceKey(rowPosition, columnIndex));
        if (difference == null || status == null) {
            log.debug(
                    "Ignoring status {} for unknown difference ({}, {})",
                    status,
                    rowPosition,
                    columnIndex);
            return false;
        }
        difference.setStatus(status);
        return true;
    }

    public synchronized Optional<Difference> find(int rowPosition, int columnIndex) {
        return Optional.ofNullable(differences.get(new DifferenceKey(rowPosition, columnIndex)));
    }

    public List<Difference> filter(
            DifferenceKind kindFilter, DifferenceStatus statusFilter, String searchText) {
        return filter(new DifferenceFilter(kindFilter, statusFilter, searchText));
    }

    public synchronized List<Difference> filter(DifferenceFilter filter) {
        DifferenceFilter effective = filter != null ? filter : DifferenceFilter.any();
        return differences.values().stream().filter(effective::matches).toList();
    }

    public synchronized List<Difference> differences() {
        return List.copyOf(differences.values());
    }

    public synchronized List<Difference> accepted() {
        return filter(new DifferenceFilter(null, DifferenceStatus.ACCEPTED, ""));
    }

    public synchronized boolean hasAccepted() {
        return differences.values().stream()
                .anyMatch(d -> d.getStatus() == DifferenceStatus.ACCEPTED);
    }

    public synchronized DifferenceStats stats() {
        return DifferenceStats.of(differences.values());
    }

    public synchronized int size() {
        return differences.size();
    }
}
