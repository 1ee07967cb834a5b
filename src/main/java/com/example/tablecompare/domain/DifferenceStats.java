package com.example.tablecompare.domain;

import java.util.Collection;

/**
 * Aggregate counts over a full difference set.
 */
public record DifferenceStats(
        int total, int added, int removed, int modified, int accepted, int rejected, int pending) {

    public static DifferenceStats of(Collection<Difference> differences) {
        int added = 0;
        int removed = 0;
        int modified = 0;
        int accepted = 0;
        int rejected = 0;
        int pending = 0;
        for (Difference difference : differences) {
            switch (difference.getKind()) {
                case ADDED -> added++;
                case REMOVED -> removed++;
                case MODIFIED -> modified++;
            }
            switch (difference.getStatus()) {
                case ACCEPTED -> accepted++;
                case REJECTED -> rejected++;
                case PENDING -> pending++;
            }
        }
        return new DifferenceStats(
                differences.size(), added, removed, modified, accepted, rejected, pending);
    }
}
