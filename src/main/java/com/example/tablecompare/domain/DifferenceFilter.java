package com.example.tablecompare.domain;

import java.util.Locale;

/**
 * Display filter over a difference set. A {@code null} kind or status matches any value.
 * A blank search matches everything; otherwise the search text is matched as given,
 * without trimming.
 */
public record DifferenceFilter(DifferenceKind kind, DifferenceStatus status, String searchText) {
    public DifferenceFilter {
        searchText = searchText == null ? "" : searchText;
    }

    public static DifferenceFilter any() {
        return new DifferenceFilter(null, null, "");
    }

    public boolean matches(Difference difference) {
        if (kind != null && difference.getKind() != kind) {
            return false;
        }
        if (status != null && difference.getStatus() != status) {
            return false;
        }
        if (searchText.isBlank()) {
            return true;
        }
        String needle = searchText.toLowerCase(Locale.ROOT);
        return contains(difference.getColumnKey(), needle)
                || contains(difference.getOriginalValue(), needle)
                || contains(difference.getNewValue(), needle);
    }

    private static boolean contains(String value, String needle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(needle);
    }
}
