package com.example.tablecompare.domain;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Field delimiter shared by parsing, diffing, patching and serialization.
 * Splitting keeps trailing empty fields; there is no quoting support.
 */
public final class Delimiter {
    public static final Delimiter COMMA = new Delimiter(",");

    private final String value;
    private final Pattern pattern;

    public Delimiter(String value) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("Delimiter must not be empty");
        }
        this.value = value;
        this.pattern = Pattern.compile(Pattern.quote(value));
    }

    public String value() {
        return value;
    }

    public List<String> split(String line) {
        return Arrays.asList(pattern.split(line, -1));
    }

    public String join(List<String> cells) {
        return String.join(value, cells);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Delimiter other)) {
            return false;
        }
        return value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
