package com.example.tablecompare.domain;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Represents an uploaded delimited-text file in a framework-agnostic way.
 */
public class TableInput {
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final String filename;
    private final InputStreamSupplier inputStreamSupplier;

    public TableInput(String filename, InputStreamSupplier inputStreamSupplier) {
        this.filename = filename != null ? filename.trim() : "";
        this.inputStreamSupplier = Objects.requireNonNull(inputStreamSupplier, "inputStreamSupplier");
    }

    public static TableInput ofText(String filename, String text) {
        byte[] bytes = (text != null ? text : "").getBytes(StandardCharsets.UTF_8);
        return new TableInput(filename, () -> new ByteArrayInputStream(bytes));
    }

    public String filename() {
        return filename;
    }

    public InputStream openStream() throws IOException {
        return inputStreamSupplier.openStream();
    }

    /** Reads the whole input as UTF-8, dropping a leading byte order mark. */
    public String readText() throws IOException {
        try (InputStream inputStream = openStream()) {
            String text = new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
            if (!text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK) {
                return text.substring(1);
            }
            return text;
        }
    }

    @FunctionalInterface
    public interface InputStreamSupplier {
        InputStream openStream() throws IOException;
    }
}
