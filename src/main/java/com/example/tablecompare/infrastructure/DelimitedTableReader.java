package com.example.tablecompare.infrastructure;

import com.example.tablecompare.application.TableReader;
import com.example.tablecompare.domain.Delimiter;
import com.example.tablecompare.domain.Table;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Plain delimited-text parser. Quoted fields and escaped delimiters are not supported:
 * double quotes are stripped and every delimiter splits.
 */
@Component
public class DelimitedTableReader implements TableReader {
    private final Delimiter delimiter;

    public DelimitedTableReader(Delimiter delimiter) {
        this.delimiter = delimiter;
    }

    @Override
    public Table read(String text) {
        if (text == null || text.isEmpty()) {
            return Table.empty();
        }
        List<String> lines = new ArrayList<>();
        for (String line : text.split("\n", -1)) {
            if (!strip(line).isEmpty()) {
                lines.add(line);
            }
        }
        if (lines.isEmpty()) {
            return Table.empty();
        }

        List<String> headers = splitLine(lines.get(0));
        List<List<String>> rows = new ArrayList<>(lines.size() - 1);
        for (String line : lines.subList(1, lines.size())) {
            rows.add(splitLine(line));
        }
        return new Table(headers, rows);
    }

    private List<String> splitLine(String line) {
        List<String> cells = new ArrayList<>();
        for (String cell : delimiter.split(line)) {
            cells.add(strip(cell).replace("\"", ""));
        }
        return cells;
    }

    // Unlike String.trim, also drops no-break spaces and a stray BOM.
    static String strip(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && isTrimmable(value.charAt(start))) {
            start++;
        }
        while (end > start && isTrimmable(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(start, end);
    }

    private static boolean isTrimmable(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c) || c == '\uFEFF';
    }
}
