package com.example.tablecompare.infrastructure;

import com.example.tablecompare.application.TableWriter;
import com.example.tablecompare.domain.Delimiter;
import com.example.tablecompare.domain.Table;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Writes the header line and one line per row, joined with {@code \n}. Cells are not
 * re-quoted, so a cell holding the delimiter does not survive a round trip.
 */
@Component
public class DelimitedTableWriter implements TableWriter {
    private final Delimiter delimiter;

    public DelimitedTableWriter(Delimiter delimiter) {
        this.delimiter = delimiter;
    }

    @Override
    public String write(Table table) {
        if (table == null || (table.headers().isEmpty() && table.rows().isEmpty())) {
            return "";
        }
        List<String> lines = new ArrayList<>(table.rowCount() + 1);
        lines.add(delimiter.join(table.headers()));
        for (List<String> row : table.rows()) {
            lines.add(delimiter.join(row));
        }
        return String.join("\n", lines);
    }
}
