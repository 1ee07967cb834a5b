package com.example.tablecompare.infrastructure;

import com.example.tablecompare.domain.Delimiter;
import com.example.tablecompare.domain.Table;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class DelimitedTableWriterTest {

    private final DelimitedTableWriter writer = new DelimitedTableWriter(Delimiter.COMMA);

    @Test
    void writesHeaderLineThenRows() {
        Table table =
                new Table(
                        List.of("Name", "City"),
                        List.of(List.of("Alice", "NYC"), List.of("Bob", "", "extra")));

        assertEquals("Name,City\nAlice,NYC\nBob,,extra", writer.write(table));
    }

    @Test
    void cellsContainingTheDelimiterAreNotQuoted() {
        Table table = new Table(List.of("Note"), List.of(List.of("a,b")));

        assertEquals("Note\na,b", writer.write(table));
    }

    @Test
    void emptyTableWritesEmptyText() {
        assertEquals("", writer.write(Table.empty()));
    }

    @Test
    void headerOnlyTableWritesSingleLine() {
        assertEquals("a,b", writer.write(new Table(List.of("a", "b"), List.of())));
    }

    @Test
    void parsedTextSurvivesWriteThenRead() {
        DelimitedTableReader reader = new DelimitedTableReader(Delimiter.COMMA);
        String text = "id,name\n1,Alice\n2,Bob";

        assertEquals(text, writer.write(reader.read(text)));
    }
}
