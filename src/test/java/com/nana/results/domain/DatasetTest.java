package com.nana.results.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DatasetTest {

    private static Map<String, Object> row(Object... kv) {
        Map<String, Object> m = new HashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            m.put((String) kv[i], kv[i + 1]);
        }
        return m;
    }

    @Test
    @DisplayName("first column is the id, Name column is found case-insensitively")
    void idAndNameColumns() {
        Dataset dataset = Dataset.of("cse", List.of("USN", "name", "CS301 Total"),
                List.of(row("USN", "1XX22CS001", "name", "Asha", "CS301 Total", 80)));

        assertEquals("USN", dataset.getIdColumn());
        assertEquals("name", dataset.getNameColumn());
        assertEquals("1XX22CS001", dataset.studentIdOf(dataset.getRows().get(0)));
        assertEquals("Asha", dataset.studentNameOf(dataset.getRows().get(0)));
    }

    @Test
    @DisplayName("blank rows are dropped and the rest renumbered")
    void blankRowsDropped() {
        Dataset dataset = Dataset.of("cse", List.of("USN", "CS301 Total"), List.of(
                row("USN", "1", "CS301 Total", 50),
                row("USN", "", "CS301 Total", null),
                row("USN", "2", "CS301 Total", 60)));

        assertEquals(2, dataset.getRowCount());
        assertEquals(1, dataset.getRows().get(1).getIndex());
    }

    @Test
    @DisplayName("content hash depends on content, not on the name")
    void contentHash() {
        List<Map<String, Object>> rows = List.of(row("USN", "1", "CS301 Total", 50));
        Dataset a = Dataset.of("a", List.of("USN", "CS301 Total"), rows);
        Dataset b = Dataset.of("b", List.of("USN", "CS301 Total"), rows);
        Dataset c = Dataset.of("a", List.of("USN", "CS301 Total"), List.of(row("USN", "1", "CS301 Total", 51)));

        assertEquals(a.getContentHash(), b.getContentHash());
        assertNotEquals(a.getContentHash(), c.getContentHash());
    }

    @Test
    @DisplayName("a sheet without a Name column yields empty names")
    void noNameColumn() {
        Dataset dataset = Dataset.of("cse", List.of("USN"), List.of(row("USN", "1")));

        assertNull(dataset.getNameColumn());
        assertEquals("", dataset.studentNameOf(dataset.getRows().get(0)));
    }
}
