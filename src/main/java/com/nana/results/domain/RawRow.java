package com.nana.results.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * RawRow - One Undecoded Mark Sheet Row
 *
 * <p>Maps column name to raw cell value exactly as the reader produced it.
 * The row index is the 0-based position of the row in its {@link Dataset}
 * after fully blank rows were dropped; it is the tie-breaker wherever the
 * engine needs "original row order".
 */
public final class RawRow {

    private final int index;
    private final Map<String, Object> cells;

    /**
     * @param index 0-based row position in the dataset
     * @param cells column name to raw value; copied, null values allowed
     */
    public RawRow(int index, Map<String, Object> cells) {
        this.index = index;
        this.cells = Collections.unmodifiableMap(new LinkedHashMap<>(cells));
    }

    /** @return 0-based row position */
    public int getIndex() {
        return index;
    }

    /**
     * @param column column name
     * @return raw cell value, or null if the column is missing or blank
     */
    public Object get(String column) {
        return column == null ? null : cells.get(column);
    }

    /** @return unmodifiable column-to-value view */
    public Map<String, Object> getCells() {
        return cells;
    }

    /** @return true if every cell is blank */
    public boolean isBlank() {
        return cells.values().stream().allMatch(CellValues::isBlank);
    }

    @Override
    public String toString() {
        return "RawRow{index=" + index + ", cells=" + cells.size() + "}";
    }
}
