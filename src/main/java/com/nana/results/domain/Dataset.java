package com.nana.results.domain;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

/**
 * Dataset - Immutable Mark Sheet Snapshot
 *
 * <p>A decoded mark sheet: ordered column names plus the rows beneath them.
 * The first column is the student identifier; a column named {@code Name}
 * (any case) holds the student name when present.
 *
 * <p>CONSTRUCTION RULES:
 * <ul>
 *   <li>Rows whose cells are all blank are dropped and the survivors are
 *       re-indexed from 0.</li>
 *   <li>The content hash is SHA-256 over column names and the text form of
 *       every cell. The display name does not take part, so the same sheet
 *       uploaded under two names hashes identically.</li>
 * </ul>
 *
 * <p>Instances are never mutated; a new upload produces a new snapshot.
 */
public final class Dataset {

    /** Header of the name column, matched case-insensitively. */
    public static final String NAME_COLUMN = "Name";

    private static final char UNIT_SEPARATOR  = '\u001F';
    private static final char RECORD_SEPARATOR = '\u001E';

    private final String name;
    private final List<String> columns;
    private final List<RawRow> rows;
    private final String contentHash;

    private Dataset(String name, List<String> columns, List<RawRow> rows) {
        this.name        = name == null ? "" : name.trim();
        this.columns     = Collections.unmodifiableList(new ArrayList<>(columns));
        this.rows        = Collections.unmodifiableList(new ArrayList<>(rows));
        this.contentHash = computeHash(this.columns, this.rows);
    }

    /**
     * Builds a dataset from decoded rows.
     *
     * @param name    display name (file or branch name); may be blank
     * @param columns ordered column names; must not be null
     * @param rows    one column-to-value map per data row, in sheet order
     * @return the snapshot
     */
    public static Dataset of(String name,
                             List<String> columns,
                             List<? extends Map<String, Object>> rows) {
        if (columns == null) {
            throw new IllegalArgumentException("Column list must not be null.");
        }
        List<RawRow> kept = new ArrayList<>();
        if (rows != null) {
            for (Map<String, Object> cells : rows) {
                RawRow candidate = new RawRow(kept.size(), cells);
                if (!candidate.isBlank()) {
                    kept.add(candidate);
                }
            }
        }
        return new Dataset(name, columns, kept);
    }

    // -----------------------------------------------------------------------
    // ACCESSORS
    // -----------------------------------------------------------------------

    public String getName()           { return name; }

    public List<String> getColumns()  { return columns; }

    public List<RawRow> getRows()     { return rows; }

    public int getRowCount()          { return rows.size(); }

    public boolean isEmpty()          { return rows.isEmpty(); }

    /** @return hex SHA-256 of the sheet content */
    public String getContentHash()    { return contentHash; }

    /**
     * Returns the identifier column, which is always the first column.
     *
     * @return first column name, or null for a dataset without columns
     */
    public String getIdColumn() {
        return columns.isEmpty() ? null : columns.get(0);
    }

    /**
     * Returns the name column if the sheet has one.
     *
     * @return the column whose header equals "Name" ignoring case, or null
     */
    public String getNameColumn() {
        for (String column : columns) {
            if (column != null && column.trim().equalsIgnoreCase(NAME_COLUMN)) {
                return column;
            }
        }
        return null;
    }

    /**
     * Returns the student identifier of a row as text.
     *
     * @param row a row of this dataset
     * @return identifier text (empty if blank)
     */
    public String studentIdOf(RawRow row) {
        return CellValues.toText(row.get(getIdColumn()));
    }

    /**
     * Returns the student name of a row, or an empty string when the sheet
     * has no name column.
     *
     * @param row a row of this dataset
     * @return name text
     */
    public String studentNameOf(RawRow row) {
        String nameColumn = getNameColumn();
        return nameColumn == null ? "" : CellValues.toText(row.get(nameColumn));
    }

    /**
     * Returns every raw value in a column, in row order.
     *
     * @param column column name
     * @return list of raw values (null entries for blank cells)
     */
    public List<Object> columnValues(String column) {
        List<Object> values = new ArrayList<>(rows.size());
        for (RawRow row : rows) {
            values.add(row.get(column));
        }
        return values;
    }

    // -----------------------------------------------------------------------
    // HASHING
    // -----------------------------------------------------------------------

    private static String computeHash(List<String> columns, List<RawRow> rows) {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException ex) {
            // Every JDK ships SHA-256.
            throw new IllegalStateException("SHA-256 digest unavailable.", ex);
        }
        StringBuilder sb = new StringBuilder();
        for (String column : columns) {
            sb.append(column).append(UNIT_SEPARATOR);
        }
        sb.append(RECORD_SEPARATOR);
        digest.update(sb.toString().getBytes(StandardCharsets.UTF_8));

        for (RawRow row : rows) {
            sb.setLength(0);
            for (String column : columns) {
                sb.append(CellValues.toText(row.get(column))).append(UNIT_SEPARATOR);
            }
            sb.append(RECORD_SEPARATOR);
            digest.update(sb.toString().getBytes(StandardCharsets.UTF_8));
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    @Override
    public String toString() {
        return "Dataset{name='" + name + "', columns=" + columns.size()
               + ", rows=" + rows.size() + ", hash=" + contentHash.substring(0, 12) + "}";
    }
}
