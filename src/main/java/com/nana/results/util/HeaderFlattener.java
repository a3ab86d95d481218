package com.nana.results.util;

import com.nana.results.domain.Dataset;
import com.nana.results.domain.SubjectSuffix;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * HeaderFlattener - Two-Row Mark Sheet Header to Column Names
 *
 * <p>Mark sheets group each subject's columns under a merged label:
 * <pre>
 *   USN  | Name | CS301    |          |       |        | CS302 ...
 *        |      | Internal | External | Total | Result | Internal ...
 * </pre>
 * Flattening rules, per column:
 * <ul>
 *   <li>a blank group cell inherits the nearest group label to its left,
 *       but only under a non-blank sub-header cell;</li>
 *   <li>a group label of {@code name} (any case) becomes {@code Name};</li>
 *   <li>the result is {@code "<group> <sub>"} when the sub-header is
 *       present, else the group label alone;</li>
 *   <li>a column whose result is empty is dropped (its position maps to
 *       null).</li>
 * </ul>
 * Duplicate results get a {@code " (2)"}, {@code " (3)"}... suffix.
 */
public final class HeaderFlattener {

    private HeaderFlattener() {
        throw new UnsupportedOperationException("HeaderFlattener is a static utility class.");
    }

    /**
     * Flattens a two-row header.
     *
     * @param groupRow first header row
     * @param subRow   second header row
     * @return one name per column position; null where a column is dropped
     */
    public static List<String> flatten(List<String> groupRow, List<String> subRow) {
        int width = Math.max(groupRow.size(), subRow.size());
        List<String> names = new ArrayList<>(width);
        Set<String> seen = new HashSet<>();
        String lastGroup = "";
        for (int i = 0; i < width; i++) {
            String group = normalizeGroup(cell(groupRow, i));
            String sub = cell(subRow, i);
            if (!group.isEmpty()) {
                lastGroup = group;
            } else if (!sub.isEmpty()) {
                group = lastGroup;
            }
            String name;
            if (group.isEmpty()) {
                name = sub;
            } else if (sub.isEmpty()) {
                name = group;
            } else {
                name = group + " " + sub;
            }
            names.add(name.isEmpty() ? null : unique(name, seen));
        }
        return names;
    }

    /**
     * Cleans a single-row header: trims names, drops empty ones, and
     * de-duplicates.
     *
     * @param headerRow the header row
     * @return one name per column position; null where a column is dropped
     */
    public static List<String> single(List<String> headerRow) {
        List<String> names = new ArrayList<>(headerRow.size());
        Set<String> seen = new HashSet<>();
        for (String raw : headerRow) {
            String name = raw == null ? "" : raw.trim();
            names.add(name.isEmpty() ? null : unique(name, seen));
        }
        return names;
    }

    /**
     * Returns true if a row looks like the sub-header of a two-row header:
     * at least one cell is a subject role token (Internal, External, Total
     * or Result).
     *
     * @param row candidate row
     * @return true for a sub-header row
     */
    public static boolean isSubHeader(List<String> row) {
        for (String value : row) {
            if (SubjectSuffix.fromToken(value) != null) {
                return true;
            }
        }
        return false;
    }

    private static String normalizeGroup(String group) {
        return group.equalsIgnoreCase(Dataset.NAME_COLUMN) ? Dataset.NAME_COLUMN : group;
    }

    private static String cell(List<String> row, int index) {
        if (index >= row.size() || row.get(index) == null) {
            return "";
        }
        return row.get(index).trim();
    }

    private static String unique(String name, Set<String> seen) {
        String candidate = name;
        int n = 2;
        while (!seen.add(candidate)) {
            candidate = name + " (" + n++ + ")";
        }
        return candidate;
    }
}
