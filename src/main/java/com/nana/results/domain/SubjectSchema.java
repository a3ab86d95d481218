package com.nana.results.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * SubjectSchema - Detected Subject Layout of a Mark Sheet
 *
 * <p>Output of {@link com.nana.results.service.SchemaDetector}: the sorted
 * list of subject codes and, per code, which column plays which
 * {@link SubjectSuffix} role. A code may lack some roles (a sheet without
 * Result columns, for example); lookups for a missing role return null.
 */
public final class SubjectSchema {

    private static final SubjectSchema EMPTY = new SubjectSchema(Collections.emptyMap());

    private final List<String> codes;
    private final Map<String, Map<SubjectSuffix, SubjectColumn>> columnsByCode;

    private SubjectSchema(Map<String, Map<SubjectSuffix, SubjectColumn>> columnsByCode) {
        Map<String, Map<SubjectSuffix, SubjectColumn>> sorted = new TreeMap<>();
        columnsByCode.forEach((code, roles) ->
                sorted.put(code, Collections.unmodifiableMap(new EnumMap<>(roles))));
        this.columnsByCode = Collections.unmodifiableMap(new LinkedHashMap<>(sorted));
        this.codes = Collections.unmodifiableList(new ArrayList<>(sorted.keySet()));
    }

    /**
     * Builds a schema from a flat list of subject columns. When two columns
     * claim the same code and role, the first one wins.
     *
     * @param columns subject columns in header order
     * @return the schema
     */
    public static SubjectSchema of(List<SubjectColumn> columns) {
        Map<String, Map<SubjectSuffix, SubjectColumn>> byCode = new LinkedHashMap<>();
        for (SubjectColumn column : columns) {
            byCode.computeIfAbsent(column.getCode(), c -> new EnumMap<>(SubjectSuffix.class))
                  .putIfAbsent(column.getSuffix(), column);
        }
        return new SubjectSchema(byCode);
    }

    /** @return a schema with no subjects */
    public static SubjectSchema empty() {
        return EMPTY;
    }

    /** @return sorted subject codes */
    public List<String> getCodes() {
        return codes;
    }

    public int getSubjectCount() {
        return codes.size();
    }

    public boolean isEmpty() {
        return codes.isEmpty();
    }

    public boolean contains(String code) {
        return columnsByCode.containsKey(code);
    }

    /**
     * @param code   subject code
     * @param suffix column role
     * @return header of the column playing that role, or null
     */
    public String columnFor(String code, SubjectSuffix suffix) {
        Map<SubjectSuffix, SubjectColumn> roles = columnsByCode.get(code);
        if (roles == null) {
            return null;
        }
        SubjectColumn column = roles.get(suffix);
        return column == null ? null : column.getColumnName();
    }

    /**
     * @param code subject code
     * @return role-to-column map for the subject (empty if unknown)
     */
    public Map<SubjectSuffix, SubjectColumn> columnsOf(String code) {
        return columnsByCode.getOrDefault(code, Collections.emptyMap());
    }

    /** @return every subject column, grouped by code in code order */
    public List<SubjectColumn> allColumns() {
        List<SubjectColumn> all = new ArrayList<>();
        columnsByCode.values().forEach(roles -> all.addAll(roles.values()));
        return all;
    }

    @Override
    public String toString() {
        return "SubjectSchema{codes=" + codes + "}";
    }
}
