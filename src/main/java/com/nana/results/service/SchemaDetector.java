package com.nana.results.service;

import com.nana.results.domain.CellValues;
import com.nana.results.domain.Dataset;
import com.nana.results.domain.SubjectColumn;
import com.nana.results.domain.SubjectSchema;
import com.nana.results.domain.SubjectSuffix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * SchemaDetector - Subject Column Inference
 *
 * <p>Mark sheets arrive with free-form flattened headers such as
 * {@code "CS301 Internal"}, {@code "CS301 Total"} or {@code "Grand Total"}.
 * Detection runs in two passes:
 *
 * <ol>
 *   <li><b>Parse</b> - split each header on its last whitespace run. If the
 *       trailing token is a {@link SubjectSuffix} (any case) the prefix
 *       becomes a candidate subject code.</li>
 *   <li><b>Filter</b> - keep a candidate only when
 *       {@link #isRealSubject(Map, Dataset)} holds.</li>
 * </ol>
 *
 * <p>Headers without a recognised suffix are ignored outright. Candidates
 * rejected by the filter are logged at DEBUG.
 */
public class SchemaDetector {

    private static final Logger log = LoggerFactory.getLogger(SchemaDetector.class);

    /** Typical course code: letters, then digits, then an optional letter. */
    private static final Pattern CODE_SHAPE = Pattern.compile("[A-Za-z]+\\d+[A-Za-z]?");

    private static final Pattern CONTAINS_DIGIT = Pattern.compile(".*\\d.*");

    private static final Pattern LAST_WHITESPACE = Pattern.compile("\\s+(?=\\S+$)");

    /**
     * Detects the subject schema of a dataset.
     *
     * @param dataset decoded mark sheet
     * @return the schema; empty when no column group qualifies
     */
    public SubjectSchema detect(Dataset dataset) {
        Map<String, Map<SubjectSuffix, SubjectColumn>> candidates = parse(dataset.getColumns());

        List<SubjectColumn> kept = new ArrayList<>();
        for (Map.Entry<String, Map<SubjectSuffix, SubjectColumn>> entry : candidates.entrySet()) {
            if (isRealSubject(entry.getValue(), dataset)) {
                kept.addAll(entry.getValue().values());
            } else {
                log.debug("Column group '{}' rejected as a subject.", entry.getKey());
            }
        }
        SubjectSchema schema = SubjectSchema.of(kept);
        log.info("Detected {} subject(s) in '{}': {}",
                schema.getSubjectCount(), dataset.getName(), schema.getCodes());
        return schema;
    }

    // -----------------------------------------------------------------------
    // PASS 1: PARSE
    // -----------------------------------------------------------------------

    /**
     * Groups headers by candidate code. The first header for a given code
     * and role wins.
     *
     * @param columns headers in sheet order
     * @return candidate code to role map, in first-seen order
     */
    public Map<String, Map<SubjectSuffix, SubjectColumn>> parse(List<String> columns) {
        Map<String, Map<SubjectSuffix, SubjectColumn>> candidates = new LinkedHashMap<>();
        for (String column : columns) {
            SubjectColumn parsed = parseHeader(column);
            if (parsed != null) {
                candidates.computeIfAbsent(parsed.getCode(), c -> new EnumMap<>(SubjectSuffix.class))
                          .putIfAbsent(parsed.getSuffix(), parsed);
            }
        }
        return candidates;
    }

    /**
     * Parses one header.
     *
     * @param column header text
     * @return the subject column, or null if the header has no recognised
     *         suffix or no prefix
     */
    public SubjectColumn parseHeader(String column) {
        if (column == null) {
            return null;
        }
        String trimmed = column.trim();
        String[] parts = LAST_WHITESPACE.split(trimmed, 2);
        if (parts.length != 2) {
            return null;
        }
        SubjectSuffix suffix = SubjectSuffix.fromToken(parts[1]);
        String code = parts[0].trim();
        if (suffix == null || code.isEmpty()) {
            return null;
        }
        return new SubjectColumn(code, suffix, column);
    }

    // -----------------------------------------------------------------------
    // PASS 2: FILTER
    // -----------------------------------------------------------------------

    /**
     * Decides whether a candidate column group is a real subject.
     *
     * <p>All of the following must hold:
     * <ul>
     *   <li>a Total column exists,</li>
     *   <li>it holds at least one numeric value and the maximum is above 0,</li>
     *   <li>an Internal or External sibling exists, or the code contains a
     *       digit or looks like a course code.</li>
     * </ul>
     *
     * @param roles   role to column for the candidate
     * @param dataset the sheet, for the Total column's values
     * @return true to keep the candidate
     */
    public boolean isRealSubject(Map<SubjectSuffix, SubjectColumn> roles, Dataset dataset) {
        SubjectColumn total = roles.get(SubjectSuffix.TOTAL);
        if (total == null) {
            return false;
        }
        if (!hasPositiveNumericValue(dataset.columnValues(total.getColumnName()))) {
            return false;
        }
        boolean hasSibling = roles.containsKey(SubjectSuffix.INTERNAL)
                             || roles.containsKey(SubjectSuffix.EXTERNAL);
        return hasSibling || looksLikeCode(total.getCode());
    }

    static boolean hasPositiveNumericValue(List<Object> values) {
        double max = Double.NEGATIVE_INFINITY;
        boolean anyNumeric = false;
        for (Object value : values) {
            if (CellValues.isNumeric(value)) {
                anyNumeric = true;
                max = Math.max(max, CellValues.toNumber(value));
            }
        }
        return anyNumeric && max > 0;
    }

    static boolean looksLikeCode(String code) {
        return CONTAINS_DIGIT.matcher(code).matches() || CODE_SHAPE.matcher(code).matches();
    }
}
