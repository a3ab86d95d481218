package com.nana.results.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;

/**
 * ValidationException - Service Layer Checked Exception
 *
 * <p>Raised when a configuration object handed to the engine cannot be
 * used as given: an empty or all-zero credit table, a credit weight
 * outside 0-4, a section rule without a name. All problems found in one
 * pass are collected into a {@code Map<String, String>} of key to message,
 * so the caller can report every offending subject code or section at
 * once.
 *
 * <p>The condition is recoverable: {@link ResultEngineImpl} catches it,
 * turns each entry into a warning on the {@link EngineResult} and carries
 * on without the affected feature.
 *
 * <p>KEY CONVENTION:
 * Keys name the offending item: {@code "credits"} for table-level
 * problems, {@code "credits.<CODE>"} for one subject's weight,
 * {@code "sections.<index>"} for a range rule. Configuration files add
 * line-numbered keys ({@code "sections.<line>"}, {@code "mapping.<line>"},
 * {@code "credits.<line>"}).
 */
public class ValidationException extends Exception {

    /** Key to message, in detection order. */
    private final Map<String, String> fieldErrors;

    // -----------------------------------------------------------------------
    // CONSTRUCTORS
    // -----------------------------------------------------------------------

    /**
     * @param fieldErrors key to message; must not be null
     */
    public ValidationException(Map<String, String> fieldErrors) {
        super(buildMessage(fieldErrors));
        this.fieldErrors = Collections.unmodifiableMap(new LinkedHashMap<>(fieldErrors));
    }

    /**
     * Single-problem convenience constructor.
     *
     * @param fieldName    key of the invalid item
     * @param errorMessage human-readable description
     */
    public ValidationException(String fieldName, String errorMessage) {
        super(fieldName + ": " + errorMessage);
        Map<String, String> map = new LinkedHashMap<>();
        map.put(fieldName, errorMessage);
        this.fieldErrors = Collections.unmodifiableMap(map);
    }

    // -----------------------------------------------------------------------
    // ACCESSORS
    // -----------------------------------------------------------------------

    /** @return unmodifiable key to message map */
    public Map<String, String> getFieldErrors() {
        return fieldErrors;
    }

    public boolean hasError(String fieldName) {
        return fieldErrors.containsKey(fieldName);
    }

    /**
     * @param fieldName key to look up
     * @return message for that key, or null
     */
    public String getError(String fieldName) {
        return fieldErrors.get(fieldName);
    }

    // -----------------------------------------------------------------------
    // PRIVATE HELPERS
    // -----------------------------------------------------------------------

    private static String buildMessage(Map<String, String> errors) {
        if (errors == null || errors.isEmpty()) {
            return "Invalid configuration.";
        }
        StringJoiner joined = new StringJoiner("; ",
                "Invalid configuration (" + errors.size() + " problem(s)): ", "");
        errors.forEach((key, msg) -> joined.add(key + ": " + msg));
        return joined.toString();
    }
}
