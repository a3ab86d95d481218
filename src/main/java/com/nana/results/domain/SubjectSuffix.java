package com.nana.results.domain;

/**
 * SubjectSuffix - Column Role Enumeration
 *
 * <p>A mark sheet groups the columns of each subject under four roles. The
 * role is the last whitespace-separated token of a flattened column header,
 * for example {@code "CS301 Internal"} or {@code "CS301 Result"}.
 */
public enum SubjectSuffix {

    /** Continuous-assessment marks awarded by the institution. */
    INTERNAL("Internal"),

    /** Marks awarded in the end-of-term examination. */
    EXTERNAL("External"),

    /** Combined subject marks. */
    TOTAL("Total"),

    /** Textual subject result as printed on the sheet (P, F, A, ...). */
    RESULT("Result");

    // -----------------------------------------------------------------------
    // FIELDS
    // -----------------------------------------------------------------------

    /** Header token exactly as it appears on published mark sheets. */
    private final String headerToken;

    SubjectSuffix(String headerToken) {
        this.headerToken = headerToken;
    }

    // -----------------------------------------------------------------------
    // ACCESSORS
    // -----------------------------------------------------------------------

    /**
     * Returns the header token for this role.
     *
     * @return header token (e.g., "Internal")
     */
    public String getHeaderToken() {
        return headerToken;
    }

    /**
     * Resolves a header token to its role, ignoring case and surrounding
     * whitespace.
     *
     * <p>Unlike {@link Enum#valueOf(Class, String)} this never throws: an
     * unrecognised token simply means the column is not a subject column.
     *
     * @param token the trailing token of a column header
     * @return the matching suffix, or {@code null} if the token is not a role
     */
    public static SubjectSuffix fromToken(String token) {
        if (token == null || token.isBlank()) {
            return null;
        }
        String trimmed = token.trim();
        for (SubjectSuffix suffix : values()) {
            if (suffix.headerToken.equalsIgnoreCase(trimmed)) {
                return suffix;
            }
        }
        return null;
    }

    /**
     * Builds the column header for a subject code and this role.
     *
     * @param code subject code (e.g., "CS301")
     * @return header string (e.g., "CS301 Total")
     */
    public String headerFor(String code) {
        return code + " " + headerToken;
    }

    @Override
    public String toString() {
        return headerToken;
    }
}
