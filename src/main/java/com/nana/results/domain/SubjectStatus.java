package com.nana.results.domain;

/**
 * SubjectStatus - Per-Subject Classification
 *
 * <p>The outcome of a single subject for a single student, as decided by
 * {@link com.nana.results.service.ResultClassifier#classifySubject(SubjectMarks)}.
 */
public enum SubjectStatus {

    /** Student cleared the subject. */
    PASS("P"),

    /** Student attempted the subject and did not clear it. */
    FAIL("F"),

    /** Student did not sit the external examination. */
    ABSENT("A");

    private final String code;

    SubjectStatus(String code) {
        this.code = code;
    }

    /** @return the one-letter result code (P, F or A) */
    public String getCode() {
        return code;
    }
}
