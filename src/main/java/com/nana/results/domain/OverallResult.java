package com.nana.results.domain;

/**
 * OverallResult - Aggregate Student Result
 *
 * <p>Folded from all subject statuses of one student:
 * <ul>
 *   <li>{@code P} - every subject passed, or the student had no subjects;</li>
 *   <li>{@code A} - every subject was Absent;</li>
 *   <li>{@code F} - anything else (at least one Fail, or an Absent mixed
 *       with attempted subjects).</li>
 * </ul>
 */
public enum OverallResult {

    P("Pass"),
    F("Fail"),
    A("Absent");

    private final String displayName;

    OverallResult(String displayName) {
        this.displayName = displayName;
    }

    /** @return human-readable label (e.g., "Pass") */
    public String getDisplayName() {
        return displayName;
    }

    /** @return true for {@link #P} */
    public boolean isPass() {
        return this == P;
    }
}
