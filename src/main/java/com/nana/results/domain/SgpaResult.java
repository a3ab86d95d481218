package com.nana.results.domain;

/**
 * SgpaResult - Pass/Fail Label Reported in SGPA Mode
 */
public enum SgpaResult {

    PASS("Pass"),
    FAIL("Fail"),
    ABSENT("Absent");

    private final String displayName;

    SgpaResult(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Maps a marks-mode overall result onto its SGPA-mode label.
     *
     * @param result the overall result; must not be null
     * @return the mirrored SGPA label
     */
    public static SgpaResult mirrorOf(OverallResult result) {
        return switch (result) {
            case P -> PASS;
            case F -> FAIL;
            case A -> ABSENT;
        };
    }

    @Override
    public String toString() {
        return displayName;
    }
}
