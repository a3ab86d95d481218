package com.nana.results.domain;

/**
 * Category - VTU Performance Tier
 *
 * <p>Passing students are placed in one of four tiers by percentage.
 * Students who did not pass carry their result code instead
 * ({@link #FAILED} for F, {@link #ABSENT} for A).
 *
 * <p>Each constant also names the worksheet it is exported to by
 * {@link com.nana.results.util.CategoryWorkbookExporter}.
 */
public enum Category {

    /** First Class with Distinction: 70% and above. */
    FCD("FCD", "FCD"),

    /** First Class: 60% up to 70%. */
    FC("FC", "First Class"),

    /** Second Class: 50% up to 60%. */
    SC("SC", "Second Class"),

    /** Pass Class: below 50%. */
    PASS_CLASS("Pass Class", "Pass Class"),

    /** Overall result F. */
    FAILED("F", "Failed"),

    /** Overall result A. */
    ABSENT("A", "Absent");

    // -----------------------------------------------------------------------
    // FIELDS
    // -----------------------------------------------------------------------

    /** Short label used in records and CSV exports. */
    private final String label;

    /** Worksheet title used by the category workbook export. */
    private final String sheetName;

    Category(String label, String sheetName) {
        this.label     = label;
        this.sheetName = sheetName;
    }

    // -----------------------------------------------------------------------
    // ACCESSORS
    // -----------------------------------------------------------------------

    /** @return short label (e.g., "FCD", "Pass Class", "F") */
    public String getLabel() {
        return label;
    }

    /** @return worksheet title (e.g., "First Class") */
    public String getSheetName() {
        return sheetName;
    }

    /** @return true for the four tiers awarded to passing students */
    public boolean isPassingTier() {
        return this != FAILED && this != ABSENT;
    }

    /**
     * Returns the category a non-passing student keeps.
     *
     * @param result overall result F or A
     * @return {@link #FAILED} or {@link #ABSENT}
     * @throws IllegalArgumentException if {@code result} is P
     */
    public static Category forNonPassing(OverallResult result) {
        return switch (result) {
            case F -> FAILED;
            case A -> ABSENT;
            case P -> throw new IllegalArgumentException(
                    "Passing students are categorised by percentage.");
        };
    }

    @Override
    public String toString() {
        return label;
    }
}
