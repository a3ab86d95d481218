package com.nana.results.util;

import com.nana.results.domain.CellValues;
import com.nana.results.domain.StudentRecord;

import java.util.Locale;
import java.util.function.Function;

/**
 * CsvColumn - Exportable StudentRecord Fields
 *
 * <p>Each constant pairs a CSV header with an extractor. Exports pick an
 * ordered subset, so adding a column here needs no change in
 * {@link CsvExporter}. Optional fields (SGPA, ranks) export as empty cells
 * when unset.
 */
public enum CsvColumn {

    STUDENT_ID("Student ID", StudentRecord::getStudentId),

    NAME("Name", StudentRecord::getName),

    SECTION("Section", StudentRecord::getSection),

    TOTAL_MARKS("Total Marks", r -> number(r.getTotalMarks())),

    TOTAL_INTERNAL("Total Internal", r -> number(r.getTotalInternal())),

    TOTAL_EXTERNAL("Total External", r -> number(r.getTotalExternal())),

    PERCENTAGE("Percentage", r -> twoDecimals(r.getPercentage())),

    OVERALL_RESULT("Overall Result", r -> r.getOverallResult().name()),

    CATEGORY("Category", r -> r.getCategory().getLabel()),

    FAILED_SUBJECT_COUNT("Failed Subjects Count", r -> String.valueOf(r.getFailedSubjectCount())),

    ABSENT_SUBJECT_COUNT("Absent Subjects Count", r -> String.valueOf(r.getAbsentSubjectCount())),

    FAILED_SUBJECTS("Failed Subjects", r -> String.join(", ", r.getFailedSubjectNames())),

    SGPA("SGPA", r -> r.getSgpa() == null ? "" : twoDecimals(r.getSgpa())),

    SGPA_RESULT("SGPA Result", r -> r.getSgpaResult() == null ? "" : r.getSgpaResult().getDisplayName()),

    CLASS_RANK("Class Rank", r -> r.getClassRank() == null ? "" : String.valueOf(r.getClassRank())),

    SECTION_RANK("Section Rank", r -> r.getSectionRank() == null ? "" : String.valueOf(r.getSectionRank()));

    private final String headerName;
    private final Function<StudentRecord, String> extractor;

    CsvColumn(String headerName, Function<StudentRecord, String> extractor) {
        this.headerName = headerName;
        this.extractor  = extractor;
    }

    public String getHeaderName() {
        return headerName;
    }

    /**
     * @param record a record; null yields an empty string
     * @return the field as text, never null
     */
    public String extract(StudentRecord record) {
        if (record == null) return "";
        String value = extractor.apply(record);
        return value == null ? "" : value;
    }

    @Override
    public String toString() {
        return headerName;
    }

    // -----------------------------------------------------------------------
    // STATIC HELPERS
    // -----------------------------------------------------------------------

    /** @return every column, in declaration order */
    public static CsvColumn[] defaultColumns() {
        return values();
    }

    /** @return the columns of the ranked listing */
    public static CsvColumn[] rankingColumns() {
        return new CsvColumn[] {
            CLASS_RANK,
            SECTION_RANK,
            STUDENT_ID,
            NAME,
            SECTION,
            TOTAL_MARKS,
            PERCENTAGE,
            SGPA,
            OVERALL_RESULT,
            CATEGORY
        };
    }

    private static String number(double value) {
        return CellValues.toText(value);
    }

    private static String twoDecimals(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
