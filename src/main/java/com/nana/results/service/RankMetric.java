package com.nana.results.service;

import com.nana.results.domain.SgpaResult;
import com.nana.results.domain.StudentRecord;

import java.util.Locale;
import java.util.function.ToDoubleFunction;

/**
 * RankMetric - Value Students Are Ranked By
 *
 * <p>{@link #SGPA} also switches ranking to SGPA mode, in which a student
 * is eligible when their SGPA result is Pass rather than their overall
 * result.
 */
public enum RankMetric {

    TOTAL_MARKS("Total Marks", StudentRecord::getTotalMarks),

    TOTAL_INTERNAL("Total Internal", StudentRecord::getTotalInternal),

    TOTAL_EXTERNAL("Total External", StudentRecord::getTotalExternal),

    SGPA("SGPA", r -> r.getSgpa() == null ? 0.0 : r.getSgpa());

    private final String displayName;
    private final ToDoubleFunction<StudentRecord> extractor;

    RankMetric(String displayName, ToDoubleFunction<StudentRecord> extractor) {
        this.displayName = displayName;
        this.extractor   = extractor;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * @param record a student record
     * @return the metric value (0 for a missing SGPA)
     */
    public double extract(StudentRecord record) {
        return extractor.applyAsDouble(record);
    }

    /**
     * Returns true if the record is eligible for a rank under this metric.
     *
     * @param record a student record
     * @return overall P in marks mode; SGPA result Pass in SGPA mode
     */
    public boolean isPassing(StudentRecord record) {
        if (this == SGPA) {
            return record.getSgpaResult() == SgpaResult.PASS;
        }
        return record.isPassed();
    }

    /**
     * Parses a metric name, ignoring case and treating '-' and ' ' as '_'.
     *
     * @param text metric name (e.g., "total-marks", "SGPA")
     * @return the metric
     * @throws IllegalArgumentException for unknown names
     */
    public static RankMetric parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Rank metric must not be blank.");
        }
        String normalized = text.trim().replace('-', '_').replace(' ', '_').toUpperCase(Locale.ROOT);
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown rank metric '" + text
                    + "'. Expected one of TOTAL_MARKS, TOTAL_INTERNAL, TOTAL_EXTERNAL, SGPA.", ex);
        }
    }

    @Override
    public String toString() {
        return displayName;
    }
}
