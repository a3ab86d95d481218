package com.nana.results.service;

import com.nana.results.domain.Category;
import com.nana.results.domain.OverallResult;
import com.nana.results.domain.SubjectMarks;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;

/**
 * MetricsCalculator - Totals, Percentage and VTU Category
 *
 * <p>A subject counts as attempted when its Total is above 0; only
 * attempted subjects contribute to the percentage denominator (100 marks
 * each). Category thresholds apply to passing students only.
 */
public class MetricsCalculator {

    /** Lower bound of First Class with Distinction, in percent. */
    public static final double FCD_THRESHOLD = 70.0;

    /** Lower bound of First Class, in percent. */
    public static final double FC_THRESHOLD = 60.0;

    /** Lower bound of Second Class, in percent. */
    public static final double SC_THRESHOLD = 50.0;

    /** Full marks of one subject. */
    public static final double MARKS_PER_SUBJECT = 100.0;

    /**
     * Sums one student's marks.
     *
     * @param subjects marks of every schema subject
     * @return totals and percentage
     */
    public Metrics compute(Collection<SubjectMarks> subjects) {
        double total = 0.0;
        double internal = 0.0;
        double external = 0.0;
        int attempted = 0;
        for (SubjectMarks marks : subjects) {
            total += marks.totalOrZero();
            internal += marks.internalOrZero();
            external += marks.externalOrZero();
            if (marks.isAttempted()) {
                attempted++;
            }
        }
        return new Metrics(total, internal, external, attempted, percentage(total, attempted));
    }

    /**
     * @param totalMarks sum of Total marks
     * @param attempted  number of subjects with Total above 0
     * @return percentage rounded to two decimals; 0.0 when nothing was attempted
     */
    public static double percentage(double totalMarks, int attempted) {
        if (attempted <= 0) {
            return 0.0;
        }
        return round2(totalMarks / (attempted * MARKS_PER_SUBJECT) * 100.0);
    }

    /**
     * Places a student in a category.
     *
     * @param result     overall result
     * @param percentage rounded percentage
     * @return tier for passing students, otherwise FAILED or ABSENT
     */
    public Category categorize(OverallResult result, double percentage) {
        if (result != OverallResult.P) {
            return Category.forNonPassing(result);
        }
        if (percentage >= FCD_THRESHOLD) {
            return Category.FCD;
        }
        if (percentage >= FC_THRESHOLD) {
            return Category.FC;
        }
        if (percentage >= SC_THRESHOLD) {
            return Category.SC;
        }
        return Category.PASS_CLASS;
    }

    /**
     * Rounds to two decimals, half-even, via the decimal form of the value.
     *
     * @param value value to round
     * @return rounded value
     */
    public static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
    }

    // -----------------------------------------------------------------------
    // RESULT VALUE OBJECT
    // -----------------------------------------------------------------------

    /** Totals of one student. */
    public static final class Metrics {

        private final double totalMarks;
        private final double totalInternal;
        private final double totalExternal;
        private final int attemptedSubjectCount;
        private final double percentage;

        public Metrics(double totalMarks, double totalInternal, double totalExternal,
                       int attemptedSubjectCount, double percentage) {
            this.totalMarks            = totalMarks;
            this.totalInternal         = totalInternal;
            this.totalExternal         = totalExternal;
            this.attemptedSubjectCount = attemptedSubjectCount;
            this.percentage            = percentage;
        }

        public double getTotalMarks()          { return totalMarks; }

        public double getTotalInternal()       { return totalInternal; }

        public double getTotalExternal()       { return totalExternal; }

        public int getAttemptedSubjectCount()  { return attemptedSubjectCount; }

        public double getPercentage()          { return percentage; }
    }
}
