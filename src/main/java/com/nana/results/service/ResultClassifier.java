package com.nana.results.service;

import com.nana.results.domain.OverallResult;
import com.nana.results.domain.SubjectMarks;
import com.nana.results.domain.SubjectStatus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * ResultClassifier - Subject and Student Pass/Fail/Absent Rules
 *
 * <p>Two pure functions: {@link #classifySubject(SubjectMarks)} for one
 * subject, and {@link #aggregate(Map)} to reduce a student's statuses to an
 * {@link OverallResult}.
 *
 * <p>SUBJECT RULES (first match wins):
 * <ol>
 *   <li>Absent: External is 0 (or missing) and Result is {@code A},
 *       {@code ABSENT} or empty.</li>
 *   <li>Fail: Result is {@code F} or {@code FAIL}; or Result is empty,
 *       Internal/External marks exist and their sum is below
 *       {@link #PASS_MARK_FALLBACK}.</li>
 *   <li>Pass otherwise.</li>
 * </ol>
 */
public class ResultClassifier {

    /**
     * Combined Internal + External mark below which a subject without a
     * Result column is a fail. Unrelated to the category percentages.
     */
    public static final double PASS_MARK_FALLBACK = 35.0;

    private static final Set<String> ABSENT_CODES = Set.of("A", "ABSENT", "");

    private static final Set<String> FAIL_CODES = Set.of("F", "FAIL");

    /**
     * Classifies one subject.
     *
     * @param marks raw marks of the subject
     * @return the subject status
     */
    public SubjectStatus classifySubject(SubjectMarks marks) {
        String result = marks.getResultRaw();
        double external = marks.externalOrZero();

        if (external == 0.0 && ABSENT_CODES.contains(result)) {
            return SubjectStatus.ABSENT;
        }
        if (FAIL_CODES.contains(result)) {
            return SubjectStatus.FAIL;
        }
        if (result.isEmpty() && marks.hasMarks()
                && marks.internalOrZero() + external < PASS_MARK_FALLBACK) {
            return SubjectStatus.FAIL;
        }
        return SubjectStatus.PASS;
    }

    /**
     * Reduces per-subject statuses to the student's overall result and
     * tallies.
     *
     * <p>No subjects gives P; all Absent gives A; any Fail or Absent gives F;
     * otherwise P.
     *
     * @param statuses subject code to status, in schema order
     * @return the aggregate
     */
    public Classification aggregate(Map<String, SubjectStatus> statuses) {
        int failed = 0;
        int absent = 0;
        List<String> failedNames = new ArrayList<>();
        for (Map.Entry<String, SubjectStatus> entry : statuses.entrySet()) {
            switch (entry.getValue()) {
                case FAIL -> {
                    failed++;
                    failedNames.add(entry.getKey());
                }
                case ABSENT -> absent++;
                case PASS -> { }
            }
        }

        OverallResult overall;
        if (statuses.isEmpty()) {
            overall = OverallResult.P;
        } else if (absent == statuses.size()) {
            overall = OverallResult.A;
        } else if (failed > 0 || absent > 0) {
            overall = OverallResult.F;
        } else {
            overall = OverallResult.P;
        }
        return new Classification(overall, failed, absent, failedNames);
    }

    // -----------------------------------------------------------------------
    // RESULT VALUE OBJECT
    // -----------------------------------------------------------------------

    /**
     * Aggregate outcome of one student.
     */
    public static final class Classification {

        private final OverallResult overallResult;
        private final int failedSubjectCount;
        private final int absentSubjectCount;
        private final List<String> failedSubjectNames;

        public Classification(OverallResult overallResult,
                              int failedSubjectCount,
                              int absentSubjectCount,
                              List<String> failedSubjectNames) {
            this.overallResult      = overallResult;
            this.failedSubjectCount = failedSubjectCount;
            this.absentSubjectCount = absentSubjectCount;
            this.failedSubjectNames = Collections.unmodifiableList(new ArrayList<>(failedSubjectNames));
        }

        public OverallResult getOverallResult()    { return overallResult; }

        public int getFailedSubjectCount()         { return failedSubjectCount; }

        public int getAbsentSubjectCount()         { return absentSubjectCount; }

        public List<String> getFailedSubjectNames() { return failedSubjectNames; }
    }
}
