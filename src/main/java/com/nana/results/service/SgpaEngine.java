package com.nana.results.service;

import com.nana.results.domain.CreditConfig;
import com.nana.results.domain.OverallResult;
import com.nana.results.domain.SgpaResult;
import com.nana.results.domain.StudentRecord;
import com.nana.results.domain.SubjectMarks;
import com.nana.results.domain.SubjectSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * SgpaEngine - Credit-Weighted Grade Points
 *
 * <p>GRADE POINTS (per credited subject score):
 * <pre>
 *   90 and above -> 10     55-59 -> 6
 *   80-89        ->  9     50-54 -> 5
 *   70-79        ->  8     40-49 -> 4
 *   60-69        ->  7     below -> 0
 * </pre>
 *
 * <p>SCORE: Total when present; otherwise Internal + External when both are
 * present; otherwise whichever of the two is non-zero; otherwise 0.
 *
 * <p>FAIL FLAG: Result {@code P}/{@code PASS} never flags;
 * {@code F}/{@code FAIL}/{@code A}/{@code ABSENT} always flags; any other
 * Result text flags when the score is below 35.
 *
 * <p>RECONCILIATION: the SGPA label mirrors the student's overall result
 * (A to Absent, F to Fail, P to Pass). The fail flag decides only for
 * students with no classified subjects.
 *
 * <p>Subjects with weight 0, and credit entries for codes the schema does
 * not know, take no part.
 */
public class SgpaEngine {

    private static final Logger log = LoggerFactory.getLogger(SgpaEngine.class);

    /** Highest accepted credit weight. */
    public static final int MAX_CREDIT = 4;

    /** Score below which an unlabelled subject raises the fail flag. */
    public static final double FAIL_FLAG_SCORE = 35.0;

    private static final Set<String> PASS_CODES = Set.of("P", "PASS");

    private static final Set<String> FLAG_CODES = Set.of("F", "FAIL", "A", "ABSENT");

    // -----------------------------------------------------------------------
    // VALIDATION
    // -----------------------------------------------------------------------

    /**
     * Checks a credit table before use.
     *
     * @param credits credit table
     * @throws ValidationException with key {@code "credits"} when the table
     *         is empty or all zero, and key {@code "credits.<CODE>"} for
     *         every weight outside 0-4
     */
    public void validate(CreditConfig credits) throws ValidationException {
        if (credits == null || credits.isEmptyOrZero()) {
            throw new ValidationException("credits",
                    "Credit configuration is empty or all zero; SGPA was not computed.");
        }
        Map<String, String> errors = new LinkedHashMap<>();
        credits.getCredits().forEach((code, weight) -> {
            if (weight < 0 || weight > MAX_CREDIT) {
                errors.put("credits." + code,
                        "Credit weight " + weight + " for " + code
                        + " is outside 0-" + MAX_CREDIT + ".");
            }
        });
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
    }

    // -----------------------------------------------------------------------
    // COMPUTATION
    // -----------------------------------------------------------------------

    /**
     * Adds SGPA and SGPA result to every record.
     *
     * @param records classified records
     * @param credits validated credit table
     * @param schema  detected schema
     * @return new records carrying SGPA fields
     * @throws ValidationException if the credit table is invalid
     */
    public List<StudentRecord> apply(List<StudentRecord> records,
                                     CreditConfig credits,
                                     SubjectSchema schema) throws ValidationException {
        validate(credits);
        credits.getCredits().keySet().stream()
               .filter(code -> !schema.contains(code))
               .forEach(code -> log.warn("Credit given for unknown subject '{}'; ignored.", code));

        List<StudentRecord> out = new ArrayList<>(records.size());
        for (StudentRecord record : records) {
            SgpaOutcome outcome = compute(record, credits, schema);
            OverallResult overall = record.getSubjectStatuses().isEmpty()
                    ? null : record.getOverallResult();
            out.add(record.toBuilder()
                          .sgpa(outcome.getSgpa())
                          .sgpaResult(reconcile(overall, outcome.isCreditedFail()))
                          .build());
        }
        log.debug("SGPA computed for {} record(s).", out.size());
        return out;
    }

    /**
     * Computes one student's SGPA and fail flag.
     *
     * @param record  classified record
     * @param credits credit table
     * @param schema  detected schema
     * @return SGPA rounded to two decimals plus the fail flag
     */
    public SgpaOutcome compute(StudentRecord record, CreditConfig credits, SubjectSchema schema) {
        double weighted = 0.0;
        int creditSum = 0;
        boolean creditedFail = false;
        for (String code : schema.getCodes()) {
            int credit = credits.creditFor(code);
            SubjectMarks marks = record.getSubjects().get(code);
            if (credit <= 0 || marks == null) {
                continue;
            }
            double score = scoreOf(marks);
            weighted += gradePoints(score) * credit;
            creditSum += credit;
            if (isFailFlag(marks.getResultRaw(), score)) {
                creditedFail = true;
            }
        }
        double sgpa = creditSum == 0 ? 0.0 : MetricsCalculator.round2(weighted / creditSum);
        return new SgpaOutcome(sgpa, creditedFail);
    }

    /**
     * @param score subject score
     * @return grade point 0-10
     */
    public static int gradePoints(double score) {
        if (score >= 90) return 10;
        if (score >= 80) return 9;
        if (score >= 70) return 8;
        if (score >= 60) return 7;
        if (score >= 55) return 6;
        if (score >= 50) return 5;
        if (score >= 40) return 4;
        return 0;
    }

    /**
     * @param marks subject marks
     * @return the score used for grade points
     */
    public static double scoreOf(SubjectMarks marks) {
        if (marks.getTotal() != null) {
            return marks.getTotal();
        }
        Double internal = marks.getInternal();
        Double external = marks.getExternal();
        if (internal != null && external != null) {
            return internal + external;
        }
        if (internal != null && internal != 0.0) {
            return internal;
        }
        if (external != null && external != 0.0) {
            return external;
        }
        return 0.0;
    }

    static boolean isFailFlag(String resultRaw, double score) {
        if (PASS_CODES.contains(resultRaw)) {
            return false;
        }
        if (FLAG_CODES.contains(resultRaw)) {
            return true;
        }
        return score < FAIL_FLAG_SCORE;
    }

    /**
     * Derives the SGPA result label.
     *
     * @param overall      overall result, or null when the student had no
     *                     classified subjects
     * @param creditedFail fail flag over credited subjects
     * @return the label
     */
    public static SgpaResult reconcile(OverallResult overall, boolean creditedFail) {
        if (overall != null) {
            return SgpaResult.mirrorOf(overall);
        }
        return creditedFail ? SgpaResult.FAIL : SgpaResult.PASS;
    }

    // -----------------------------------------------------------------------
    // RESULT VALUE OBJECT
    // -----------------------------------------------------------------------

    /** SGPA of one student before reconciliation. */
    public static final class SgpaOutcome {

        private final double sgpa;
        private final boolean creditedFail;

        public SgpaOutcome(double sgpa, boolean creditedFail) {
            this.sgpa         = sgpa;
            this.creditedFail = creditedFail;
        }

        public double getSgpa()          { return sgpa; }

        public boolean isCreditedFail()  { return creditedFail; }
    }
}
