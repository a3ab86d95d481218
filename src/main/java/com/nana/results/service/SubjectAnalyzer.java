package com.nana.results.service;

import com.nana.results.domain.StudentRecord;
import com.nana.results.domain.SubjectSchema;
import com.nana.results.domain.SubjectStatus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * SubjectAnalyzer - Per-Subject Pass/Fail/Absent Statistics
 *
 * <p>The hardest subject has the highest fail rate and the easiest the
 * lowest; both resolve ties to the first subject in code order.
 */
public class SubjectAnalyzer {

    /**
     * @param records classified records
     * @param schema  detected schema
     * @return one row per subject in code order, plus hardest/easiest
     */
    public SubjectAnalysis analyze(List<StudentRecord> records, SubjectSchema schema) {
        List<SubjectStats> rows = new ArrayList<>();
        for (String code : schema.getCodes()) {
            int students = 0;
            int passed = 0;
            int failed = 0;
            int absent = 0;
            for (StudentRecord record : records) {
                SubjectStatus status = record.statusOf(code);
                if (status == null) {
                    continue;
                }
                students++;
                switch (status) {
                    case PASS -> passed++;
                    case FAIL -> failed++;
                    case ABSENT -> absent++;
                }
            }
            rows.add(new SubjectStats(code, students, passed, failed, absent));
        }

        SubjectStats hardest = null;
        SubjectStats easiest = null;
        for (SubjectStats row : rows) {
            if (hardest == null || row.getFailRate() > hardest.getFailRate()) {
                hardest = row;
            }
            if (easiest == null || row.getFailRate() < easiest.getFailRate()) {
                easiest = row;
            }
        }
        return new SubjectAnalysis(rows,
                hardest == null ? null : hardest.getCode(),
                easiest == null ? null : easiest.getCode());
    }

    // -----------------------------------------------------------------------
    // VALUE OBJECTS
    // -----------------------------------------------------------------------

    /** Counts for one subject. */
    public static final class SubjectStats {

        private final String code;
        private final int students;
        private final int passed;
        private final int failed;
        private final int absent;

        public SubjectStats(String code, int students, int passed, int failed, int absent) {
            this.code     = code;
            this.students = students;
            this.passed   = passed;
            this.failed   = failed;
            this.absent   = absent;
        }

        public String getCode()   { return code; }

        public int getStudents()  { return students; }

        public int getPassed()    { return passed; }

        public int getFailed()    { return failed; }

        public int getAbsent()    { return absent; }

        /** @return passed over students in percent, two decimals */
        public double getPassPercentage() {
            return students == 0 ? 0.0 : MetricsCalculator.round2(passed * 100.0 / students);
        }

        /** @return failed over students as a fraction */
        public double getFailRate() {
            return students == 0 ? 0.0 : (double) failed / students;
        }

        @Override
        public String toString() {
            return code + ": students=" + students + ", passed=" + passed
                   + ", failed=" + failed + ", absent=" + absent;
        }
    }

    /** Analysis of every subject of a sheet. */
    public static final class SubjectAnalysis {

        private final List<SubjectStats> subjects;
        private final String hardestSubject;
        private final String easiestSubject;

        public SubjectAnalysis(List<SubjectStats> subjects, String hardestSubject, String easiestSubject) {
            this.subjects       = Collections.unmodifiableList(new ArrayList<>(subjects));
            this.hardestSubject = hardestSubject;
            this.easiestSubject = easiestSubject;
        }

        public List<SubjectStats> getSubjects()  { return subjects; }

        /** @return code of the hardest subject, or null for a sheet without subjects */
        public String getHardestSubject()        { return hardestSubject; }

        /** @return code of the easiest subject, or null for a sheet without subjects */
        public String getEasiestSubject()        { return easiestSubject; }
    }
}
