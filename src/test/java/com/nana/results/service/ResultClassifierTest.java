package com.nana.results.service;

import com.nana.results.domain.OverallResult;
import com.nana.results.domain.SubjectMarks;
import com.nana.results.domain.SubjectStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResultClassifierTest {

    private final ResultClassifier classifier = new ResultClassifier();

    private static SubjectMarks marks(Double internal, Double external, String result) {
        Double total = internal != null && external != null ? internal + external : null;
        return new SubjectMarks("CS301", internal, external, total, result);
    }

    @Nested
    @DisplayName("classifySubject")
    class ClassifySubjectTests {

        @Test
        @DisplayName("Result A with zero external is Absent even with internal marks")
        void absentCode_zeroExternal_isAbsent() {
            assertEquals(SubjectStatus.ABSENT, classifier.classifySubject(marks(20.0, 0.0, "A")));
        }

        @Test
        @DisplayName("empty Result below 35 combined is Fail")
        void emptyResult_below35_isFail() {
            assertEquals(SubjectStatus.FAIL, classifier.classifySubject(marks(15.0, 10.0, "")));
        }

        @Test
        @DisplayName("empty Result at 35 combined is Pass")
        void emptyResult_at35_isPass() {
            assertEquals(SubjectStatus.PASS, classifier.classifySubject(marks(15.0, 20.0, "")));
        }

        @Test
        @DisplayName("empty Result with no marks at all is Absent")
        void emptyResult_noMarks_isAbsent() {
            assertEquals(SubjectStatus.ABSENT, classifier.classifySubject(marks(null, null, null)));
        }

        @ParameterizedTest
        @CsvSource({
            "40, 50, F,      FAIL",
            "40, 50, fail,   FAIL",
            "10, 10, P,      PASS",
            "20, 30, ABSENT, PASS",
            "20, 0,  absent, ABSENT",
            "20, 0,  F,      FAIL"
        })
        @DisplayName("explicit result codes are honoured, case-insensitively")
        void explicitCodes(double internal, double external, String result, SubjectStatus expected) {
            assertEquals(expected, classifier.classifySubject(marks(internal, external, result)));
        }
    }

    @Nested
    @DisplayName("aggregate")
    class AggregateTests {

        private Map<String, SubjectStatus> statuses(SubjectStatus... values) {
            Map<String, SubjectStatus> map = new LinkedHashMap<>();
            for (int i = 0; i < values.length; i++) {
                map.put("S" + (i + 1), values[i]);
            }
            return map;
        }

        @Test
        @DisplayName("one absence among attempted subjects is F")
        void oneAbsence_isFail() {
            ResultClassifier.Classification c = classifier.aggregate(
                    statuses(SubjectStatus.PASS, SubjectStatus.ABSENT, SubjectStatus.PASS));

            assertEquals(OverallResult.F, c.getOverallResult());
            assertEquals(1, c.getAbsentSubjectCount());
            assertEquals(0, c.getFailedSubjectCount());
            assertTrue(c.getFailedSubjectNames().isEmpty());
        }

        @Test
        @DisplayName("every subject absent is A")
        void allAbsent_isAbsent() {
            ResultClassifier.Classification c = classifier.aggregate(
                    statuses(SubjectStatus.ABSENT, SubjectStatus.ABSENT));

            assertEquals(OverallResult.A, c.getOverallResult());
            assertEquals(2, c.getAbsentSubjectCount());
        }

        @Test
        @DisplayName("failures are counted and named in order")
        void failures_areNamed() {
            ResultClassifier.Classification c = classifier.aggregate(
                    statuses(SubjectStatus.FAIL, SubjectStatus.PASS, SubjectStatus.FAIL));

            assertEquals(OverallResult.F, c.getOverallResult());
            assertEquals(2, c.getFailedSubjectCount());
            assertEquals(List.of("S1", "S3"), c.getFailedSubjectNames());
        }

        @Test
        @DisplayName("all passed is P with zero counts")
        void allPassed_isPass() {
            ResultClassifier.Classification c = classifier.aggregate(
                    statuses(SubjectStatus.PASS, SubjectStatus.PASS));

            assertEquals(OverallResult.P, c.getOverallResult());
            assertEquals(0, c.getFailedSubjectCount());
            assertEquals(0, c.getAbsentSubjectCount());
        }

        @Test
        @DisplayName("no subjects is P")
        void empty_isPass() {
            assertEquals(OverallResult.P, classifier.aggregate(Map.of()).getOverallResult());
        }
    }
}
