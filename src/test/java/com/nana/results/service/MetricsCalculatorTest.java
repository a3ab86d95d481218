package com.nana.results.service;

import com.nana.results.domain.Category;
import com.nana.results.domain.OverallResult;
import com.nana.results.domain.SubjectMarks;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MetricsCalculatorTest {

    private final MetricsCalculator calculator = new MetricsCalculator();

    @Test
    @DisplayName("two attempted subjects at 80 and 60 give 70% and FCD")
    void twoSubjects_seventyPercent_isFcd() {
        MetricsCalculator.Metrics metrics = calculator.compute(List.of(
                new SubjectMarks("CS301", 30.0, 50.0, 80.0, "P"),
                new SubjectMarks("CS302", 20.0, 40.0, 60.0, "P")));

        assertEquals(140.0, metrics.getTotalMarks());
        assertEquals(50.0, metrics.getTotalInternal());
        assertEquals(90.0, metrics.getTotalExternal());
        assertEquals(2, metrics.getAttemptedSubjectCount());
        assertEquals(70.0, metrics.getPercentage());
        assertEquals(Category.FCD, calculator.categorize(OverallResult.P, metrics.getPercentage()));
    }

    @Test
    @DisplayName("subjects with no positive Total are left out of the denominator")
    void unattemptedSubjects_excludedFromDenominator() {
        MetricsCalculator.Metrics metrics = calculator.compute(List.of(
                new SubjectMarks("CS301", 30.0, 45.0, 75.0, "P"),
                new SubjectMarks("CS302", null, null, null, "A"),
                new SubjectMarks("CS303", 0.0, 0.0, 0.0, "A")));

        assertEquals(1, metrics.getAttemptedSubjectCount());
        assertEquals(75.0, metrics.getPercentage());
    }

    @Test
    @DisplayName("nothing attempted gives 0.0 percent")
    void nothingAttempted_zeroPercent() {
        MetricsCalculator.Metrics metrics = calculator.compute(List.of(
                new SubjectMarks("CS301", null, null, null, "A")));

        assertEquals(0, metrics.getAttemptedSubjectCount());
        assertEquals(0.0, metrics.getPercentage());
    }

    @Test
    @DisplayName("percentage is rounded to two decimals")
    void percentage_roundedToTwoDecimals() {
        assertEquals(83.33, MetricsCalculator.percentage(250, 3));
    }

    @ParameterizedTest
    @CsvSource({
        "70.00, FCD",
        "69.99, FC",
        "60.00, FC",
        "59.99, SC",
        "50.00, SC",
        "49.99, PASS_CLASS",
        "0.0,   PASS_CLASS"
    })
    @DisplayName("category boundaries are inclusive at the lower bound")
    void categoryBoundaries(double percentage, Category expected) {
        assertEquals(expected, calculator.categorize(OverallResult.P, percentage));
    }

    @Test
    @DisplayName("non-passing students keep their result code as category")
    void nonPassing_keepResultCode() {
        assertEquals(Category.FAILED, calculator.categorize(OverallResult.F, 95.0));
        assertEquals(Category.ABSENT, calculator.categorize(OverallResult.A, 0.0));
    }
}
