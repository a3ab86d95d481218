package com.nana.results.service;

import com.nana.results.domain.SectionConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigInteger;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SectionAssignerTest {

    private final SectionAssigner assigner = new SectionAssigner();

    private final SectionConfig ranges = SectionConfig.builder()
            .range("A", "1XX22CS001", "1XX22CS060")
            .range("B", "1XX22CS061", "1XX22CS120")
            .build();

    @Nested
    @DisplayName("Range rules")
    class RangeTests {

        @ParameterizedTest
        @CsvSource({
            "1XX22CS001, A",
            "1XX22CS060, A",
            "1XX22CS061, B",
            "1xx22cs120, B",
            "1XX22CS121, Unassigned",
            "NOID,       Unassigned"
        })
        @DisplayName("compares the last digit run of the id against the bounds")
        void assignsByNumericSuffix(String id, String expected) {
            assertEquals(expected, assigner.assignSection(id, ranges));
        }

        @Test
        @DisplayName("first matching rule wins when rules overlap")
        void overlappingRules_firstWins() {
            SectionConfig overlapping = SectionConfig.builder()
                    .range("X", "CS010", "CS050")
                    .range("Y", "CS040", "CS090")
                    .build();

            assertEquals("X", assigner.assignSection("1XX22CS045", overlapping));
            assertEquals("Y", assigner.assignSection("1XX22CS051", overlapping));
        }

        @Test
        @DisplayName("reversed bounds are accepted")
        void reversedBounds() {
            SectionConfig reversed = SectionConfig.builder().range("A", "CS060", "CS001").build();

            assertEquals("A", assigner.assignSection("1XX22CS030", reversed));
        }

        @Test
        @DisplayName("no configuration yields Unassigned")
        void noConfig_unassigned() {
            assertEquals(SectionAssigner.UNASSIGNED, assigner.assignSection("1XX22CS001", SectionConfig.none()));
            assertEquals(SectionAssigner.UNASSIGNED, assigner.assignSection("1XX22CS001", null));
        }

        @Test
        @DisplayName("lastDigitRun takes the final run of digits")
        void lastDigitRun() {
            assertEquals(BigInteger.valueOf(7), SectionAssigner.lastDigitRun("1XX22CS007"));
            assertNull(SectionAssigner.lastDigitRun("ABC"));
        }
    }

    @Nested
    @DisplayName("Explicit mapping")
    class ExplicitTests {

        @Test
        @DisplayName("explicit mapping wins over a matching range")
        void explicitWins() {
            String section = assigner.assignSection("1XX22CS005", ranges, Map.of("1XX22CS005", "C"));

            assertEquals("C", section);
        }

        @Test
        @DisplayName("explicit lookup ignores case and whitespace")
        void explicitLookup_normalised() {
            SectionConfig config = SectionConfig.builder().assign(" 1xx22 cs200 ", "D").build();

            assertEquals("D", assigner.assignSection("1XX22CS200", config));
        }

        @Test
        @DisplayName("ids missing from the mapping fall back to ranges")
        void missingFromMapping_usesRanges() {
            assertEquals("B", assigner.assignSection("1XX22CS070", ranges, Map.of("1XX22CS005", "C")));
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("blank section names are reported by rule position")
        void blankName_reported() {
            SectionConfig config = SectionConfig.builder()
                    .range("A", "CS001", "CS010")
                    .range("  ", "CS011", "CS020")
                    .build();

            ValidationException ex = assertThrows(ValidationException.class, () -> assigner.validate(config));

            assertTrue(ex.hasError("sections.2"));
            assertEquals(1, ex.getFieldErrors().size());
        }

        @Test
        @DisplayName("withoutUnnamedRules drops only the blank rules")
        void withoutUnnamedRules() {
            SectionConfig config = SectionConfig.builder()
                    .range("", "CS001", "CS010")
                    .range("B", "CS011", "CS020")
                    .assign("1XX22CS001", "Z")
                    .build();

            SectionConfig cleaned = assigner.withoutUnnamedRules(config);

            assertEquals(1, cleaned.getRanges().size());
            assertEquals("B", cleaned.getRanges().get(0).getSectionName());
            assertEquals("Z", cleaned.explicitSectionFor("1XX22CS001"));
        }

        @Test
        @DisplayName("valid rules pass validation")
        void validRules() {
            assertDoesNotThrow(() -> assigner.validate(ranges));
        }
    }
}
