package com.nana.results.service;

import com.nana.results.domain.Dataset;
import com.nana.results.domain.SubjectColumn;
import com.nana.results.domain.SubjectSchema;
import com.nana.results.domain.SubjectSuffix;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SchemaDetectorTest {

    private final SchemaDetector detector = new SchemaDetector();

    @Nested
    @DisplayName("Header parsing")
    class HeaderParsingTests {

        @Test
        @DisplayName("splits on the last whitespace into code and suffix")
        void parseHeader_codeAndSuffix() {
            SubjectColumn column = detector.parseHeader("CS301 Internal");

            assertNotNull(column);
            assertEquals("CS301", column.getCode());
            assertEquals(SubjectSuffix.INTERNAL, column.getSuffix());
            assertEquals("CS301 Internal", column.getColumnName());
        }

        @Test
        @DisplayName("keeps multi-word codes intact")
        void parseHeader_multiWordCode() {
            SubjectColumn column = detector.parseHeader("Data Structures Total");

            assertNotNull(column);
            assertEquals("Data Structures", column.getCode());
            assertEquals(SubjectSuffix.TOTAL, column.getSuffix());
        }

        @ParameterizedTest
        @ValueSource(strings = {"USN", "Name", "CS301 Marks", "Total", " ", "CS301Total"})
        @DisplayName("returns null for headers without a known suffix")
        void parseHeader_noSuffix_returnsNull(String header) {
            assertNull(detector.parseHeader(header));
        }

        @Test
        @DisplayName("groups columns by code, first column per role wins")
        void parse_groupsByCode() {
            Map<String, Map<SubjectSuffix, SubjectColumn>> groups = detector.parse(List.of(
                    "USN", "CS301 Internal", "CS301 External", "CS301 Total", "CS302 Total", "CS301 Total"));

            assertEquals(List.of("CS301", "CS302"), List.copyOf(groups.keySet()));
            assertEquals(3, groups.get("CS301").size());
            assertEquals("CS301 Total", groups.get("CS301").get(SubjectSuffix.TOTAL).getColumnName());
        }
    }

    @Nested
    @DisplayName("Subject filtering")
    class FilteringTests {

        @Test
        @DisplayName("detects every subject of a regular sheet, sorted by code")
        void detect_regularSheet() {
            Dataset dataset = MarkSheetFixture.sheet("cse", "CS302", "CS301")
                    .student("1XX22CS001", "Asha", 40, 50, "P", 35, 40, "P")
                    .build();

            SubjectSchema schema = detector.detect(dataset);

            assertEquals(List.of("CS301", "CS302"), schema.getCodes());
            assertEquals("CS301 Result", schema.columnFor("CS301", SubjectSuffix.RESULT));
        }

        @Test
        @DisplayName("rejects a phantom 'Grand Total' column")
        void detect_grandTotal_isNotASubject() {
            Dataset dataset = MarkSheetFixture.sheet("cse", "CS301")
                    .extraColumn("Grand Total")
                    .row(Map.of("USN", "1XX22CS001", "CS301 Internal", 40, "CS301 External", 50,
                            "CS301 Total", 90, "Grand Total", 90))
                    .build();

            SubjectSchema schema = detector.detect(dataset);

            assertEquals(List.of("CS301"), schema.getCodes());
            assertFalse(schema.contains("Grand"));
        }

        @Test
        @DisplayName("accepts a Total-only subject whose code carries a digit")
        void detect_totalOnlyWithDigitCode_isSubject() {
            Dataset dataset = Dataset.of("lab", List.of("USN", "CSL37 Total"),
                    List.of(Map.of("USN", "1", "CSL37 Total", 45)));

            assertEquals(List.of("CSL37"), detector.detect(dataset).getCodes());
        }

        @Test
        @DisplayName("rejects a subject whose Total column has no positive number")
        void detect_allZeroTotal_isRejected() {
            Dataset dataset = Dataset.of("cse", List.of("USN", "CS301 Internal", "CS301 Total"),
                    List.of(Map.of("USN", "1", "CS301 Internal", 0, "CS301 Total", 0),
                            Map.of("USN", "2", "CS301 Internal", "x", "CS301 Total", "absent")));

            assertTrue(detector.detect(dataset).isEmpty());
        }

        @Test
        @DisplayName("rejects a group without a Total column")
        void detect_noTotal_isRejected() {
            Dataset dataset = Dataset.of("cse", List.of("USN", "CS301 Internal", "CS301 External"),
                    List.of(Map.of("USN", "1", "CS301 Internal", 20, "CS301 External", 40)));

            assertTrue(detector.detect(dataset).isEmpty());
        }

        @ParameterizedTest
        @ValueSource(strings = {"CS301", "18CS53", "MATH2", "BCS304A"})
        @DisplayName("looksLikeCode accepts code-shaped names")
        void looksLikeCode_accepts(String code) {
            assertTrue(SchemaDetector.looksLikeCode(code));
        }

        @ParameterizedTest
        @ValueSource(strings = {"Grand", "Overall", "Marks"})
        @DisplayName("looksLikeCode rejects plain words")
        void looksLikeCode_rejects(String code) {
            assertFalse(SchemaDetector.looksLikeCode(code));
        }
    }
}
