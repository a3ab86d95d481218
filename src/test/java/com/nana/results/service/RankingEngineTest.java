package com.nana.results.service;

import com.nana.results.domain.OverallResult;
import com.nana.results.domain.SgpaResult;
import com.nana.results.domain.StudentRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static com.nana.results.service.MarkSheetFixture.failed;
import static com.nana.results.service.MarkSheetFixture.passed;
import static org.junit.jupiter.api.Assertions.*;

class RankingEngineTest {

    private final RankingEngine engine = new RankingEngine();

    private static List<Integer> classRanks(List<StudentRecord> records) {
        return records.stream().map(StudentRecord::getClassRank).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("Competition ranking")
    class CompetitionTests {

        @Test
        @DisplayName("90, 90, 85 rank as 1, 1, 3")
        void ties_shareRank_nextSkips() {
            List<StudentRecord> ranked = engine.rank(List.of(
                    passed(0, "S1", "A", 90),
                    passed(1, "S2", "A", 90),
                    passed(2, "S3", "A", 85)), RankMetric.TOTAL_MARKS);

            assertEquals(List.of(1, 1, 3), classRanks(ranked));
        }

        @Test
        @DisplayName("records keep their input order")
        void inputOrderPreserved() {
            List<StudentRecord> ranked = engine.rank(List.of(
                    passed(0, "S1", "A", 50),
                    passed(1, "S2", "A", 80),
                    passed(2, "S3", "A", 70)), RankMetric.TOTAL_MARKS);

            assertEquals(List.of("S1", "S2", "S3"),
                    ranked.stream().map(StudentRecord::getStudentId).collect(Collectors.toList()));
            assertEquals(List.of(3, 1, 2), classRanks(ranked));
        }

        @Test
        @DisplayName("failed students are not ranked")
        void failedStudents_unranked() {
            List<StudentRecord> ranked = engine.rank(List.of(
                    failed(0, "S1", "A", 99),
                    passed(1, "S2", "A", 60)), RankMetric.TOTAL_MARKS);

            assertNull(ranked.get(0).getClassRank());
            assertNull(ranked.get(0).getSectionRank());
            assertEquals(1, ranked.get(1).getClassRank());
        }

        @Test
        @DisplayName("section ranks are computed within each section")
        void sectionRanks() {
            List<StudentRecord> ranked = engine.rank(List.of(
                    passed(0, "S1", "A", 80),
                    passed(1, "S2", "B", 90),
                    passed(2, "S3", "A", 85),
                    passed(3, "S4", "B", 70)), RankMetric.TOTAL_MARKS);

            assertEquals(List.of(3, 1, 2, 4), classRanks(ranked));
            assertEquals(List.of(2, 1, 1, 2),
                    ranked.stream().map(StudentRecord::getSectionRank).collect(Collectors.toList()));
        }

        @Test
        @DisplayName("stale ranks are cleared on re-ranking")
        void staleRanksCleared() {
            StudentRecord stale = failed(0, "S1", "A", 50).toBuilder().classRank(1).sectionRank(1).build();

            StudentRecord ranked = engine.rank(List.of(stale), RankMetric.TOTAL_MARKS).get(0);

            assertNull(ranked.getClassRank());
            assertNull(ranked.getSectionRank());
        }

        @Test
        @DisplayName("SGPA mode ranks students whose SGPA result is Pass")
        void sgpaMode_usesSgpaResult() {
            StudentRecord a = passed(0, "S1", "A", 50).toBuilder().sgpa(9.1).sgpaResult(SgpaResult.PASS).build();
            StudentRecord b = passed(1, "S2", "A", 90).toBuilder().sgpa(7.5).sgpaResult(SgpaResult.PASS).build();
            StudentRecord c = passed(2, "S3", "A", 95).toBuilder()
                    .overallResult(OverallResult.F).sgpa(9.9).sgpaResult(SgpaResult.FAIL).build();

            List<StudentRecord> ranked = engine.rank(List.of(a, b, c), RankMetric.SGPA);

            assertEquals(1, ranked.get(0).getClassRank());
            assertEquals(2, ranked.get(1).getClassRank());
            assertNull(ranked.get(2).getClassRank());
        }
    }

    @Nested
    @DisplayName("Ranked listing")
    class ListingTests {

        private final List<StudentRecord> records = List.of(
                failed(0, "S1", "A", 99),
                passed(1, "S2", "A", 60),
                passed(2, "S3", "A", 75));

        @Test
        @DisplayName("ALL lists passing students first, then by metric descending")
        void all_passingFirst() {
            List<StudentRecord> listing = engine.rankedListing(records, RankMetric.TOTAL_MARKS, ResultFilter.ALL);

            assertEquals(List.of("S3", "S2", "S1"),
                    listing.stream().map(StudentRecord::getStudentId).collect(Collectors.toList()));
        }

        @Test
        @DisplayName("PASS and FAIL filters split the listing")
        void filters() {
            assertEquals(2, engine.rankedListing(records, RankMetric.TOTAL_MARKS, ResultFilter.PASS).size());
            assertEquals(List.of("S1"), engine.rankedListing(records, RankMetric.TOTAL_MARKS, ResultFilter.FAIL)
                    .stream().map(StudentRecord::getStudentId).collect(Collectors.toList()));
        }
    }

    @Test
    @DisplayName("metric and filter names parse leniently")
    void parsing() {
        assertEquals(RankMetric.TOTAL_INTERNAL, RankMetric.parse("total-internal"));
        assertEquals(RankMetric.SGPA, RankMetric.parse(" sgpa "));
        assertThrows(IllegalArgumentException.class, () -> RankMetric.parse("average"));
        assertEquals(ResultFilter.ALL, ResultFilter.parse(null));
        assertEquals(ResultFilter.FAIL, ResultFilter.parse("fail"));
    }
}
