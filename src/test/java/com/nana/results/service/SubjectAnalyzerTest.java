package com.nana.results.service;

import com.nana.results.domain.Dataset;
import com.nana.results.domain.SubjectSchema;
import com.nana.results.repository.InMemoryDatasetStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SubjectAnalyzerTest {

    private final SubjectAnalyzer analyzer = new SubjectAnalyzer();

    private final ResultEngineImpl engine = new ResultEngineImpl(
            new InMemoryDatasetStore(), new ResultCache<>());

    @Test
    @DisplayName("counts pass, fail and absent per subject and names the extremes")
    void analyze_countsAndExtremes() {
        Dataset dataset = MarkSheetFixture.sheet("cse", "CS301", "CS302", "CS303")
                .student("1XX22CS001", "Asha", 40, 50, "P", 10, 10, "F", 30, 40, "P")
                .student("1XX22CS002", "Ravi", 35, 45, "P", 12, 11, "", 20, 0, "A")
                .student("1XX22CS003", "Meera", 38, 42, "P", 30, 40, "P", 25, 30, "P")
                .build();
        EngineResult result = engine.analyze(dataset, AnalysisRequest.defaults());

        SubjectAnalyzer.SubjectAnalysis analysis = analyzer.analyze(result.getRecords(), result.getSchema());

        SubjectAnalyzer.SubjectStats cs302 = analysis.getSubjects().get(1);
        SubjectAnalyzer.SubjectStats cs303 = analysis.getSubjects().get(2);
        assertEquals("CS302", cs302.getCode());
        assertEquals(3, cs302.getStudents());
        assertEquals(2, cs302.getFailed());
        assertEquals(33.33, cs302.getPassPercentage());
        assertEquals(1, cs303.getAbsent());
        assertEquals("CS302", analysis.getHardestSubject());
        assertEquals("CS301", analysis.getEasiestSubject());
    }

    @Test
    @DisplayName("no subjects yields no extremes")
    void analyze_emptySchema() {
        SubjectAnalyzer.SubjectAnalysis analysis = analyzer.analyze(
                List.of(), SubjectSchema.empty());

        assertTrue(analysis.getSubjects().isEmpty());
        assertNull(analysis.getHardestSubject());
        assertNull(analysis.getEasiestSubject());
    }
}
