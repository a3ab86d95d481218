package com.nana.results.service;

import com.nana.results.domain.Dataset;
import com.nana.results.domain.SectionConfig;
import com.nana.results.domain.StudentRecord;

import java.util.List;

/**
 * ResultEngine - Service Layer Interface of the Result Pipeline
 *
 * <p>Turns a stored mark sheet plus an {@link AnalysisRequest} into
 * classified, ranked records and reports. The pipeline is synchronous,
 * performs no I/O and is idempotent: the same dataset and request always
 * yield an equal {@link EngineResult}.
 *
 * <p>Configuration problems never abort a run; they become warnings on
 * the result (see {@link EngineResult#getWarnings()}).
 */
public interface ResultEngine {

    /**
     * Analyses a dataset held by the engine's store.
     *
     * @param datasetName name the dataset was stored under
     * @param request     run configuration
     * @return records and reports
     * @throws com.nana.results.repository.DatasetStore.StoreException if the
     *         name is unknown
     */
    EngineResult analyze(String datasetName, AnalysisRequest request);

    /**
     * Analyses a dataset directly, bypassing the store.
     *
     * @param dataset decoded mark sheet
     * @param request run configuration
     * @return records and reports
     */
    EngineResult analyze(Dataset dataset, AnalysisRequest request);

    /**
     * Runs the cached front of the pipeline: schema, sections,
     * classification and metrics.
     *
     * @param dataset  decoded mark sheet
     * @param sections section rules
     * @return the (possibly cached) snapshot
     */
    NormalizedSnapshot normalize(Dataset dataset, SectionConfig sections);

    /**
     * @param result an engine result
     * @param filter ALL, PASS or FAIL under the result's metric
     * @return passing students first, each group by metric descending
     */
    List<StudentRecord> rankedListing(EngineResult result, ResultFilter filter);

    /**
     * @param result an engine result
     * @return per-subject statistics with hardest and easiest subject
     */
    SubjectAnalyzer.SubjectAnalysis analyzeSubjects(EngineResult result);

    /**
     * Analyses several stored datasets with the same request and compares
     * their pass percentages.
     *
     * @param datasetNames branch dataset names, in display order
     * @param request      run configuration applied to each branch
     * @return the comparison
     * @throws com.nana.results.repository.DatasetStore.StoreException if a
     *         name is unknown
     */
    BranchComparator.BranchComparison compareBranches(List<String> datasetNames, AnalysisRequest request);

    /**
     * @param result an engine result
     * @param query  case-insensitive text matched against id and name
     * @return matching records in row order
     */
    List<StudentRecord> searchStudents(EngineResult result, String query);
}
