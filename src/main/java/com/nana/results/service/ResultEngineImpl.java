package com.nana.results.service;

import com.nana.results.domain.CellValues;
import com.nana.results.domain.Dataset;
import com.nana.results.domain.RawRow;
import com.nana.results.domain.SectionConfig;
import com.nana.results.domain.StudentRecord;
import com.nana.results.domain.SubjectMarks;
import com.nana.results.domain.SubjectSchema;
import com.nana.results.domain.SubjectStatus;
import com.nana.results.domain.SubjectSuffix;
import com.nana.results.repository.DatasetStore;
import com.nana.results.util.AppLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * ResultEngineImpl - Service Layer Implementation of {@link ResultEngine}
 *
 * <p>PIPELINE:
 * <ol>
 *   <li>{@link SchemaDetector}, {@link SectionAssigner},
 *       {@link ResultClassifier} and {@link MetricsCalculator} produce a
 *       {@link NormalizedSnapshot}, memoised in the {@link ResultCache}
 *       under the dataset hash and the serialised section rules.</li>
 *   <li>{@link SgpaEngine} adds SGPA when credits were supplied.</li>
 *   <li>{@link RankingEngine} assigns class and section ranks.</li>
 *   <li>{@link ReportAggregator} builds the report bundle.</li>
 * </ol>
 * Steps 2-4 run on every call, so changing credits or the metric never
 * needs a cache invalidation.
 *
 * <p>DEPENDENCY INJECTION:
 * The dataset store and the cache are passed in by the caller. The pure
 * stage objects hold no state and are created here.
 */
public class ResultEngineImpl implements ResultEngine {

    private static final Logger log = LoggerFactory.getLogger(ResultEngineImpl.class);

    // -----------------------------------------------------------------------
    // DEPENDENCIES
    // -----------------------------------------------------------------------

    private final DatasetStore store;
    private final ResultCache<CacheKey, NormalizedSnapshot> cache;

    private final SchemaDetector schemaDetector = new SchemaDetector();
    private final SectionAssigner sectionAssigner = new SectionAssigner();
    private final ResultClassifier classifier = new ResultClassifier();
    private final MetricsCalculator metricsCalculator = new MetricsCalculator();
    private final SgpaEngine sgpaEngine = new SgpaEngine();
    private final RankingEngine rankingEngine = new RankingEngine();
    private final SubjectAnalyzer subjectAnalyzer = new SubjectAnalyzer();
    private final BranchComparator branchComparator = new BranchComparator();
    private final ReportAggregator reportAggregator;

    // -----------------------------------------------------------------------
    // CONSTRUCTORS
    // -----------------------------------------------------------------------

    public ResultEngineImpl(DatasetStore store, ResultCache<CacheKey, NormalizedSnapshot> cache) {
        this(store, cache, new ReportAggregator());
    }

    /**
     * @param store            dataset store; must not be null
     * @param cache            snapshot cache; must not be null
     * @param reportAggregator report stage; must not be null
     * @throws IllegalArgumentException if any argument is null
     */
    public ResultEngineImpl(DatasetStore store,
                            ResultCache<CacheKey, NormalizedSnapshot> cache,
                            ReportAggregator reportAggregator) {
        if (store == null) {
            throw new IllegalArgumentException("DatasetStore must not be null.");
        }
        if (cache == null) {
            throw new IllegalArgumentException("ResultCache must not be null.");
        }
        if (reportAggregator == null) {
            throw new IllegalArgumentException("ReportAggregator must not be null.");
        }
        this.store            = store;
        this.cache            = cache;
        this.reportAggregator = reportAggregator;
        log.debug("ResultEngineImpl instantiated with store: {}, cache capacity: {}",
                store.getClass().getSimpleName(), cache.getCapacity());
    }

    // -----------------------------------------------------------------------
    // ANALYSIS
    // -----------------------------------------------------------------------

    @Override
    public EngineResult analyze(String datasetName, AnalysisRequest request) {
        return analyze(store.get(datasetName), request);
    }

    @Override
    public EngineResult analyze(Dataset dataset, AnalysisRequest request) {
        if (dataset == null) {
            throw new IllegalArgumentException("Dataset must not be null.");
        }
        AnalysisRequest effective = request == null ? AnalysisRequest.defaults() : request;

        AppLogger.setOperationContext(AppLogger.OP_RESULT_ANALYSIS);
        try {
            log.debug("analyze() called for {} with {}", dataset, effective);
            List<String> warnings = new ArrayList<>();

            SectionConfig sections = effective.getSections();
            try {
                sectionAssigner.validate(sections);
            } catch (ValidationException ex) {
                log.warn("Section rules rejected: {}", ex.getFieldErrors());
                warnings.addAll(ex.getFieldErrors().values());
                sections = sectionAssigner.withoutUnnamedRules(sections);
            }

            NormalizedSnapshot snapshot = normalize(dataset, sections);
            if (snapshot.getSchema().isEmpty() && !dataset.isEmpty()) {
                warnings.add("No subject columns were detected in '" + dataset.getName() + "'.");
            }

            List<StudentRecord> records = snapshot.getRecords();
            boolean sgpaComputed = false;
            if (effective.isSgpaRequested()) {
                try {
                    records = sgpaEngine.apply(records, effective.getCredits(), snapshot.getSchema());
                    sgpaComputed = true;
                } catch (ValidationException ex) {
                    log.warn("SGPA skipped: {}", ex.getMessage());
                    warnings.addAll(ex.getFieldErrors().values());
                }
            }

            RankMetric metric = effective.getMetric();
            if (metric == RankMetric.SGPA && !sgpaComputed) {
                warnings.add("SGPA ranking was requested but SGPA is unavailable; ranked by "
                             + RankMetric.TOTAL_MARKS.getDisplayName() + " instead.");
                metric = RankMetric.TOTAL_MARKS;
            }

            List<StudentRecord> ranked = rankingEngine.rank(records, metric);
            ReportBundle reports = reportAggregator.aggregate(ranked, metric);

            EngineResult result = new EngineResult(dataset.getName(), snapshot.getSchema(),
                    ranked, reports, metric, sgpaComputed, warnings);
            AppLogger.logEvent("ANALYSIS_COMPLETED",
                    "dataset=" + dataset.getName() + ", students=" + ranked.size()
                    + ", subjects=" + snapshot.getSchema().getSubjectCount()
                    + ", metric=" + metric.name() + ", warnings=" + warnings.size());
            if (!warnings.isEmpty()) {
                AppLogger.logWarningEvent("ANALYSIS_WARNINGS", String.join(" | ", warnings));
            }
            return result;
        } finally {
            AppLogger.clearOperationContext();
        }
    }

    @Override
    public NormalizedSnapshot normalize(Dataset dataset, SectionConfig sections) {
        SectionConfig effective = sections == null ? SectionConfig.none() : sections;
        CacheKey key = CacheKey.of(dataset, effective);
        return cache.getOrCompute(key, () -> buildSnapshot(dataset, effective));
    }

    private NormalizedSnapshot buildSnapshot(Dataset dataset, SectionConfig sections) {
        log.debug("Cache miss; normalising '{}'.", dataset.getName());
        SubjectSchema schema = schemaDetector.detect(dataset);
        List<StudentRecord> records = new ArrayList<>(dataset.getRowCount());
        for (RawRow row : dataset.getRows()) {
            records.add(normalizeRow(dataset, schema, sections, row));
        }
        return new NormalizedSnapshot(schema, records);
    }

    private StudentRecord normalizeRow(Dataset dataset,
                                       SubjectSchema schema,
                                       SectionConfig sections,
                                       RawRow row) {
        String studentId = dataset.studentIdOf(row);
        StudentRecord.Builder builder = StudentRecord.builder()
                .rowIndex(row.getIndex())
                .studentId(studentId)
                .name(dataset.studentNameOf(row))
                .section(sectionAssigner.assignSection(studentId, sections));

        List<SubjectMarks> allMarks = new ArrayList<>(schema.getSubjectCount());
        Map<String, SubjectStatus> statuses = new LinkedHashMap<>();
        for (String code : schema.getCodes()) {
            SubjectMarks marks = readMarks(schema, code, row);
            SubjectStatus status = classifier.classifySubject(marks);
            allMarks.add(marks);
            statuses.put(code, status);
            builder.subject(marks, status);
        }

        ResultClassifier.Classification classification = classifier.aggregate(statuses);
        MetricsCalculator.Metrics metrics = metricsCalculator.compute(allMarks);

        return builder
                .overallResult(classification.getOverallResult())
                .failedSubjectCount(classification.getFailedSubjectCount())
                .absentSubjectCount(classification.getAbsentSubjectCount())
                .failedSubjectNames(classification.getFailedSubjectNames())
                .totalMarks(metrics.getTotalMarks())
                .totalInternal(metrics.getTotalInternal())
                .totalExternal(metrics.getTotalExternal())
                .attemptedSubjectCount(metrics.getAttemptedSubjectCount())
                .percentage(metrics.getPercentage())
                .category(metricsCalculator.categorize(
                        classification.getOverallResult(), metrics.getPercentage()))
                .build();
    }

    private static SubjectMarks readMarks(SubjectSchema schema, String code, RawRow row) {
        return new SubjectMarks(code,
                numberIn(schema, code, SubjectSuffix.INTERNAL, row),
                numberIn(schema, code, SubjectSuffix.EXTERNAL, row),
                numberIn(schema, code, SubjectSuffix.TOTAL, row),
                CellValues.toText(row.get(schema.columnFor(code, SubjectSuffix.RESULT))));
    }

    private static Double numberIn(SubjectSchema schema, String code, SubjectSuffix suffix, RawRow row) {
        String column = schema.columnFor(code, suffix);
        return column == null ? null : CellValues.toOptionalNumber(row.get(column));
    }

    // -----------------------------------------------------------------------
    // DERIVED VIEWS
    // -----------------------------------------------------------------------

    @Override
    public List<StudentRecord> rankedListing(EngineResult result, ResultFilter filter) {
        ResultFilter effective = filter == null ? ResultFilter.ALL : filter;
        return rankingEngine.rankedListing(result.getRecords(), result.getMetric(), effective);
    }

    @Override
    public SubjectAnalyzer.SubjectAnalysis analyzeSubjects(EngineResult result) {
        return subjectAnalyzer.analyze(result.getRecords(), result.getSchema());
    }

    @Override
    public BranchComparator.BranchComparison compareBranches(List<String> datasetNames,
                                                             AnalysisRequest request) {
        AppLogger.setOperationContext(AppLogger.OP_BRANCH_COMPARISON);
        try {
            Map<String, List<StudentRecord>> branches = new LinkedHashMap<>();
            for (String name : datasetNames) {
                branches.put(name, analyze(store.get(name), request).getRecords());
                // analyze() clears the context on exit
                AppLogger.setOperationContext(AppLogger.OP_BRANCH_COMPARISON);
            }
            BranchComparator.BranchComparison comparison = branchComparator.compare(branches);
            AppLogger.logEvent("BRANCHES_COMPARED", "branches=" + branches.size()
                    + ", best=" + comparison.getBestBranch() + ", weak=" + comparison.getWeakBranch());
            return comparison;
        } finally {
            AppLogger.clearOperationContext();
        }
    }

    @Override
    public List<StudentRecord> searchStudents(EngineResult result, String query) {
        return reportAggregator.search(result.getRecords(), query);
    }
}
