package com.nana.results.service;

import com.nana.results.domain.OverallResult;
import com.nana.results.domain.StudentRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * ReportAggregator - Category Breakdowns, Top/Bottom Lists, Toppers, KPIs
 *
 * <p>Works purely on already classified and ranked records; it never reads
 * the raw sheet. All orderings are total (ties fall back to row order) so
 * repeated runs give identical bundles.
 */
public class ReportAggregator {

    private static final Logger log = LoggerFactory.getLogger(ReportAggregator.class);

    /** Length of the top and bottom lists when not configured. */
    public static final int DEFAULT_TOP_SIZE = 5;

    private final int topSize;

    public ReportAggregator() {
        this(DEFAULT_TOP_SIZE);
    }

    /**
     * @param topSize length of the top and bottom lists; must be positive
     * @throws IllegalArgumentException if {@code topSize < 1}
     */
    public ReportAggregator(int topSize) {
        if (topSize < 1) {
            throw new IllegalArgumentException("Top list size must be at least 1, was " + topSize + ".");
        }
        this.topSize = topSize;
    }

    /**
     * Builds the full report bundle.
     *
     * @param records ranked records
     * @param metric  active metric
     * @return the bundle
     */
    public ReportBundle aggregate(List<StudentRecord> records, RankMetric metric) {
        ReportBundle bundle = ReportBundle.builder()
                .metric(metric)
                .sectionBreakdowns(sectionBreakdowns(records))
                .topStudents(topStudents(records, metric))
                .bottomStudents(bottomStudents(records, metric))
                .sectionToppers(sectionToppers(records, metric))
                .kpiSummary(kpiSummary(records))
                .build();
        log.debug("Report aggregated: {} section row(s), KPI {}.",
                bundle.getSectionBreakdowns().size(), bundle.getKpiSummary());
        return bundle;
    }

    // -------- SECTION BREAKDOWN --------

    /**
     * @param records records to count
     * @return one row per section sorted by name, then the Overall row
     */
    public List<SectionBreakdown> sectionBreakdowns(List<StudentRecord> records) {
        Map<String, List<StudentRecord>> bySection = new TreeMap<>();
        for (StudentRecord record : records) {
            bySection.computeIfAbsent(record.getSection(), s -> new ArrayList<>()).add(record);
        }
        List<SectionBreakdown> rows = new ArrayList<>();
        bySection.forEach((section, group) -> rows.add(count(section, group)));
        rows.add(count(SectionBreakdown.OVERALL, records));
        return rows;
    }

    private SectionBreakdown count(String section, List<StudentRecord> group) {
        int fcd = 0;
        int fc = 0;
        int sc = 0;
        int pass = 0;
        int failed = 0;
        int absent = 0;
        for (StudentRecord record : group) {
            switch (record.getCategory()) {
                case FCD -> fcd++;
                case FC -> fc++;
                case SC -> sc++;
                case PASS_CLASS -> pass++;
                case FAILED -> failed++;
                case ABSENT -> absent++;
            }
        }
        return new SectionBreakdown(section, fcd, fc, sc, pass, failed, absent);
    }

    // -------- TOP / BOTTOM --------

    /**
     * @param records records to choose from
     * @param metric  active metric
     * @return highest metric values first, ties by row order
     */
    public List<StudentRecord> topStudents(List<StudentRecord> records, RankMetric metric) {
        return records.stream()
                .sorted(RankingEngine.byMetricDescending(metric))
                .limit(topSize)
                .collect(Collectors.toList());
    }

    /**
     * @param records records to choose from
     * @param metric  active metric
     * @return lowest metric values first, ties by row order
     */
    public List<StudentRecord> bottomStudents(List<StudentRecord> records, RankMetric metric) {
        Comparator<StudentRecord> ascending =
                Comparator.comparingDouble((StudentRecord r) -> metric.extract(r))
                          .thenComparingInt(StudentRecord::getRowIndex);
        return records.stream()
                .sorted(ascending)
                .limit(topSize)
                .collect(Collectors.toList());
    }

    /**
     * @param records records to choose from
     * @param metric  active metric
     * @return section name to the student with the highest metric value;
     *         the earliest row wins ties
     */
    public Map<String, StudentRecord> sectionToppers(List<StudentRecord> records, RankMetric metric) {
        Map<String, StudentRecord> toppers = new TreeMap<>();
        Comparator<StudentRecord> order = RankingEngine.byMetricDescending(metric);
        for (StudentRecord record : records) {
            toppers.merge(record.getSection(), record,
                    (current, candidate) -> order.compare(candidate, current) < 0 ? candidate : current);
        }
        return new LinkedHashMap<>(toppers);
    }

    // -------- KPI --------

    /**
     * @param records every record of the sheet
     * @return total, present, passed and result percentage
     */
    public KpiSummary kpiSummary(List<StudentRecord> records) {
        int total = records.size();
        int present = (int) records.stream()
                .filter(r -> r.getOverallResult() != OverallResult.A)
                .count();
        int passed = (int) records.stream().filter(StudentRecord::isPassed).count();
        double pct = total == 0 ? 0.0 : MetricsCalculator.round2(passed * 100.0 / total);
        return new KpiSummary(total, present, passed, pct);
    }

    // -------- LOOKUP --------

    /**
     * Case-insensitive substring search over student id and name.
     *
     * @param records records to search
     * @param query   search text; blank matches nothing
     * @return matches in row order
     */
    public List<StudentRecord> search(List<StudentRecord> records, String query) {
        if (query == null || query.isBlank()) {
            return new ArrayList<>();
        }
        String needle = query.trim().toLowerCase(Locale.ROOT);
        return records.stream()
                .filter(r -> r.getStudentId().toLowerCase(Locale.ROOT).contains(needle)
                             || r.getName().toLowerCase(Locale.ROOT).contains(needle))
                .collect(Collectors.toList());
    }
}
