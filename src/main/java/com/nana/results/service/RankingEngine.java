package com.nana.results.service;

import com.nana.results.domain.StudentRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * RankingEngine - Competition Ranks on a Chosen Metric
 *
 * <p>Only students passing under the active metric are ranked (see
 * {@link RankMetric#isPassing(StudentRecord)}). Ranking is descending
 * "competition" ranking: equal values share a rank and the next distinct
 * value skips ahead by the size of the tie group (90, 90, 85 rank 1, 1, 3).
 *
 * <p>Ranks are computed once over the whole class and once within each
 * section. Everybody else gets null ranks.
 */
public class RankingEngine {

    private static final Logger log = LoggerFactory.getLogger(RankingEngine.class);

    /** Descending by metric value, then by row order. */
    static Comparator<StudentRecord> byMetricDescending(RankMetric metric) {
        return Comparator.comparingDouble((StudentRecord r) -> metric.extract(r)).reversed()
                         .thenComparingInt(StudentRecord::getRowIndex);
    }

    /**
     * Assigns class and section ranks.
     *
     * @param records records in row order
     * @param metric  active metric
     * @return new records, same order, with ranks set or cleared
     */
    public List<StudentRecord> rank(List<StudentRecord> records, RankMetric metric) {
        List<StudentRecord> eligible = records.stream()
                .filter(metric::isPassing)
                .collect(Collectors.toList());

        Map<Integer, Integer> classRanks = competitionRanks(eligible, metric);

        Map<String, List<StudentRecord>> bySection = new LinkedHashMap<>();
        for (StudentRecord record : eligible) {
            bySection.computeIfAbsent(record.getSection(), s -> new ArrayList<>()).add(record);
        }
        Map<Integer, Integer> sectionRanks = new HashMap<>();
        bySection.values().forEach(group -> sectionRanks.putAll(competitionRanks(group, metric)));

        List<StudentRecord> out = new ArrayList<>(records.size());
        for (StudentRecord record : records) {
            out.add(record.toBuilder()
                          .classRank(classRanks.get(record.getRowIndex()))
                          .sectionRank(sectionRanks.get(record.getRowIndex()))
                          .build());
        }
        log.debug("Ranked {} of {} student(s) by {} across {} section(s).",
                eligible.size(), records.size(), metric, bySection.size());
        return out;
    }

    /**
     * Computes competition ranks for one group.
     *
     * @param group  eligible records
     * @param metric active metric
     * @return row index to rank
     */
    public Map<Integer, Integer> competitionRanks(List<StudentRecord> group, RankMetric metric) {
        List<StudentRecord> sorted = new ArrayList<>(group);
        sorted.sort(byMetricDescending(metric));

        Map<Integer, Integer> ranks = new HashMap<>();
        int rank = 0;
        double previous = Double.NaN;
        for (int i = 0; i < sorted.size(); i++) {
            double value = metric.extract(sorted.get(i));
            if (i == 0 || Double.compare(value, previous) != 0) {
                rank = i + 1;
                previous = value;
            }
            ranks.put(sorted.get(i).getRowIndex(), rank);
        }
        return ranks;
    }

    /**
     * Orders records for display: passing students first by metric
     * descending, then the others by metric descending, ties by row order.
     *
     * @param records records to list
     * @param metric  active metric
     * @param filter  which records to keep
     * @return filtered, ordered records
     */
    public List<StudentRecord> rankedListing(List<StudentRecord> records,
                                             RankMetric metric,
                                             ResultFilter filter) {
        Comparator<StudentRecord> passingFirst =
                Comparator.comparing((StudentRecord r) -> !metric.isPassing(r));
        return records.stream()
                .filter(r -> filter.accepts(r, metric))
                .sorted(passingFirst.thenComparing(byMetricDescending(metric)))
                .collect(Collectors.toList());
    }
}
