package com.nana.results.service;

import com.nana.results.domain.StudentRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * ReportBundle - Immutable Report Value Object
 *
 * <p>Everything {@link ReportAggregator} derives from one set of ranked
 * records: per-section category breakdowns ending with the
 * {@link SectionBreakdown#OVERALL} row, top and bottom lists, one topper
 * per section, and the KPI summary.
 *
 * <p>The bundle carries no timestamp, so two runs over the same input
 * produce equal bundles.
 */
public final class ReportBundle {

    private final RankMetric metric;
    private final List<SectionBreakdown> sectionBreakdowns;
    private final List<StudentRecord> topStudents;
    private final List<StudentRecord> bottomStudents;
    private final Map<String, StudentRecord> sectionToppers;
    private final KpiSummary kpiSummary;

    private ReportBundle(Builder builder) {
        this.metric            = Objects.requireNonNull(builder.metric, "metric");
        this.sectionBreakdowns = Collections.unmodifiableList(new ArrayList<>(builder.sectionBreakdowns));
        this.topStudents       = Collections.unmodifiableList(new ArrayList<>(builder.topStudents));
        this.bottomStudents    = Collections.unmodifiableList(new ArrayList<>(builder.bottomStudents));
        this.sectionToppers    = Collections.unmodifiableMap(new LinkedHashMap<>(builder.sectionToppers));
        this.kpiSummary        = Objects.requireNonNull(builder.kpiSummary, "kpiSummary");
    }

    public static Builder builder() {
        return new Builder();
    }

    // -----------------------------------------------------------------------
    // ACCESSORS
    // -----------------------------------------------------------------------

    /** @return metric the top/bottom lists and toppers were chosen by */
    public RankMetric getMetric()                         { return metric; }

    /** @return one row per section in name order, then the Overall row */
    public List<SectionBreakdown> getSectionBreakdowns()  { return sectionBreakdowns; }

    public List<StudentRecord> getTopStudents()           { return topStudents; }

    public List<StudentRecord> getBottomStudents()        { return bottomStudents; }

    /** @return section name to its topper, in section name order */
    public Map<String, StudentRecord> getSectionToppers() { return sectionToppers; }

    public KpiSummary getKpiSummary()                     { return kpiSummary; }

    /**
     * @return the Overall breakdown row
     */
    public SectionBreakdown getOverall() {
        return sectionBreakdowns.get(sectionBreakdowns.size() - 1);
    }

    /**
     * @param section section name
     * @return that section's breakdown, or null
     */
    public SectionBreakdown breakdownFor(String section) {
        for (SectionBreakdown breakdown : sectionBreakdowns) {
            if (breakdown.getSection().equals(section)) {
                return breakdown;
            }
        }
        return null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReportBundle other)) return false;
        return metric == other.metric
               && sectionBreakdowns.equals(other.sectionBreakdowns)
               && topStudents.equals(other.topStudents)
               && bottomStudents.equals(other.bottomStudents)
               && sectionToppers.equals(other.sectionToppers)
               && kpiSummary.equals(other.kpiSummary);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metric, sectionBreakdowns, topStudents, bottomStudents,
                sectionToppers, kpiSummary);
    }

    // -----------------------------------------------------------------------
    // BUILDER
    // -----------------------------------------------------------------------

    public static final class Builder {

        private RankMetric metric = RankMetric.TOTAL_MARKS;
        private List<SectionBreakdown> sectionBreakdowns = new ArrayList<>();
        private List<StudentRecord> topStudents = new ArrayList<>();
        private List<StudentRecord> bottomStudents = new ArrayList<>();
        private Map<String, StudentRecord> sectionToppers = new LinkedHashMap<>();
        private KpiSummary kpiSummary = new KpiSummary(0, 0, 0, 0.0);

        private Builder() {
        }

        public Builder metric(RankMetric metric) {
            this.metric = metric;
            return this;
        }

        public Builder sectionBreakdowns(List<SectionBreakdown> breakdowns) {
            this.sectionBreakdowns = breakdowns == null ? new ArrayList<>() : breakdowns;
            return this;
        }

        public Builder topStudents(List<StudentRecord> topStudents) {
            this.topStudents = topStudents == null ? new ArrayList<>() : topStudents;
            return this;
        }

        public Builder bottomStudents(List<StudentRecord> bottomStudents) {
            this.bottomStudents = bottomStudents == null ? new ArrayList<>() : bottomStudents;
            return this;
        }

        public Builder sectionToppers(Map<String, StudentRecord> sectionToppers) {
            this.sectionToppers = sectionToppers == null ? new LinkedHashMap<>() : sectionToppers;
            return this;
        }

        public Builder kpiSummary(KpiSummary kpiSummary) {
            this.kpiSummary = kpiSummary;
            return this;
        }

        public ReportBundle build() {
            return new ReportBundle(this);
        }
    }
}
