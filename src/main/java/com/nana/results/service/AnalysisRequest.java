package com.nana.results.service;

import com.nana.results.domain.CreditConfig;
import com.nana.results.domain.SectionConfig;

/**
 * AnalysisRequest - Configuration of One Engine Run
 *
 * <p>Section rules, an optional credit table (null means "no SGPA"), and
 * the rank metric. Defaults: no section rules, no credits, total marks.
 */
public final class AnalysisRequest {

    private final SectionConfig sections;
    private final CreditConfig credits;
    private final RankMetric metric;

    private AnalysisRequest(Builder builder) {
        this.sections = builder.sections == null ? SectionConfig.none() : builder.sections;
        this.credits  = builder.credits;
        this.metric   = builder.metric == null ? RankMetric.TOTAL_MARKS : builder.metric;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** @return a request with every default */
    public static AnalysisRequest defaults() {
        return builder().build();
    }

    public SectionConfig getSections() { return sections; }

    /** @return credit table, or null when SGPA was not requested */
    public CreditConfig getCredits()   { return credits; }

    public boolean isSgpaRequested()   { return credits != null; }

    public RankMetric getMetric()      { return metric; }

    @Override
    public String toString() {
        return "AnalysisRequest{" + sections + ", credits=" + credits + ", metric=" + metric.name() + "}";
    }

    public static final class Builder {

        private SectionConfig sections;
        private CreditConfig credits;
        private RankMetric metric;

        private Builder() {
        }

        public Builder sections(SectionConfig sections) {
            this.sections = sections;
            return this;
        }

        public Builder credits(CreditConfig credits) {
            this.credits = credits;
            return this;
        }

        public Builder metric(RankMetric metric) {
            this.metric = metric;
            return this;
        }

        public AnalysisRequest build() {
            return new AnalysisRequest(this);
        }
    }
}
