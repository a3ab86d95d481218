package com.nana.results.service;

import com.nana.results.domain.StudentRecord;
import com.nana.results.domain.SubjectSchema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * EngineResult - Output of One Engine Run
 *
 * <p>Records are in row order. {@code metric} is the metric actually used,
 * which is {@link RankMetric#TOTAL_MARKS} when SGPA ranking was asked for
 * but SGPA could not be computed. Warnings are user-facing sentences.
 */
public final class EngineResult {

    private final String datasetName;
    private final SubjectSchema schema;
    private final List<StudentRecord> records;
    private final ReportBundle reports;
    private final RankMetric metric;
    private final boolean sgpaComputed;
    private final List<String> warnings;

    public EngineResult(String datasetName,
                        SubjectSchema schema,
                        List<StudentRecord> records,
                        ReportBundle reports,
                        RankMetric metric,
                        boolean sgpaComputed,
                        List<String> warnings) {
        this.datasetName  = datasetName;
        this.schema       = schema;
        this.records      = Collections.unmodifiableList(new ArrayList<>(records));
        this.reports      = reports;
        this.metric       = metric;
        this.sgpaComputed = sgpaComputed;
        this.warnings     = Collections.unmodifiableList(new ArrayList<>(warnings));
    }

    public String getDatasetName()          { return datasetName; }

    public SubjectSchema getSchema()        { return schema; }

    public List<StudentRecord> getRecords() { return records; }

    public ReportBundle getReports()        { return reports; }

    public RankMetric getMetric()           { return metric; }

    public boolean isSgpaComputed()         { return sgpaComputed; }

    public List<String> getWarnings()       { return warnings; }

    public boolean hasWarnings()            { return !warnings.isEmpty(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EngineResult other)) return false;
        return sgpaComputed == other.sgpaComputed
               && Objects.equals(datasetName, other.datasetName)
               && Objects.equals(schema.getCodes(), other.schema.getCodes())
               && records.equals(other.records)
               && reports.equals(other.reports)
               && metric == other.metric
               && warnings.equals(other.warnings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(datasetName, schema.getCodes(), records, reports, metric, sgpaComputed, warnings);
    }

    @Override
    public String toString() {
        return "EngineResult{dataset='" + datasetName + "', students=" + records.size()
               + ", subjects=" + schema.getSubjectCount() + ", metric=" + metric.name()
               + ", warnings=" + warnings.size() + "}";
    }
}
