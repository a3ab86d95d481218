package com.nana.results.domain;

import java.util.Objects;

/**
 * SectionRange - Identifier Range Rule for One Section
 *
 * <p>Bounds are kept as the identifiers the user typed (for example
 * {@code 1RV22CS001} and {@code 1RV22CS060}); only their trailing digit
 * runs are compared, by {@link com.nana.results.service.SectionAssigner}.
 */
public final class SectionRange {

    private final String sectionName;
    private final String startId;
    private final String endId;

    public SectionRange(String sectionName, String startId, String endId) {
        this.sectionName = Objects.requireNonNull(sectionName, "sectionName").trim();
        this.startId     = startId == null ? "" : startId.trim();
        this.endId       = endId == null ? "" : endId.trim();
    }

    public String getSectionName() { return sectionName; }

    public String getStartId()     { return startId; }

    public String getEndId()       { return endId; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SectionRange other)) return false;
        return sectionName.equals(other.sectionName)
               && startId.equals(other.startId)
               && endId.equals(other.endId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sectionName, startId, endId);
    }

    @Override
    public String toString() {
        return sectionName + "=" + startId + ".." + endId;
    }
}
