package com.nana.results.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * SectionConfig - Section Assignment Rules
 *
 * <p>Holds two independent rule sets:
 * <ol>
 *   <li>an explicit {@code student id -> section} table, and</li>
 *   <li>ordered identifier range rules, one {@link SectionRange} per
 *       section.</li>
 * </ol>
 * When a student appears in the explicit table that entry is used; range
 * rules are only consulted for students the table does not mention.
 *
 * <p>Explicit keys are stored normalised (upper-case, whitespace removed)
 * so that {@code " 1rv22cs001 "} and {@code "1RV22CS001"} are the same key.
 *
 * <p>The result cache keys on {@link #getRanges()} and
 * {@link #getExplicitMapping()} directly, through {@link SectionRange}
 * equality.
 */
public final class SectionConfig {

    private static final SectionConfig NONE = new Builder().build();

    private final List<SectionRange> ranges;
    private final Map<String, String> explicitMapping;

    private SectionConfig(Builder builder) {
        this.ranges          = Collections.unmodifiableList(new ArrayList<>(builder.ranges));
        this.explicitMapping = Collections.unmodifiableMap(new LinkedHashMap<>(builder.explicitMapping));
    }

    /** @return configuration with no rules; every student is Unassigned */
    public static SectionConfig none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Normalises a student identifier for explicit-table lookup.
     *
     * @param studentId raw identifier
     * @return upper-cased identifier with all whitespace removed
     */
    public static String normalizeId(String studentId) {
        if (studentId == null) {
            return "";
        }
        return studentId.replaceAll("\\s+", "").toUpperCase(Locale.ROOT);
    }

    // -----------------------------------------------------------------------
    // ACCESSORS
    // -----------------------------------------------------------------------

    public List<SectionRange> getRanges() {
        return ranges;
    }

    /** @return normalised id to section name */
    public Map<String, String> getExplicitMapping() {
        return explicitMapping;
    }

    public boolean hasRanges() {
        return !ranges.isEmpty();
    }

    public boolean hasExplicitMapping() {
        return !explicitMapping.isEmpty();
    }

    /**
     * @param studentId raw identifier
     * @return explicitly mapped section, or null
     */
    public String explicitSectionFor(String studentId) {
        return explicitMapping.get(normalizeId(studentId));
    }

    @Override
    public String toString() {
        return "SectionConfig{ranges=" + ranges.size()
               + ", explicit=" + explicitMapping.size() + "}";
    }

    // -----------------------------------------------------------------------
    // BUILDER
    // -----------------------------------------------------------------------

    public static final class Builder {

        private final List<SectionRange> ranges = new ArrayList<>();
        private final Map<String, String> explicitMapping = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Adds a range rule. Rules are tried in the order they are added.
         *
         * @param sectionName section name
         * @param startId     first identifier of the range
         * @param endId       last identifier of the range
         * @return this builder
         */
        public Builder range(String sectionName, String startId, String endId) {
            ranges.add(new SectionRange(sectionName, startId, endId));
            return this;
        }

        /**
         * Adds an explicit mapping. A later mapping for the same normalised
         * identifier replaces the earlier one.
         *
         * @param studentId   student identifier
         * @param sectionName section name
         * @return this builder
         */
        public Builder assign(String studentId, String sectionName) {
            String key = normalizeId(studentId);
            if (!key.isEmpty() && sectionName != null) {
                explicitMapping.put(key, sectionName.trim());
            }
            return this;
        }

        /**
         * Adds every entry of an explicit table.
         *
         * @param mapping student id to section name
         * @return this builder
         */
        public Builder assignAll(Map<String, String> mapping) {
            if (mapping != null) {
                mapping.forEach(this::assign);
            }
            return this;
        }

        public SectionConfig build() {
            return new SectionConfig(this);
        }
    }
}
