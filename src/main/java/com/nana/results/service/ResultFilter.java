package com.nana.results.service;

import com.nana.results.domain.StudentRecord;

import java.util.Locale;

/**
 * ResultFilter - Ranked Listing Filter
 */
public enum ResultFilter {

    ALL,
    PASS,
    FAIL;

    /**
     * @param record a record
     * @param metric active metric; decides what "passing" means
     * @return true if the record is shown under this filter
     */
    public boolean accepts(StudentRecord record, RankMetric metric) {
        return switch (this) {
            case ALL  -> true;
            case PASS -> metric.isPassing(record);
            case FAIL -> !metric.isPassing(record);
        };
    }

    /**
     * @param text filter name, any case
     * @return the filter
     * @throws IllegalArgumentException for unknown names
     */
    public static ResultFilter parse(String text) {
        if (text == null || text.isBlank()) {
            return ALL;
        }
        return valueOf(text.trim().toUpperCase(Locale.ROOT));
    }
}
