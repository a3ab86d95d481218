package com.nana.results.service;

import com.nana.results.domain.Dataset;
import com.nana.results.domain.SectionConfig;
import com.nana.results.domain.SectionRange;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * CacheKey - Identity of a Normalised Snapshot
 *
 * <p>Dataset content hash plus the section rules themselves: the range
 * rules in declaration order and the explicit mapping sorted by id.
 * Credits and the rank metric are not part of the key; they are applied
 * on top of the cached snapshot on every call.
 */
public final class CacheKey {

    private final String contentHash;
    private final List<SectionRange> ranges;
    private final SortedMap<String, String> mapping;

    public CacheKey(String contentHash, List<SectionRange> ranges, Map<String, String> mapping) {
        this.contentHash = Objects.requireNonNull(contentHash, "contentHash");
        this.ranges      = ranges == null ? List.of() : List.copyOf(ranges);
        this.mapping     = mapping == null
                ? Collections.emptySortedMap()
                : Collections.unmodifiableSortedMap(new TreeMap<>(mapping));
    }

    public static CacheKey of(Dataset dataset, SectionConfig sections) {
        return new CacheKey(dataset.getContentHash(), sections.getRanges(), sections.getExplicitMapping());
    }

    public String getContentHash()            { return contentHash; }

    public List<SectionRange> getRanges()     { return ranges; }

    public SortedMap<String, String> getMapping() { return mapping; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CacheKey other)) return false;
        return contentHash.equals(other.contentHash)
               && ranges.equals(other.ranges)
               && mapping.equals(other.mapping);
    }

    @Override
    public int hashCode() {
        return Objects.hash(contentHash, ranges, mapping);
    }

    @Override
    public String toString() {
        return "CacheKey{" + contentHash.substring(0, Math.min(12, contentHash.length()))
               + ", ranges=" + ranges.size() + ", mapping=" + mapping.size() + "}";
    }
}
