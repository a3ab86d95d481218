package com.nana.results.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * CreditConfig - Subject Credit Weights for SGPA
 *
 * <p>Maps subject code to an integer credit weight. Subjects missing from
 * the map, or mapped to 0, do not take part in SGPA. Range checking (0-4)
 * happens in {@link com.nana.results.service.SgpaEngine#validate(CreditConfig)}
 * so that all problems can be reported together.
 */
public final class CreditConfig {

    private static final CreditConfig EMPTY = new CreditConfig(Collections.emptyMap());

    private final Map<String, Integer> credits;

    private CreditConfig(Map<String, Integer> credits) {
        this.credits = Collections.unmodifiableMap(new LinkedHashMap<>(credits));
    }

    /**
     * @param credits subject code to weight; null weights are dropped
     * @return the configuration
     */
    public static CreditConfig of(Map<String, Integer> credits) {
        if (credits == null) {
            return EMPTY;
        }
        Map<String, Integer> copy = new LinkedHashMap<>();
        credits.forEach((code, weight) -> {
            if (code != null && weight != null) {
                copy.put(code.trim(), weight);
            }
        });
        return new CreditConfig(copy);
    }

    public static CreditConfig empty() {
        return EMPTY;
    }

    /** @return subject code to weight, in insertion order */
    public Map<String, Integer> getCredits() {
        return credits;
    }

    /**
     * @param code subject code
     * @return configured weight, 0 when unconfigured
     */
    public int creditFor(String code) {
        return credits.getOrDefault(code, 0);
    }

    /** @return true if no subject carries a positive weight */
    public boolean isEmptyOrZero() {
        return credits.values().stream().noneMatch(w -> w > 0);
    }

    @Override
    public String toString() {
        return "CreditConfig" + credits;
    }
}
