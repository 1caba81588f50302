package com.openBudget.normalizer.normalization.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable mapping from period label to factor. May be sparse: a missing
 * label means "no adjustment available", never zero.
 */
public final class FactorMap {

    private static final FactorMap EMPTY = new FactorMap(Collections.emptyMap());

    private final Map<String, BigDecimal> factors;

    private FactorMap(Map<String, BigDecimal> factors) {
        this.factors = factors;
    }

    public static FactorMap empty() {
        return EMPTY;
    }

    /**
     * Copies the entries, keeping their iteration order.
     */
    public static FactorMap of(Map<String, BigDecimal> factors) {
        return new FactorMap(Collections.unmodifiableMap(new LinkedHashMap<>(factors)));
    }

    /**
     * @return the factor for the label, or null when absent
     */
    public BigDecimal get(String label) {
        return factors.get(label);
    }

    public boolean contains(String label) {
        return factors.containsKey(label);
    }

    public Set<String> labels() {
        return factors.keySet();
    }

    public int size() {
        return factors.size();
    }

    public boolean isEmpty() {
        return factors.isEmpty();
    }

    public Map<String, BigDecimal> asMap() {
        return factors;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FactorMap)) {
            return false;
        }
        return factors.equals(((FactorMap) o).factors);
    }

    @Override
    public int hashCode() {
        return factors.hashCode();
    }

    @Override
    public String toString() {
        return "FactorMap" + factors;
    }
}
