package com.openBudget.normalizer.normalization.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Frequency-matched factors for one (frequency, year range) request.
 * Every map is keyed by period labels at the request frequency.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class NormalizationFactors {

    /**
     * Price index per period.
     */
    @Builder.Default
    private FactorMap cpi = FactorMap.empty();

    /**
     * Local currency units per EUR.
     */
    @Builder.Default
    private FactorMap eur = FactorMap.empty();

    /**
     * Local currency units per USD.
     */
    @Builder.Default
    private FactorMap usd = FactorMap.empty();

    /**
     * Nominal GDP in millions of local currency.
     */
    @Builder.Default
    private FactorMap gdp = FactorMap.empty();

    @Builder.Default
    private FactorMap population = FactorMap.empty();

    /**
     * Price index of the anchor year; null disables inflation adjustment.
     */
    private BigDecimal cpiReference;

    /**
     * Anchor year inflation-adjusted values are expressed in.
     */
    private Integer cpiReferenceYear;

    /**
     * Returns a copy whose population factor is the given denominator for every
     * label of the current population map and of {@code labels}.
     */
    public NormalizationFactors withConstantPopulation(BigDecimal denominator, Iterable<String> labels) {
        Map<String, BigDecimal> constant = new LinkedHashMap<>();
        for (String label : population.labels()) {
            constant.put(label, denominator);
        }
        for (String label : labels) {
            constant.put(label, denominator);
        }
        return toBuilder().population(FactorMap.of(constant)).build();
    }
}
