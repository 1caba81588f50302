package com.openBudget.normalizer.normalization.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of a normalize call. Failures are reported here instead of thrown.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class NormalizationResult {

    private boolean success;

    /**
     * Normalized series, null when {@link #success} is false.
     */
    private TimeSeries series;

    /**
     * Human-readable failure message, null on success.
     */
    private String errorMessage;

    /**
     * Price level year of inflation-adjusted values; null when no reference was available.
     */
    private Integer cpiReferenceYear;

    public static NormalizationResult ok(TimeSeries series) {
        return ok(series, null);
    }

    public static NormalizationResult ok(TimeSeries series, Integer cpiReferenceYear) {
        return NormalizationResult.builder().success(true).series(series).cpiReferenceYear(cpiReferenceYear).build();
    }

    public static NormalizationResult failure(String errorMessage) {
        return NormalizationResult.builder().success(false).errorMessage(errorMessage).build();
    }
}
