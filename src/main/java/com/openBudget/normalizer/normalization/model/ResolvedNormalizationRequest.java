package com.openBudget.normalizer.normalization.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A client request decomposed into strict options.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ResolvedNormalizationRequest {

    private NormalizationMode normalization;

    private Currency currency;

    private boolean inflationAdjusted;

    private boolean showPeriodGrowth;

    /**
     * Options ready for the transform pipeline.
     */
    private TransformationOptions transformation;

    /**
     * True when callers must supply a population denominator for the query's filter.
     */
    public boolean isPerCapita() {
        return normalization == NormalizationMode.PER_CAPITA;
    }
}
