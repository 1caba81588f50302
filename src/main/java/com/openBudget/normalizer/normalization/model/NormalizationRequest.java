package com.openBudget.normalizer.normalization.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Normalization options as a client sends them. Every field is optional.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class NormalizationRequest {

    /**
     * Requested mode; null means {@link LegacyNormalization#TOTAL}.
     */
    private LegacyNormalization normalization;

    /**
     * Explicit currency; overrides the currency implied by {@link #normalization}.
     */
    private Currency currency;

    private Boolean inflationAdjusted;

    private Boolean showPeriodGrowth;
}
