package com.openBudget.normalizer.normalization.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Strict transformation options for one normalization request.
 * Legacy combined modes are decomposed before reaching this type.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TransformationOptions {

    @Builder.Default
    private NormalizationMode normalization = NormalizationMode.TOTAL;

    /**
     * Target currency; null is treated as {@link Currency#LOCAL}.
     */
    private Currency currency;

    /**
     * Whether to express values at the reference year's price level.
     */
    private boolean inflationAdjusted;

    /**
     * Whether to replace values by period-over-period growth percentages.
     */
    private boolean showPeriodGrowth;

    public Currency effectiveCurrency() {
        return currency != null ? currency : Currency.LOCAL;
    }
}
