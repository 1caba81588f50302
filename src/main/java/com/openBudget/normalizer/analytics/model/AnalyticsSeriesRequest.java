package com.openBudget.normalizer.analytics.model;

import com.openBudget.normalizer.normalization.model.NormalizationRequest;
import com.openBudget.normalizer.period.Frequency;
import com.openBudget.normalizer.population.model.AnalyticsFilter;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One analytics series query.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AnalyticsSeriesRequest {

    /**
     * Caller-chosen identifier echoed on the result.
     */
    private String seriesId;

    private AnalyticsFilter filter;

    @Builder.Default
    private Frequency frequency = Frequency.YEAR;

    /**
     * Normalization options; null means nominal totals in local currency.
     */
    private NormalizationRequest normalization;
}
