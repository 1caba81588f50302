package com.openBudget.normalizer.analytics.service;

import com.openBudget.normalizer.normalization.model.TimeSeries;
import com.openBudget.normalizer.period.Frequency;
import com.openBudget.normalizer.population.model.AnalyticsFilter;

/**
 * Produces raw nominal series, in local currency, from the budget line-item store.
 */
public interface RawSeriesSource {

    /**
     * Sums the amounts selected by the filter, one point per period of the frequency.
     */
    TimeSeries fetch(AnalyticsFilter filter, Frequency frequency);
}
