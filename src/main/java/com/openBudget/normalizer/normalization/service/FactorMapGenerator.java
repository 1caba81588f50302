package com.openBudget.normalizer.normalization.service;

import com.openBudget.normalizer.normalization.model.FactorDatasets;
import com.openBudget.normalizer.normalization.model.FactorMap;
import com.openBudget.normalizer.period.Frequency;
import com.openBudget.normalizer.period.PeriodLabels;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds one factor per period of a year range at the requested frequency.
 *
 * Lookup order for each period:
 * 1. the dataset at the requested frequency
 * 2. for months only, the quarterly value of the containing quarter
 * 3. the yearly value, broadcast to every sub-period of the year
 *
 * Periods with no value at any granularity are left out of the map.
 */
@Slf4j
public class FactorMapGenerator {

    public FactorMap generate(Frequency frequency, int startYear, int endYear, FactorDatasets datasets) {
        Map<String, BigDecimal> result = new LinkedHashMap<>();
        int omitted = 0;

        for (int year = startYear; year <= endYear; year++) {
            BigDecimal yearlyValue = lookup(datasets.getYearly(), PeriodLabels.format(year, 1, Frequency.YEAR));

            for (int subPeriod = 1; subPeriod <= frequency.getSubPeriodsPerYear(); subPeriod++) {
                String label = PeriodLabels.format(year, subPeriod, frequency);
                BigDecimal value = exactValue(frequency, label, datasets);

                if (value == null && frequency == Frequency.MONTH) {
                    String quarterLabel = PeriodLabels.format(year, PeriodLabels.quarterOfMonth(subPeriod), Frequency.QUARTER);
                    value = lookup(datasets.getQuarterly(), quarterLabel);
                }
                if (value == null) {
                    value = yearlyValue;
                }

                if (value != null) {
                    result.put(label, value);
                } else {
                    omitted++;
                }
            }
        }

        if (omitted > 0) {
            log.debug("Factor map has gaps - frequency: {}, range: {}-{}, omitted periods: {}",
                    frequency, startYear, endYear, omitted);
        }
        return FactorMap.of(result);
    }

    private BigDecimal exactValue(Frequency frequency, String label, FactorDatasets datasets) {
        switch (frequency) {
            case MONTH:
                return lookup(datasets.getMonthly(), label);
            case QUARTER:
                return lookup(datasets.getQuarterly(), label);
            case YEAR:
            default:
                return lookup(datasets.getYearly(), label);
        }
    }

    private static BigDecimal lookup(FactorMap map, String label) {
        return map != null ? map.get(label) : null;
    }
}
