package com.openBudget.normalizer.normalization.service;

import com.openBudget.normalizer.normalization.model.Currency;
import com.openBudget.normalizer.normalization.model.DataPoint;
import com.openBudget.normalizer.normalization.model.FactorMap;
import com.openBudget.normalizer.normalization.model.NormalizationFactors;
import com.openBudget.normalizer.normalization.model.NormalizationMode;
import com.openBudget.normalizer.normalization.model.TimeSeries;
import com.openBudget.normalizer.normalization.model.TransformationOptions;
import com.openBudget.normalizer.period.Frequency;
import com.openBudget.normalizer.period.PeriodLabels;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies normalization to a raw series, point by point, with the factor of each
 * point's own period. Because every point carries its own factor, the output can
 * be aggregated safely afterwards.
 *
 * Exactly one branch runs:
 * - PERCENT_GDP: value / (GDP * 1,000,000) * 100, nominal over nominal
 * - otherwise: inflation -> currency -> per capita, each step optional
 * Period-over-period growth is applied last when requested.
 */
public class TransformPipeline {

    static final MathContext MATH_CONTEXT = MathContext.DECIMAL128;

    /**
     * GDP datasets are stored in millions of local currency.
     */
    private static final BigDecimal GDP_UNIT = BigDecimal.valueOf(1_000_000);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public TimeSeries transform(TimeSeries series, TransformationOptions options,
                                NormalizationFactors factors, Frequency frequency) {
        List<DataPoint> data = copyOf(series.getPoints());

        if (options.getNormalization() == NormalizationMode.PERCENT_GDP) {
            data = applyPercentGdp(data, factors.getGdp());
        } else {
            if (options.isInflationAdjusted()) {
                data = applyInflation(data, factors.getCpi(), factors.getCpiReference());
            }

            Currency currency = options.effectiveCurrency();
            if (currency.isForeign()) {
                data = applyCurrency(data, currency == Currency.EUR ? factors.getEur() : factors.getUsd());
            }

            if (options.getNormalization() == NormalizationMode.PER_CAPITA) {
                data = applyPerCapita(data, factors.getPopulation());
            }
        }

        if (options.isShowPeriodGrowth()) {
            data = applyGrowth(data, frequency);
        }

        return TimeSeries.of(series.getFrequency() != null ? series.getFrequency() : frequency, data);
    }

    /**
     * Missing or zero GDP yields 0 for the point; the point is kept.
     */
    List<DataPoint> applyPercentGdp(List<DataPoint> data, FactorMap gdpMap) {
        List<DataPoint> result = new ArrayList<>(data.size());
        for (DataPoint point : data) {
            BigDecimal gdp = gdpMap.get(point.getLabel());
            if (isAbsentOrZero(gdp)) {
                result.add(point.withValue(BigDecimal.ZERO));
                continue;
            }
            BigDecimal share = point.getValue()
                    .divide(gdp.multiply(GDP_UNIT), MATH_CONTEXT)
                    .multiply(HUNDRED, MATH_CONTEXT);
            result.add(point.withValue(share));
        }
        return result;
    }

    /**
     * value * (reference / index). Points without a usable index pass through unchanged.
     */
    List<DataPoint> applyInflation(List<DataPoint> data, FactorMap cpiMap, BigDecimal reference) {
        if (isAbsentOrZero(reference)) {
            return data;
        }
        List<DataPoint> result = new ArrayList<>(data.size());
        for (DataPoint point : data) {
            BigDecimal index = cpiMap.get(point.getLabel());
            if (isAbsentOrZero(index)) {
                result.add(point);
                continue;
            }
            result.add(point.withValue(point.getValue().multiply(reference.divide(index, MATH_CONTEXT), MATH_CONTEXT)));
        }
        return result;
    }

    List<DataPoint> applyCurrency(List<DataPoint> data, FactorMap rateMap) {
        return divideBy(data, rateMap);
    }

    List<DataPoint> applyPerCapita(List<DataPoint> data, FactorMap populationMap) {
        return divideBy(data, populationMap);
    }

    /**
     * Growth against the previous period found by label, so gaps in the series
     * are not bridged. No predecessor or a zero predecessor gives 0.
     */
    List<DataPoint> applyGrowth(List<DataPoint> data, Frequency frequency) {
        Map<String, BigDecimal> byLabel = new HashMap<>();
        for (DataPoint point : data) {
            byLabel.put(point.getLabel(), point.getValue());
        }

        List<DataPoint> result = new ArrayList<>(data.size());
        for (DataPoint point : data) {
            BigDecimal previous = PeriodLabels.previousLabel(point.getLabel(), frequency)
                    .map(byLabel::get)
                    .orElse(null);
            if (isAbsentOrZero(previous)) {
                result.add(point.withValue(BigDecimal.ZERO));
                continue;
            }
            BigDecimal growth = point.getValue().subtract(previous)
                    .divide(previous, MATH_CONTEXT)
                    .multiply(HUNDRED, MATH_CONTEXT);
            result.add(point.withValue(growth));
        }
        return result;
    }

    private List<DataPoint> divideBy(List<DataPoint> data, FactorMap divisors) {
        List<DataPoint> result = new ArrayList<>(data.size());
        for (DataPoint point : data) {
            BigDecimal divisor = divisors.get(point.getLabel());
            if (isAbsentOrZero(divisor)) {
                result.add(point);
                continue;
            }
            result.add(point.withValue(point.getValue().divide(divisor, MATH_CONTEXT)));
        }
        return result;
    }

    /**
     * Output points are never the caller's instances.
     */
    private static List<DataPoint> copyOf(List<DataPoint> points) {
        if (points == null) {
            return List.of();
        }
        List<DataPoint> copy = new ArrayList<>(points.size());
        for (DataPoint point : points) {
            copy.add(point.withValue(point.getValue()));
        }
        return copy;
    }

    private static boolean isAbsentOrZero(BigDecimal value) {
        return value == null || value.signum() == 0;
    }
}
