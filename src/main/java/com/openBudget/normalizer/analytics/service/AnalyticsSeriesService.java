package com.openBudget.normalizer.analytics.service;

import com.openBudget.normalizer.analytics.exception.AnalyticsSeriesException;
import com.openBudget.normalizer.analytics.model.AnalyticsSeries;
import com.openBudget.normalizer.analytics.model.AnalyticsSeriesRequest;
import com.openBudget.normalizer.analytics.model.Axis;
import com.openBudget.normalizer.config.NormalizationProperties;
import com.openBudget.normalizer.normalization.model.DataPoint;
import com.openBudget.normalizer.normalization.model.NormalizationMode;
import com.openBudget.normalizer.normalization.model.NormalizationResult;
import com.openBudget.normalizer.normalization.model.ResolvedNormalizationRequest;
import com.openBudget.normalizer.normalization.model.TimeSeries;
import com.openBudget.normalizer.normalization.model.TransformationOptions;
import com.openBudget.normalizer.normalization.model.YearRange;
import com.openBudget.normalizer.normalization.service.NormalizationRequestResolver;
import com.openBudget.normalizer.normalization.service.NormalizationService;
import com.openBudget.normalizer.period.Frequency;
import com.openBudget.normalizer.population.service.PopulationDenominatorResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Year;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Analytics series use case.
 *
 * Flow:
 * 1. Decompose the client's normalization options into strict options
 * 2. Fetch the raw nominal series for the filter
 * 3. Resolve the filter's population when per-capita is requested
 * 4. Normalize every point before anything is aggregated
 * 5. Sort by period and describe the axes
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalyticsSeriesService {

    private final ObjectProvider<RawSeriesSource> rawSeriesSource;
    private final NormalizationService normalizationService;
    private final PopulationDenominatorResolver populationDenominatorResolver;
    private final NormalizationProperties properties;
    private final Clock clock;

    /**
     * Produces the normalized series for a query.
     *
     * @throws AnalyticsSeriesException if the raw series cannot be fetched or normalization fails
     */
    public AnalyticsSeries getSeries(AnalyticsSeriesRequest request) {
        Frequency frequency = request.getFrequency() != null ? request.getFrequency() : Frequency.YEAR;
        ResolvedNormalizationRequest resolved = NormalizationRequestResolver.resolve(request.getNormalization());
        log.debug("Analytics series requested - seriesId: {}, frequency: {}, mode: {}, currency: {}",
                request.getSeriesId(), frequency, resolved.getNormalization(), resolved.getCurrency());

        TimeSeries raw = fetchRawSeries(request, frequency);

        TransformationOptions options = resolved.getTransformation();
        BigDecimal populationDenominator = null;
        if (resolved.isPerCapita()) {
            populationDenominator = populationDenominatorResolver
                    .resolve(request.getFilter(), resolved.getNormalization())
                    .orElse(null);
            if (populationDenominator == null) {
                log.warn("No population denominator for seriesId: {} - returning totals", request.getSeriesId());
                options = TransformationOptions.builder()
                        .normalization(NormalizationMode.TOTAL)
                        .currency(options.getCurrency())
                        .inflationAdjusted(options.isInflationAdjusted())
                        .showPeriodGrowth(options.isShowPeriodGrowth())
                        .build();
            }
        }

        List<String> labels = raw.getPoints().stream().map(DataPoint::getLabel).collect(Collectors.toList());
        YearRange yearRange = YearRange.covering(labels, Year.now(clock).getValue());

        NormalizationResult result = normalizationService.normalize(raw, options, frequency, yearRange, populationDenominator);
        if (!result.isSuccess()) {
            log.error("Normalization failed - seriesId: {}, error: {}", request.getSeriesId(), result.getErrorMessage());
            throw new AnalyticsSeriesException("Failed to normalize series " + request.getSeriesId()
                    + ": " + result.getErrorMessage());
        }

        List<DataPoint> data = new ArrayList<>(result.getSeries().getPoints());
        data.sort(Comparator.comparing(DataPoint::getLabel));

        return AnalyticsSeries.builder()
                .seriesId(request.getSeriesId())
                .xAxis(Axis.builder().name(xAxisName(frequency)).type("STRING").unit(frequency.getDatasetGranularity()).build())
                .yAxis(Axis.builder().name("Amount").type("FLOAT").unit(yAxisUnit(options, result.getCpiReferenceYear())).build())
                .data(data)
                .build();
    }

    private TimeSeries fetchRawSeries(AnalyticsSeriesRequest request, Frequency frequency) {
        RawSeriesSource source = rawSeriesSource.getIfAvailable();
        if (source == null) {
            throw new AnalyticsSeriesException("No raw series source is configured");
        }
        try {
            TimeSeries raw = source.fetch(request.getFilter(), frequency);
            if (raw == null || raw.getPoints() == null) {
                return TimeSeries.of(frequency, List.of());
            }
            return raw;
        } catch (RuntimeException e) {
            log.error("Failed to fetch raw series - seriesId: {}", request.getSeriesId(), e);
            throw new AnalyticsSeriesException("Failed to fetch raw series " + request.getSeriesId(), e);
        }
    }

    static String xAxisName(Frequency frequency) {
        switch (frequency) {
            case QUARTER:
                return "Quarter";
            case MONTH:
                return "Month";
            case YEAR:
            default:
                return "Year";
        }
    }

    /**
     * Unit of the normalized values, e.g. "EUR/capita (real 2024)".
     */
    String yAxisUnit(TransformationOptions options, Integer referenceYear) {
        if (options.isShowPeriodGrowth()) {
            return "%";
        }
        if (options.getNormalization() == NormalizationMode.PERCENT_GDP) {
            return "% of GDP";
        }
        StringBuilder unit = new StringBuilder(options.effectiveCurrency().isForeign()
                ? options.effectiveCurrency().name()
                : properties.getLocalCurrencyCode());
        if (options.getNormalization() == NormalizationMode.PER_CAPITA) {
            unit.append("/capita");
        }
        if (options.isInflationAdjusted() && referenceYear != null) {
            unit.append(" (real ").append(referenceYear).append(")");
        }
        return unit.toString();
    }
}
