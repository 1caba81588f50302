package com.openBudget.normalizer.normalization.service;

import com.openBudget.normalizer.dataset.exception.DatasetStoreException;
import com.openBudget.normalizer.dataset.model.Dataset;
import com.openBudget.normalizer.dataset.service.DatasetStore;
import com.openBudget.normalizer.normalization.exception.NormalizationDatasetException;
import com.openBudget.normalizer.normalization.model.FactorDatasets;
import com.openBudget.normalizer.normalization.model.FactorMap;
import com.openBudget.normalizer.normalization.model.NormalizationFactors;
import com.openBudget.normalizer.normalization.model.NormalizationResult;
import com.openBudget.normalizer.normalization.model.TimeSeries;
import com.openBudget.normalizer.normalization.model.TransformationOptions;
import com.openBudget.normalizer.normalization.model.YearRange;
import com.openBudget.normalizer.normalization.registry.DatasetRegistry;
import com.openBudget.normalizer.normalization.registry.DimensionDatasetConfig;
import com.openBudget.normalizer.normalization.registry.NormalizationDimension;
import com.openBudget.normalizer.period.Frequency;
import com.openBudget.normalizer.period.PeriodLabels;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Normalizes time series with frequency-matched factors.
 *
 * Responsibilities:
 * - Validate at creation that every required yearly dataset loads
 * - Load each dimension's datasets once and keep them as a process-wide snapshot
 * - Generate factor maps for the caller's frequency and year range on every request
 * - Run the transform pipeline and report failures as a result
 *
 * Use {@link #create} to instantiate, so no caller can hold an unvalidated service.
 */
@Slf4j
public class NormalizationService {

    private final DatasetStore datasetStore;
    private final DatasetRegistry registry;
    private final FactorMapGenerator factorMapGenerator;
    private final TransformPipeline transformPipeline;
    private final Integer configuredReferenceYear;

    /**
     * Replaced wholesale, never mutated. Concurrent first requests may each load the datasets.
     */
    private final AtomicReference<LoadedDatasets> cachedDatasets = new AtomicReference<>();

    private NormalizationService(DatasetStore datasetStore, DatasetRegistry registry,
                                 FactorMapGenerator factorMapGenerator, TransformPipeline transformPipeline,
                                 Integer configuredReferenceYear) {
        this.datasetStore = datasetStore;
        this.registry = registry;
        this.factorMapGenerator = factorMapGenerator;
        this.transformPipeline = transformPipeline;
        this.configuredReferenceYear = configuredReferenceYear;
    }

    /**
     * Creates and validates a service.
     *
     * @param referenceYear Price level year for inflation adjustment; null for the latest year in the price index
     * @throws NormalizationDatasetException if any required dataset cannot be loaded
     */
    public static NormalizationService create(DatasetStore datasetStore, DatasetRegistry registry, Integer referenceYear) {
        return create(datasetStore, registry, new FactorMapGenerator(), new TransformPipeline(), referenceYear);
    }

    public static NormalizationService create(DatasetStore datasetStore, DatasetRegistry registry,
                                              FactorMapGenerator factorMapGenerator, TransformPipeline transformPipeline,
                                              Integer referenceYear) {
        NormalizationService service = new NormalizationService(
                datasetStore, registry, factorMapGenerator, transformPipeline, referenceYear);
        service.validateRequiredDatasets();
        return service;
    }

    private void validateRequiredDatasets() {
        List<String> requiredIds = registry.requiredDatasetIds();
        Map<String, String> errors = new LinkedHashMap<>();

        for (String id : requiredIds) {
            try {
                datasetStore.getById(id);
            } catch (DatasetStoreException e) {
                errors.put(id, e.getMessage());
            } catch (RuntimeException e) {
                errors.put(id, e.getClass().getSimpleName() + ": " + e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            log.error("Normalization dataset validation failed - missing: {}", errors.keySet());
            throw new NormalizationDatasetException(errors);
        }
        log.info("Normalization datasets validated - required: {}", requiredIds.size());
    }

    /**
     * Generates frequency-matched factors for the year range.
     *
     * @throws NormalizationDatasetException if a required dataset fails while reloading
     */
    public NormalizationFactors generateFactors(Frequency frequency, int startYear, int endYear) {
        LoadedDatasets datasets = loadDatasets();

        return NormalizationFactors.builder()
                .cpi(factorMapGenerator.generate(frequency, startYear, endYear, datasets.get(NormalizationDimension.CPI)))
                .eur(factorMapGenerator.generate(frequency, startYear, endYear, datasets.get(NormalizationDimension.EUR)))
                .usd(factorMapGenerator.generate(frequency, startYear, endYear, datasets.get(NormalizationDimension.USD)))
                .gdp(factorMapGenerator.generate(frequency, startYear, endYear, datasets.get(NormalizationDimension.GDP)))
                .population(factorMapGenerator.generate(frequency, startYear, endYear, datasets.get(NormalizationDimension.POPULATION)))
                .cpiReference(datasets.getCpiReference())
                .cpiReferenceYear(datasets.getCpiReferenceYear())
                .build();
    }

    /**
     * Normalizes a series.
     *
     * @param series Raw nominal series
     * @param options Strict transformation options
     * @param frequency Frequency of the series labels
     * @param yearRange Years to generate factors for
     * @return the normalized series, or a failure carrying the error message
     */
    public NormalizationResult normalize(TimeSeries series, TransformationOptions options,
                                         Frequency frequency, YearRange yearRange) {
        return normalize(series, options, frequency, yearRange, null);
    }

    /**
     * Normalizes a series, dividing per-capita values by a filter-specific population
     * instead of the population dataset when {@code populationDenominator} is given.
     */
    public NormalizationResult normalize(TimeSeries series, TransformationOptions options, Frequency frequency,
                                         YearRange yearRange, BigDecimal populationDenominator) {
        try {
            NormalizationFactors factors = generateFactors(frequency, yearRange.getStartYear(), yearRange.getEndYear());
            if (populationDenominator != null) {
                factors = factors.withConstantPopulation(populationDenominator,
                        PeriodLabels.labelsFor(yearRange.getStartYear(), yearRange.getEndYear(), frequency));
            }
            TimeSeries normalized = transformPipeline.transform(series, options, factors, frequency);
            log.debug("Normalized series - frequency: {}, points: {}, mode: {}, currency: {}, inflation: {}, growth: {}",
                    frequency, normalized.getPoints().size(), options.getNormalization(),
                    options.effectiveCurrency(), options.isInflationAdjusted(), options.isShowPeriodGrowth());
            return NormalizationResult.ok(normalized,
                    factors.getCpiReference() != null ? factors.getCpiReferenceYear() : null);
        } catch (RuntimeException e) {
            log.error("Error normalizing series - frequency: {}, range: {}", frequency, yearRange, e);
            return NormalizationResult.failure(e.getMessage() != null ? e.getMessage() : e.getClass().getName());
        }
    }

    /**
     * Drops the loaded datasets; the next request reloads them from the store.
     */
    public void invalidateCache() {
        cachedDatasets.set(null);
        log.info("Normalization dataset cache invalidated");
    }

    private LoadedDatasets loadDatasets() {
        LoadedDatasets current = cachedDatasets.get();
        if (current != null) {
            return current;
        }

        Map<NormalizationDimension, FactorDatasets> byDimension = new EnumMap<>(NormalizationDimension.class);
        for (NormalizationDimension dimension : NormalizationDimension.values()) {
            DimensionDatasetConfig config = registry.config(dimension);
            byDimension.put(dimension, FactorDatasets.fromDatasets(
                    loadRequiredDataset(config.getYearly()),
                    config.getQuarterly() != null ? loadDataset(config.getQuarterly()) : null,
                    config.getMonthly() != null ? loadDataset(config.getMonthly()) : null));
        }

        FactorMap yearlyCpi = byDimension.get(NormalizationDimension.CPI).getYearly();
        Integer referenceYear = resolveReferenceYear(yearlyCpi);
        BigDecimal reference = referenceYear != null
                ? yearlyCpi.get(PeriodLabels.format(referenceYear, 1, Frequency.YEAR))
                : null;
        if (reference == null) {
            log.warn("No price index for reference year {} - inflation adjustment disabled", referenceYear);
        }

        LoadedDatasets loaded = new LoadedDatasets(byDimension, reference, referenceYear);
        cachedDatasets.set(loaded);
        log.info("Loaded normalization datasets - dimensions: {}, cpiReferenceYear: {}",
                byDimension.size(), referenceYear);
        return loaded;
    }

    /**
     * Nothing is cached when a required dataset fails, so the next request retries the store.
     */
    private Dataset loadRequiredDataset(String id) {
        try {
            return datasetStore.getById(id);
        } catch (DatasetStoreException e) {
            throw new NormalizationDatasetException(Map.of(id, String.valueOf(e.getMessage())));
        }
    }

    private Dataset loadDataset(String id) {
        try {
            return datasetStore.getById(id);
        } catch (DatasetStoreException e) {
            log.warn("Failed to load dataset {}: {}", id, e.getMessage());
            return null;
        }
    }

    /**
     * The configured year, or else the most recent year of the yearly price index.
     */
    private Integer resolveReferenceYear(FactorMap yearlyCpi) {
        if (configuredReferenceYear != null) {
            return configuredReferenceYear;
        }
        Integer latest = null;
        for (String label : yearlyCpi.labels()) {
            Integer year = PeriodLabels.extractYear(label).orElse(null);
            if (year != null && (latest == null || year > latest)) {
                latest = year;
            }
        }
        return latest;
    }

    private static final class LoadedDatasets {

        private final Map<NormalizationDimension, FactorDatasets> byDimension;
        private final BigDecimal cpiReference;
        private final Integer cpiReferenceYear;

        private LoadedDatasets(Map<NormalizationDimension, FactorDatasets> byDimension,
                               BigDecimal cpiReference, Integer cpiReferenceYear) {
            this.byDimension = byDimension;
            this.cpiReference = cpiReference;
            this.cpiReferenceYear = cpiReferenceYear;
        }

        FactorDatasets get(NormalizationDimension dimension) {
            return byDimension.get(dimension);
        }

        BigDecimal getCpiReference() {
            return cpiReference;
        }

        Integer getCpiReferenceYear() {
            return cpiReferenceYear;
        }
    }
}
