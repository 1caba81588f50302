package com.openBudget.normalizer.normalization.registry;

import com.openBudget.normalizer.period.Frequency;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Static table of the datasets behind each normalization dimension.
 *
 * Yearly data is the only required granularity; quarterly and monthly datasets
 * are optional and only improve accuracy when present. This class performs no I/O,
 * checking that the datasets exist is done by the normalization service at start-up.
 */
public class DatasetRegistry {

    private final Map<NormalizationDimension, DimensionDatasetConfig> configs;

    public DatasetRegistry(Map<NormalizationDimension, DimensionDatasetConfig> configs) {
        EnumMap<NormalizationDimension, DimensionDatasetConfig> copy = new EnumMap<>(NormalizationDimension.class);
        for (NormalizationDimension dimension : NormalizationDimension.values()) {
            DimensionDatasetConfig config = configs.get(dimension);
            if (config == null || config.getYearly() == null || config.getYearly().isBlank()) {
                throw new IllegalArgumentException("A yearly dataset id is required for dimension " + dimension);
            }
            copy.put(dimension, new DimensionDatasetConfig(config.getYearly(), config.getQuarterly(), config.getMonthly()));
        }
        this.configs = Collections.unmodifiableMap(copy);
    }

    /**
     * Registry of the national statistics datasets (INSSE price index, GDP and
     * population; BNR exchange rates). Only yearly series are published today.
     */
    public static DatasetRegistry defaults() {
        Map<NormalizationDimension, DimensionDatasetConfig> configs = new EnumMap<>(NormalizationDimension.class);
        configs.put(NormalizationDimension.CPI, yearlyOnly("ro.economics.cpi.yearly"));
        configs.put(NormalizationDimension.EUR, yearlyOnly("ro.economics.exchange.ron_eur.yearly"));
        configs.put(NormalizationDimension.USD, yearlyOnly("ro.economics.exchange.ron_usd.yearly"));
        configs.put(NormalizationDimension.GDP, yearlyOnly("ro.economics.gdp.yearly"));
        configs.put(NormalizationDimension.POPULATION, yearlyOnly("ro.demographics.population.yearly"));
        return new DatasetRegistry(configs);
    }

    private static DimensionDatasetConfig yearlyOnly(String yearlyId) {
        return DimensionDatasetConfig.builder().yearly(yearlyId).build();
    }

    public DimensionDatasetConfig config(NormalizationDimension dimension) {
        return configs.get(dimension);
    }

    /**
     * Yearly dataset ids of every dimension, in dimension order.
     */
    public List<String> requiredDatasetIds() {
        List<String> ids = new ArrayList<>();
        for (DimensionDatasetConfig config : configs.values()) {
            ids.add(config.getYearly());
        }
        return ids;
    }

    /**
     * All configured dataset ids of a dimension: yearly, then quarterly and monthly when present.
     */
    public List<String> dimensionDatasetIds(NormalizationDimension dimension) {
        DimensionDatasetConfig config = configs.get(dimension);
        List<String> ids = new ArrayList<>();
        ids.add(config.getYearly());
        if (config.getQuarterly() != null) {
            ids.add(config.getQuarterly());
        }
        if (config.getMonthly() != null) {
            ids.add(config.getMonthly());
        }
        return ids;
    }

    public List<String> allDatasetIds() {
        List<String> ids = new ArrayList<>();
        for (NormalizationDimension dimension : configs.keySet()) {
            ids.addAll(dimensionDatasetIds(dimension));
        }
        return ids;
    }

    /**
     * The dataset at the requested frequency when configured, otherwise the next
     * coarser one, ending at yearly. Diagnostic only: factor generation does its own
     * per-period fallback.
     */
    public String bestAvailableId(NormalizationDimension dimension, Frequency frequency) {
        DimensionDatasetConfig config = configs.get(dimension);

        if (frequency == Frequency.MONTH && config.getMonthly() != null) {
            return config.getMonthly();
        }
        if ((frequency == Frequency.MONTH || frequency == Frequency.QUARTER) && config.getQuarterly() != null) {
            return config.getQuarterly();
        }
        return config.getYearly();
    }

    /**
     * Whether the dimension has any dataset finer than {@code frequency}.
     */
    public boolean hasHigherFrequencyData(NormalizationDimension dimension, Frequency frequency) {
        DimensionDatasetConfig config = configs.get(dimension);
        switch (frequency) {
            case YEAR:
                return config.getQuarterly() != null || config.getMonthly() != null;
            case QUARTER:
                return config.getMonthly() != null;
            default:
                return false;
        }
    }
}
