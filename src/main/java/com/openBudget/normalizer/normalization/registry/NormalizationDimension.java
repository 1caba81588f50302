package com.openBudget.normalizer.normalization.registry;

/**
 * Reference data a normalization can depend on.
 */
public enum NormalizationDimension {
    /** Consumer price index, for inflation adjustment */
    CPI,
    /** Local currency / EUR exchange rate */
    EUR,
    /** Local currency / USD exchange rate */
    USD,
    /** Nominal GDP, for percent-of-GDP */
    GDP,
    POPULATION
}
