package com.openBudget.normalizer.normalization.model;

/**
 * Normalization values accepted from clients, including the combined
 * (mode, currency) shortcuts {@link #TOTAL_EURO} and {@link #PER_CAPITA_EURO}.
 */
public enum LegacyNormalization {
    TOTAL,
    TOTAL_EURO,
    PER_CAPITA,
    PER_CAPITA_EURO,
    PERCENT_GDP
}
