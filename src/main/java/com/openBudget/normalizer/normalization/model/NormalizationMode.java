package com.openBudget.normalizer.normalization.model;

/**
 * Strict normalization modes accepted by the transform pipeline.
 */
public enum NormalizationMode {
    TOTAL,
    PER_CAPITA,
    PERCENT_GDP
}
