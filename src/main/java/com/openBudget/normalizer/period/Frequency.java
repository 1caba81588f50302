package com.openBudget.normalizer.period;

/**
 * Granularity of a time series or of a reference dataset.
 */
public enum Frequency {

    YEAR(1, "yearly"),
    QUARTER(4, "quarterly"),
    MONTH(12, "monthly");

    private final int subPeriodsPerYear;
    private final String datasetGranularity;

    Frequency(int subPeriodsPerYear, String datasetGranularity) {
        this.subPeriodsPerYear = subPeriodsPerYear;
        this.datasetGranularity = datasetGranularity;
    }

    /**
     * Number of periods one year splits into (1, 4 or 12).
     */
    public int getSubPeriodsPerYear() {
        return subPeriodsPerYear;
    }

    /**
     * Granularity name used by dataset files ("yearly", "quarterly", "monthly").
     */
    public String getDatasetGranularity() {
        return datasetGranularity;
    }

    /**
     * Resolves a dataset granularity name back to a frequency.
     *
     * @param granularity "yearly", "quarterly" or "monthly"
     * @return matching frequency, or null if the name is unknown
     */
    public static Frequency fromDatasetGranularity(String granularity) {
        if (granularity == null) {
            return null;
        }
        for (Frequency frequency : values()) {
            if (frequency.datasetGranularity.equalsIgnoreCase(granularity)) {
                return frequency;
            }
        }
        return null;
    }
}
