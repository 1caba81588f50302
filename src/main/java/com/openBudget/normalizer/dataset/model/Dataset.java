package com.openBudget.normalizer.dataset.model;

import com.openBudget.normalizer.period.Frequency;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Parsed, validated reference dataset (price index, exchange rate, GDP, population).
 * Read-only for the normalization engine.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Dataset {

    /**
     * Dataset identifier (e.g., "ro.economics.cpi.yearly").
     */
    private String id;

    /**
     * Publisher of the data (e.g., "INSSE", "BNR").
     */
    private String source;

    private String sourceUrl;

    private String lastUpdated;

    /**
     * Unit of the y values (e.g., "RON/EUR", "million RON", "persons").
     */
    private String units;

    /**
     * Granularity every point label is keyed at.
     */
    private Frequency frequency;

    /**
     * Observations in file order.
     */
    private List<DatasetPoint> points;
}
