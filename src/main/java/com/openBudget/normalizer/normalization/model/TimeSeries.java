package com.openBudget.normalizer.normalization.model;

import com.openBudget.normalizer.period.Frequency;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Ordered series of one value per period at a single frequency.
 * Transforms never modify a series in place; they return a new one.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TimeSeries {

    private Frequency frequency;

    /**
     * Points with unique labels, chronologically ascending by convention.
     */
    private List<DataPoint> points;

    public static TimeSeries of(Frequency frequency, List<DataPoint> points) {
        return new TimeSeries(frequency, List.copyOf(points));
    }
}
