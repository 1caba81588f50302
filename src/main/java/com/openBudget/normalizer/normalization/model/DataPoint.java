package com.openBudget.normalizer.normalization.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * One value of a time series.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class DataPoint {

    /**
     * Period label matching the series frequency.
     */
    private String label;

    private BigDecimal value;

    public static DataPoint of(String label, BigDecimal value) {
        return new DataPoint(label, value);
    }

    public DataPoint withValue(BigDecimal newValue) {
        return toBuilder().value(newValue).build();
    }
}
