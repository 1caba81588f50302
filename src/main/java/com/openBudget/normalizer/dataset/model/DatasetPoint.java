package com.openBudget.normalizer.dataset.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * One (label, value) observation of a reference dataset.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DatasetPoint {

    /**
     * Period label at the dataset's granularity ("2023", "2023-Q1", "2023-01").
     */
    private String label;

    private BigDecimal value;
}
