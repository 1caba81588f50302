package com.openBudget.normalizer.normalization.registry;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Dataset identifiers holding one dimension's data at each granularity.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DimensionDatasetConfig {

    /**
     * Yearly dataset id (required).
     */
    private String yearly;

    /**
     * Quarterly dataset id, null when not available.
     */
    private String quarterly;

    /**
     * Monthly dataset id, null when not available.
     */
    private String monthly;
}
