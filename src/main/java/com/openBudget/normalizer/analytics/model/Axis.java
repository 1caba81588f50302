package com.openBudget.normalizer.analytics.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Axis {

    private String name;

    /**
     * "STRING" for period labels, "FLOAT" for values.
     */
    private String type;

    private String unit;
}
