package com.openBudget.normalizer.population.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Entity-scoping part of an analytics query filter.
 * An empty list or a null flag means the field is not set.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AnalyticsFilter {

    /**
     * Fiscal identifiers of public entities.
     */
    private List<String> entityCuis;

    private List<Integer> uatIds;

    /**
     * County codes, e.g. "CJ", "B".
     */
    private List<String> countyCodes;

    private Boolean isUat;

    /**
     * Entity type codes, e.g. "admin_county_council".
     */
    private List<String> entityTypes;

    /**
     * True when any entity-scoping field is set.
     */
    public boolean hasEntityScope() {
        return isNotEmpty(entityCuis)
                || isNotEmpty(uatIds)
                || isNotEmpty(countyCodes)
                || isUat != null
                || isNotEmpty(entityTypes);
    }

    private static boolean isNotEmpty(List<?> values) {
        return values != null && !values.isEmpty();
    }
}
