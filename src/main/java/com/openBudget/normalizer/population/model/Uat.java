package com.openBudget.normalizer.population.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Administrative-territorial unit with its resident population.
 * The county-level row of a county has {@code sirutaCode} equal to {@code countyCode}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class Uat {

    private int id;

    /**
     * Fiscal identifier of the unit's own administration.
     */
    private String uatCode;

    private String sirutaCode;

    private String countyCode;

    private String name;

    private long population;
}
