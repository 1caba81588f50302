package com.openBudget.normalizer.population.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class PublicEntity {

    private String cui;

    private String name;

    private String entityType;

    /**
     * Owning UAT; null for entities without a territorial mapping.
     */
    private Integer uatId;

    private Boolean isUat;
}
