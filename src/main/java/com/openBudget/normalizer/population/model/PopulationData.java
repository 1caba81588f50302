package com.openBudget.normalizer.population.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Reference data file: every UAT and every public entity.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PopulationData {

    private List<Uat> uats = new ArrayList<>();

    private List<PublicEntity> entities = new ArrayList<>();
}
