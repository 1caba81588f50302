package com.openBudget.normalizer.population.repository;

import com.openBudget.normalizer.population.exception.PopulationException;
import com.openBudget.normalizer.population.model.AnalyticsFilter;

/**
 * Source of population totals used as per-capita denominators.
 */
public interface PopulationRepository {

    /**
     * Nationwide population: the county-level population of every county.
     */
    long getCountryPopulation() throws PopulationException;

    /**
     * Population of the UATs and counties selected by the filter's entity-scoping fields.
     */
    long getFilteredPopulation(AnalyticsFilter filter) throws PopulationException;
}
