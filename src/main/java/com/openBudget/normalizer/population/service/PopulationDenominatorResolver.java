package com.openBudget.normalizer.population.service;

import com.openBudget.normalizer.normalization.model.NormalizationMode;
import com.openBudget.normalizer.population.exception.PopulationException;
import com.openBudget.normalizer.population.model.AnalyticsFilter;
import com.openBudget.normalizer.population.repository.PopulationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Resolves the population a per-capita query divides by.
 *
 * Unscoped filters divide by the country population; scoped filters by the population
 * of the selected entities. Lookup failures disable per-capita for the request instead
 * of failing it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PopulationDenominatorResolver {

    private final PopulationRepository populationRepository;

    public Optional<BigDecimal> resolve(AnalyticsFilter filter, NormalizationMode mode) {
        if (mode != NormalizationMode.PER_CAPITA) {
            return Optional.empty();
        }

        try {
            long population = filter != null && filter.hasEntityScope()
                    ? populationRepository.getFilteredPopulation(filter)
                    : populationRepository.getCountryPopulation();
            log.debug("Resolved population denominator: {}", population);
            return Optional.of(BigDecimal.valueOf(population));
        } catch (PopulationException e) {
            log.warn("Population lookup failed - per-capita normalization skipped: {}", e.getMessage(), e);
            return Optional.empty();
        }
    }
}
