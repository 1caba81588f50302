package com.openBudget.normalizer.population.repository;

import com.openBudget.normalizer.population.exception.PopulationException;
import com.openBudget.normalizer.population.model.AnalyticsFilter;
import com.openBudget.normalizer.population.model.PopulationData;
import com.openBudget.normalizer.population.model.PublicEntity;
import com.openBudget.normalizer.population.model.Uat;
import com.openBudget.normalizer.util.JsonFileLoader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Population repository backed by a classpath JSON file of UATs and public entities.
 *
 * A county's population is the population of its county-level UAT. Bucharest has no
 * county-level row, so its municipality (SIRUTA 179132) stands in for it.
 */
@Slf4j
@Repository
public class JsonPopulationRepository implements PopulationRepository {

    static final String BUCHAREST_COUNTY_CODE = "B";
    static final String BUCHAREST_SIRUTA_CODE = "179132";
    static final String COUNTY_COUNCIL_ENTITY_TYPE = "admin_county_council";

    private final String dataFile;

    private volatile PopulationData data;

    public JsonPopulationRepository(@Value("${population.data-file:data/population.json}") String dataFile) {
        this.dataFile = dataFile;
    }

    @Override
    public long getCountryPopulation() throws PopulationException {
        Map<String, Long> countyPopulations = countyPopulations(loadData().getUats());
        long total = countyPopulations.values().stream().mapToLong(Long::longValue).sum();
        log.debug("Computed country population - counties: {}, total: {}", countyPopulations.size(), total);
        return total;
    }

    @Override
    public long getFilteredPopulation(AnalyticsFilter filter) throws PopulationException {
        if (filter == null || !filter.hasEntityScope()) {
            return getCountryPopulation();
        }

        PopulationData populationData = loadData();
        Map<Integer, Uat> uatsById = new HashMap<>();
        Map<String, Uat> uatsByCode = new HashMap<>();
        for (Uat uat : populationData.getUats()) {
            uatsById.put(uat.getId(), uat);
            if (uat.getUatCode() != null) {
                uatsByCode.putIfAbsent(uat.getUatCode(), uat);
            }
        }

        Set<Integer> selectedUatIds = new LinkedHashSet<>();
        Set<String> selectedCountyCodes = new LinkedHashSet<>();
        if (filter.getUatIds() != null) {
            selectedUatIds.addAll(filter.getUatIds());
        }
        if (filter.getCountyCodes() != null) {
            selectedCountyCodes.addAll(filter.getCountyCodes());
        }

        if (hasEntityFilter(filter)) {
            for (PublicEntity entity : matchingEntities(populationData.getEntities(), filter, uatsById, uatsByCode)) {
                Uat uat = owningUat(entity, uatsById, uatsByCode);
                if (COUNTY_COUNCIL_ENTITY_TYPE.equals(entity.getEntityType()) && uat != null && uat.getCountyCode() != null) {
                    selectedCountyCodes.add(uat.getCountyCode());
                } else if (uat != null) {
                    selectedUatIds.add(uat.getId());
                }
            }
        }

        if (selectedUatIds.isEmpty() && selectedCountyCodes.isEmpty()) {
            log.debug("Filter selected no UATs or counties - using country population");
            return getCountryPopulation();
        }

        long total = 0;
        for (Integer uatId : selectedUatIds) {
            Uat uat = uatsById.get(uatId);
            // UATs inside a selected county are already counted by the county
            if (uat != null && !selectedCountyCodes.contains(uat.getCountyCode())) {
                total += uat.getPopulation();
            }
        }

        Map<String, Long> countyPopulations = countyPopulations(populationData.getUats());
        for (String countyCode : selectedCountyCodes) {
            total += countyPopulations.getOrDefault(countyCode, 0L);
        }

        log.debug("Computed filtered population - uats: {}, counties: {}, total: {}",
                selectedUatIds.size(), selectedCountyCodes.size(), total);
        return total;
    }

    private static boolean hasEntityFilter(AnalyticsFilter filter) {
        return (filter.getEntityCuis() != null && !filter.getEntityCuis().isEmpty())
                || (filter.getEntityTypes() != null && !filter.getEntityTypes().isEmpty())
                || filter.getIsUat() != null;
    }

    /**
     * Entities satisfying every set field of the filter, one per fiscal identifier.
     */
    private static List<PublicEntity> matchingEntities(List<PublicEntity> entities, AnalyticsFilter filter,
                                                       Map<Integer, Uat> uatsById, Map<String, Uat> uatsByCode) {
        Map<String, PublicEntity> byCui = new LinkedHashMap<>();
        for (PublicEntity entity : entities) {
            if (isSet(filter.getEntityCuis()) && !filter.getEntityCuis().contains(entity.getCui())) {
                continue;
            }
            if (isSet(filter.getEntityTypes()) && !filter.getEntityTypes().contains(entity.getEntityType())) {
                continue;
            }
            if (filter.getIsUat() != null && !filter.getIsUat().equals(Boolean.TRUE.equals(entity.getIsUat()))) {
                continue;
            }
            if (isSet(filter.getUatIds()) && !filter.getUatIds().contains(entity.getUatId())) {
                continue;
            }
            if (isSet(filter.getCountyCodes())) {
                Uat uat = owningUat(entity, uatsById, uatsByCode);
                if (uat == null || !filter.getCountyCodes().contains(uat.getCountyCode())) {
                    continue;
                }
            }
            byCui.putIfAbsent(entity.getCui(), entity);
        }
        return List.copyOf(byCui.values());
    }

    private static Uat owningUat(PublicEntity entity, Map<Integer, Uat> uatsById, Map<String, Uat> uatsByCode) {
        if (entity.getUatId() != null && uatsById.containsKey(entity.getUatId())) {
            return uatsById.get(entity.getUatId());
        }
        return entity.getCui() != null ? uatsByCode.get(entity.getCui()) : null;
    }

    private static Map<String, Long> countyPopulations(List<Uat> uats) {
        Map<String, Long> byCounty = new LinkedHashMap<>();
        for (Uat uat : uats) {
            if (uat.getCountyCode() == null) {
                continue;
            }
            long value = isCountyLevel(uat) ? uat.getPopulation() : 0L;
            byCounty.merge(uat.getCountyCode(), value, Math::max);
        }
        return byCounty;
    }

    private static boolean isCountyLevel(Uat uat) {
        if (BUCHAREST_COUNTY_CODE.equals(uat.getCountyCode())) {
            return BUCHAREST_SIRUTA_CODE.equals(uat.getSirutaCode());
        }
        return uat.getCountyCode().equals(uat.getSirutaCode());
    }

    private static boolean isSet(List<?> values) {
        return values != null && !values.isEmpty();
    }

    private PopulationData loadData() throws PopulationException {
        PopulationData current = data;
        if (current != null) {
            return current;
        }
        synchronized (this) {
            if (data == null) {
                try {
                    PopulationData loaded = JsonFileLoader.loadAsObject(dataFile, PopulationData.class);
                    log.info("Loaded population data - file: {}, uats: {}, entities: {}",
                            dataFile, loaded.getUats().size(), loaded.getEntities().size());
                    data = loaded;
                } catch (IOException e) {
                    throw new PopulationException("Failed to load population data from " + dataFile, e);
                }
            }
            return data;
        }
    }
}
