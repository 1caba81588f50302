package com.openBudget.normalizer.config;

import com.openBudget.normalizer.dataset.service.ClasspathDatasetStore;
import com.openBudget.normalizer.dataset.service.DatasetStore;
import com.openBudget.normalizer.normalization.registry.DatasetRegistry;
import com.openBudget.normalizer.normalization.service.NormalizationService;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the normalization engine. Creating {@link NormalizationService} validates
 * the required datasets, so a broken dataset directory fails start-up.
 */
@Configuration
@EnableConfigurationProperties(NormalizationProperties.class)
public class NormalizationConfig {

    @Bean
    public DatasetRegistry datasetRegistry() {
        return DatasetRegistry.defaults();
    }

    @Bean
    public DatasetStore datasetStore(NormalizationProperties properties) {
        NormalizationProperties.Datasets datasets = properties.getDatasets();
        return new ClasspathDatasetStore(datasets.getRoot(), datasets.getIndexFile(),
                datasets.getCacheMaxSize(), datasets.getCacheTtl());
    }

    @Bean
    public NormalizationService normalizationService(DatasetStore datasetStore, DatasetRegistry datasetRegistry,
                                                     NormalizationProperties properties) {
        return NormalizationService.create(datasetStore, datasetRegistry, properties.getInflation().getReferenceYear());
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
