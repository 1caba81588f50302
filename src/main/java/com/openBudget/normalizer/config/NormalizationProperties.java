package com.openBudget.normalizer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings under the {@code normalization} prefix of application.yaml.
 */
@Data
@ConfigurationProperties(prefix = "normalization")
public class NormalizationProperties {

    /**
     * ISO code of the local currency, used in axis units.
     */
    private String localCurrencyCode = "RON";

    private Datasets datasets = new Datasets();

    private Inflation inflation = new Inflation();

    @Data
    public static class Datasets {

        /**
         * Classpath directory holding the dataset JSON files.
         */
        private String root = "datasets";

        /**
         * File under {@link #root} listing the dataset file names.
         */
        private String indexFile = "index.json";

        /**
         * Maximum number of parsed datasets kept by the store.
         */
        private long cacheMaxSize = 50;

        private Duration cacheTtl = Duration.ofHours(1);
    }

    @Data
    public static class Inflation {

        /**
         * Year whose price level inflation-adjusted values are expressed in.
         * When unset, the latest year of the yearly price-index dataset is used.
         */
        private Integer referenceYear;
    }
}
