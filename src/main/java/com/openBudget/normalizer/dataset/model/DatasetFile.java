package com.openBudget.normalizer.dataset.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Raw JSON layout of a dataset file, before validation.
 *
 * <pre>
 * {
 *   "metadata": { "id": "...", "source": "...", "lastUpdated": "...", "units": "...", "frequency": "yearly" },
 *   "axes": { "x": { "label": "Year", "type": "date", "frequency": "yearly" },
 *             "y": { "label": "Index", "type": "number", "unit": "..." } },
 *   "data": [ { "x": "2023", "y": "100.0" } ]
 * }
 * </pre>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class DatasetFile {

    private Metadata metadata;

    private Axes axes;

    private List<Point> data;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Metadata {
        private String id;
        private String source;
        private String sourceUrl;
        private String lastUpdated;
        private String units;
        private String frequency;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Axes {
        private Axis x;
        private Axis y;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Axis {
        private String label;

        /**
         * "date", "category" or "number".
         */
        private String type;

        private String unit;

        private String frequency;
    }

    /**
     * Values are kept as strings in the file so no precision is lost before parsing.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Point {
        private String x;
        private String y;
    }
}
