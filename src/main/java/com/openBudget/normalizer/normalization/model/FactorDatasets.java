package com.openBudget.normalizer.normalization.model;

import com.openBudget.normalizer.dataset.model.Dataset;
import com.openBudget.normalizer.dataset.model.DatasetPoint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One dimension's source data, keyed by label at each dataset's own granularity.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FactorDatasets {

    /**
     * Yearly values ("YYYY"), required.
     */
    @Builder.Default
    private FactorMap yearly = FactorMap.empty();

    /**
     * Quarterly values ("YYYY-Qn"), null when the dimension has none.
     */
    private FactorMap quarterly;

    /**
     * Monthly values ("YYYY-MM"), null when the dimension has none.
     */
    private FactorMap monthly;

    public static FactorDatasets fromDatasets(Dataset yearly, Dataset quarterly, Dataset monthly) {
        return FactorDatasets.builder()
                .yearly(toFactorMap(yearly))
                .quarterly(quarterly != null ? toFactorMap(quarterly) : null)
                .monthly(monthly != null ? toFactorMap(monthly) : null)
                .build();
    }

    public static FactorMap toFactorMap(Dataset dataset) {
        if (dataset == null || dataset.getPoints() == null) {
            return FactorMap.empty();
        }
        Map<String, BigDecimal> values = new LinkedHashMap<>();
        for (DatasetPoint point : dataset.getPoints()) {
            values.put(point.getLabel(), point.getValue());
        }
        return FactorMap.of(values);
    }
}
