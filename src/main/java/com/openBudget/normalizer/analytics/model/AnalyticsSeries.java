package com.openBudget.normalizer.analytics.model;

import com.openBudget.normalizer.normalization.model.DataPoint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Normalized series ready for charting, sorted by period.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AnalyticsSeries {

    private String seriesId;

    private Axis xAxis;

    private Axis yAxis;

    private List<DataPoint> data;
}
