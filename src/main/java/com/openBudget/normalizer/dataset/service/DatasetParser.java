package com.openBudget.normalizer.dataset.service;

import com.openBudget.normalizer.dataset.exception.DatasetStoreException;
import com.openBudget.normalizer.dataset.exception.DatasetStoreException.ErrorType;
import com.openBudget.normalizer.dataset.model.Dataset;
import com.openBudget.normalizer.dataset.model.DatasetFile;
import com.openBudget.normalizer.dataset.model.DatasetPoint;
import com.openBudget.normalizer.period.Frequency;
import com.openBudget.normalizer.period.PeriodLabels;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Validates a raw {@link DatasetFile} and converts it to a {@link Dataset}.
 *
 * Handles:
 * - Required fields (metadata id/units, both axes, data array)
 * - Units consistency between metadata and the y axis
 * - X labels per axis type: strict period labels for date axes, finite numbers, non-blank categories
 * - Y values as exact decimals
 */
public class DatasetParser {

    private static final String AXIS_DATE = "date";
    private static final String AXIS_NUMBER = "number";
    private static final String AXIS_CATEGORY = "category";

    public Dataset parse(DatasetFile file, String location) throws DatasetStoreException {
        validateSchema(file, location);

        DatasetFile.Metadata metadata = file.getMetadata();
        DatasetFile.Axis xAxis = file.getAxes().getX();
        DatasetFile.Axis yAxis = file.getAxes().getY();

        if (yAxis.getUnit() != null && !yAxis.getUnit().equals(metadata.getUnits())) {
            throw new DatasetStoreException(ErrorType.UNITS_MISMATCH,
                    "metadata.units '" + metadata.getUnits() + "' and axes.y.unit '" + yAxis.getUnit()
                            + "' must match in " + location);
        }

        String granularity = xAxis.getFrequency() != null ? xAxis.getFrequency() : metadata.getFrequency();
        Frequency frequency = Frequency.fromDatasetGranularity(granularity);

        List<DatasetPoint> points = new ArrayList<>(file.getData().size());
        for (DatasetFile.Point point : file.getData()) {
            if (point == null) {
                throw new DatasetStoreException(ErrorType.SCHEMA_VALIDATION, "Null data point in " + location);
            }
            String label = validateX(xAxis.getType(), frequency, granularity, point.getX());
            BigDecimal value = parseDecimal(point.getY(), "y-axis");
            points.add(DatasetPoint.builder().label(label).value(value).build());
        }

        return Dataset.builder()
                .id(metadata.getId())
                .source(metadata.getSource())
                .sourceUrl(metadata.getSourceUrl())
                .lastUpdated(metadata.getLastUpdated())
                .units(metadata.getUnits())
                .frequency(frequency)
                .points(List.copyOf(points))
                .build();
    }

    private void validateSchema(DatasetFile file, String location) throws DatasetStoreException {
        List<String> problems = new ArrayList<>();
        if (file == null) {
            throw new DatasetStoreException(ErrorType.SCHEMA_VALIDATION, "Empty dataset file at " + location);
        }
        DatasetFile.Metadata metadata = file.getMetadata();
        if (metadata == null) {
            problems.add("metadata is required");
        } else {
            if (isBlank(metadata.getId())) {
                problems.add("metadata.id is required");
            }
            if (isBlank(metadata.getSource())) {
                problems.add("metadata.source is required");
            }
            if (isBlank(metadata.getLastUpdated())) {
                problems.add("metadata.lastUpdated is required");
            }
            if (metadata.getUnits() == null) {
                problems.add("metadata.units is required");
            }
        }
        if (file.getAxes() == null || file.getAxes().getX() == null || file.getAxes().getY() == null) {
            problems.add("axes.x and axes.y are required");
        } else {
            if (isBlank(file.getAxes().getX().getType())) {
                problems.add("axes.x.type is required");
            }
            if (isBlank(file.getAxes().getY().getType())) {
                problems.add("axes.y.type is required");
            }
        }
        if (file.getData() == null) {
            problems.add("data is required");
        }

        if (!problems.isEmpty()) {
            throw new DatasetStoreException(ErrorType.SCHEMA_VALIDATION,
                    "Schema validation failed for " + location + ": " + String.join("; ", problems));
        }
    }

    private String validateX(String axisType, Frequency frequency, String granularity, String value)
            throws DatasetStoreException {
        if (value == null) {
            throw new DatasetStoreException(ErrorType.INVALID_FORMAT, "x-axis value cannot be null");
        }

        if (AXIS_DATE.equals(axisType)) {
            if (frequency == null || !PeriodLabels.isValid(value, frequency)) {
                String expected = granularity != null ? granularity : "frequency::unknown";
                throw new DatasetStoreException(ErrorType.INVALID_FORMAT,
                        "Expected " + expected + " date for x-axis, got '" + value + "'");
            }
            return value;
        }

        if (AXIS_NUMBER.equals(axisType)) {
            return parseDecimal(value, "numeric x-axis").stripTrailingZeros().toPlainString();
        }

        if (AXIS_CATEGORY.equals(axisType) && value.trim().isEmpty()) {
            throw new DatasetStoreException(ErrorType.INVALID_FORMAT, "Category x-axis value cannot be empty");
        }
        return value;
    }

    private BigDecimal parseDecimal(String value, String what) throws DatasetStoreException {
        if (value == null) {
            throw new DatasetStoreException(ErrorType.INVALID_DECIMAL, "Missing " + what + " value");
        }
        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            throw new DatasetStoreException(ErrorType.INVALID_DECIMAL,
                    "Value '" + value + "' is not a valid " + what + " number", e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
