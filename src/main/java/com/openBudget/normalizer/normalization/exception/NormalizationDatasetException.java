package com.openBudget.normalizer.normalization.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Exception thrown when required normalization datasets cannot be loaded.
 * Lists every failing dataset, not just the first one.
 */
public class NormalizationDatasetException extends RuntimeException {

    private final Map<String, String> errors;

    public NormalizationDatasetException(Map<String, String> errors) {
        super(buildMessage(errors));
        this.errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }

    /**
     * Ids of the missing or broken datasets, in validation order.
     */
    public List<String> getMissingDatasets() {
        return List.copyOf(errors.keySet());
    }

    /**
     * Error message per dataset id.
     */
    public Map<String, String> getErrors() {
        return errors;
    }

    private static String buildMessage(Map<String, String> errors) {
        StringBuilder message = new StringBuilder("Required normalization datasets are missing:");
        errors.forEach((id, error) -> message.append("\n  - ").append(id).append(": ")
                .append(error != null ? error : "Unknown error"));
        return message.toString();
    }
}
