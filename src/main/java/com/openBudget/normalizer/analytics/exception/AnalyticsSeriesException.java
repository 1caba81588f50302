package com.openBudget.normalizer.analytics.exception;

/**
 * Exception thrown when an analytics series cannot be produced.
 */
public class AnalyticsSeriesException extends RuntimeException {

    public AnalyticsSeriesException(String message) {
        super(message);
    }

    public AnalyticsSeriesException(String message, Throwable cause) {
        super(message, cause);
    }
}
