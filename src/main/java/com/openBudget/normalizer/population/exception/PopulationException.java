package com.openBudget.normalizer.population.exception;

/**
 * Exception thrown when population reference data cannot be read.
 */
public class PopulationException extends Exception {

    public PopulationException(String message) {
        super(message);
    }

    public PopulationException(String message, Throwable cause) {
        super(message, cause);
    }
}
