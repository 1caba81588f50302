package com.openBudget.normalizer.dataset.exception;

/**
 * Exception thrown when a dataset cannot be found, read, or parsed.
 */
public class DatasetStoreException extends Exception {

    public enum ErrorType {
        NOT_FOUND,
        READ_ERROR,
        PARSE_ERROR,
        SCHEMA_VALIDATION,
        ID_MISMATCH,
        DUPLICATE_ID,
        INVALID_FORMAT,
        INVALID_DECIMAL,
        UNITS_MISMATCH
    }

    private final ErrorType type;

    public DatasetStoreException(ErrorType type, String message) {
        super(message);
        this.type = type;
    }

    public DatasetStoreException(ErrorType type, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
    }

    public ErrorType getType() {
        return type;
    }
}
