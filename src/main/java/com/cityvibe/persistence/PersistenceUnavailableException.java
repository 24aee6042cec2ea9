package com.cityvibe.persistence;

/**
 * The event store could not be reached, either for the history load or for the commit.
 * Aborts the whole batch.
 */
public class PersistenceUnavailableException extends RuntimeException {

    private final String operation;

    public PersistenceUnavailableException(String operation, String message) {
        super(message);
        this.operation = operation;
    }

    public PersistenceUnavailableException(String operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
