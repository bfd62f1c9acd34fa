package com.security.anomaly.persistence;

/**
 * Persistence failure. Not retried by the caller.
 */
public class EventStoreException extends RuntimeException {

    public EventStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
