package com.security.anomaly.ingestion;

import lombok.Getter;

/**
 * A required field is missing, or a field has a value that cannot be resolved.
 * The record is rejected and not redelivered.
 */
@Getter
public class EventValidationException extends RuntimeException {

    private final String field;

    public EventValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public EventValidationException(String field, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
    }

    public static EventValidationException missing(String field) {
        return new EventValidationException(field, "Missing field: " + field);
    }
}
