package com.security.anomaly.ingestion;

/**
 * Message body is not a UTF-8 JSON object.
 */
public class EventDecodeException extends RuntimeException {

    public EventDecodeException(String message) {
        super(message);
    }

    public EventDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
