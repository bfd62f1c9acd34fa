package com.security.anomaly.risk.messaging;

/**
 * The integration topic did not acknowledge an alert batch.
 */
public class AlertPublishException extends RuntimeException {

    public AlertPublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
