package com.security.anomaly.risk.model;

/**
 * The model artifact is missing, unreadable or does not describe a usable model.
 */
public class ArtifactUnavailableException extends RuntimeException {

    public ArtifactUnavailableException(String message) {
        super(message);
    }

    public ArtifactUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
