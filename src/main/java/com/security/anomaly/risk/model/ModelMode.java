package com.security.anomaly.risk.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Model family of an artifact. Decides how the scorer turns model output into a risk score.
 */
public enum ModelMode {
    /** Classifier: risk is the positive-class probability. */
    SUPERVISED("supervised"),
    /** Anomaly detector: risk is the batch-relative inverse of the normality score. */
    UNSUPERVISED("unsupervised");

    private final String wireName;

    ModelMode(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public static ModelMode fromWireName(String value) {
        for (ModelMode mode : values()) {
            if (mode.wireName.equalsIgnoreCase(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown model mode: " + value);
    }
}
