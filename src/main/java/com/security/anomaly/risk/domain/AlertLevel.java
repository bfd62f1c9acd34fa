package com.security.anomaly.risk.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Bucket an alerted IP falls into. Rows below the medium threshold are not alerted at all.
 */
public enum AlertLevel {
    HIGH("high"),
    MEDIUM("medium");

    private final String wireName;

    AlertLevel(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
