package com.security.anomaly.risk.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Message published to the integration channel once per inference cycle that produced at
 * least one alert.
 */
@Value
@Builder
@Jacksonized
public class RiskAlertBatch {

    public static final String EVENT_TYPE = "ip_risk_detected";

    @JsonProperty("event_type")
    @Builder.Default
    String eventType = EVENT_TYPE;

    @JsonProperty("producer")
    String producer;

    /** UTC, second precision, e.g. {@code 2025-12-25T19:10:30Z}. */
    @JsonProperty("ts")
    String ts;

    @JsonProperty("model_path")
    String modelPath;

    @JsonProperty("model_version")
    String modelVersion;

    @JsonProperty("window_sec")
    int windowSec;

    @JsonProperty("items")
    List<RiskAlertItem> items;
}
