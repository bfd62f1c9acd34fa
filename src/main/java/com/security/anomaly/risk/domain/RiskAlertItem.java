package com.security.anomaly.risk.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * One risky IP inside a published batch. Downstream consumers may block the IP for
 * {@code ttl_sec} seconds.
 */
@Value
@Builder
@Jacksonized
public class RiskAlertItem {

    @JsonProperty("ip")
    String ip;

    @JsonProperty("risk_score")
    double riskScore;

    @JsonProperty("risk_level")
    AlertLevel riskLevel;

    @JsonProperty("ttl_sec")
    int ttlSec;

    /** At most three, in priority order. */
    @JsonProperty("reasons")
    List<String> reasons;

    @JsonProperty("window_sec")
    int windowSec;
}
