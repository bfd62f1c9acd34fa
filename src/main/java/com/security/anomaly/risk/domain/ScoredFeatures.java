package com.security.anomaly.risk.domain;

import lombok.Value;

/**
 * A feature vector with the risk score the current model gave it.
 */
@Value
public class ScoredFeatures {

    FeatureVector features;
    /** 0.0–1.0; higher = riskier. */
    double riskScore;

    public String getIp() {
        return features.getIp();
    }
}
