package com.security.anomaly.risk.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Standardization fitted at training time: {@code (x - mean) / scale}. A zero scale is
 * treated as 1.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class FeatureScaler {

    @JsonProperty("mean")
    private double[] mean;

    @JsonProperty("scale")
    private double[] scale;

    public FeatureScaler() {}

    public FeatureScaler(double[] mean, double[] scale) {
        this.mean = mean;
        this.scale = scale;
    }

    public double[] transform(double[] row) {
        double[] out = new double[row.length];
        for (int i = 0; i < row.length; i++) {
            double s = scale[i] == 0.0 ? 1.0 : scale[i];
            out[i] = (row[i] - mean[i]) / s;
        }
        return out;
    }

    void validate(int featureCount) {
        if (mean == null || scale == null || mean.length != featureCount || scale.length != featureCount) {
            throw new IllegalArgumentException("Scaler expects " + featureCount + " mean/scale values");
        }
    }
}
