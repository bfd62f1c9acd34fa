package com.security.anomaly.risk.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Logistic regression, optionally preceded by a standard scaler.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class LogisticRegressionModel implements ClassifierModel {

    @JsonProperty("scaler")
    private FeatureScaler scaler;

    @JsonProperty("coefficients")
    private double[] coefficients;

    @JsonProperty("intercept")
    private double intercept;

    public LogisticRegressionModel() {}

    public LogisticRegressionModel(FeatureScaler scaler, double[] coefficients, double intercept) {
        this.scaler = scaler;
        this.coefficients = coefficients;
        this.intercept = intercept;
    }

    @Override
    public double[] predictProba(double[][] rows) {
        double[] proba = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            double[] x = scaler != null ? scaler.transform(rows[i]) : rows[i];
            double z = intercept;
            for (int j = 0; j < coefficients.length; j++) {
                z += coefficients[j] * x[j];
            }
            proba[i] = 1.0 / (1.0 + Math.exp(-z));
        }
        return proba;
    }

    @Override
    public void validate(int featureCount) {
        if (coefficients == null || coefficients.length != featureCount) {
            throw new IllegalArgumentException("Logistic regression expects " + featureCount + " coefficients, got "
                    + (coefficients == null ? 0 : coefficients.length));
        }
        if (scaler != null) {
            scaler.validate(featureCount);
        }
    }
}
