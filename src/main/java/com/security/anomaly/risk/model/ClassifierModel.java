package com.security.anomaly.risk.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Supervised model: estimates the probability that a row is risky.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = LogisticRegressionModel.class, name = "logistic_regression"),
        @JsonSubTypes.Type(value = RandomForestModel.class, name = "random_forest")
})
public interface ClassifierModel {

    /**
     * @param rows one feature row per IP, columns in artifact {@code feature_cols} order
     * @return positive-class probability per row, each in [0, 1]
     */
    double[] predictProba(double[][] rows);

    /**
     * @throws IllegalArgumentException when the model cannot score rows of this width
     */
    default void validate(int featureCount) {
    }
}
