package com.security.anomaly.risk.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Unsupervised model: scores how normal a row looks. Values are only comparable within the
 * same model.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = IsolationForestModel.class, name = "isolation_forest")
})
public interface AnomalyModel {

    /**
     * @param rows one feature row per IP, columns in artifact {@code feature_cols} order
     * @return decision value per row; higher = more normal
     */
    double[] decisionFunction(double[][] rows);

    /**
     * @throws IllegalArgumentException when the model cannot score rows of this width
     */
    default void validate(int featureCount) {
    }
}
