package com.security.anomaly.risk.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Isolation forest exported from training. The anomaly score is
 * {@code s = 2^(-E[h(x)] / c(sample_size))}; the decision value is {@code -s - offset}, so
 * higher means more normal.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class IsolationForestModel implements AnomalyModel {

    static final double DEFAULT_OFFSET = -0.5;

    @JsonProperty("scaler")
    private FeatureScaler scaler;

    @JsonProperty("sample_size")
    private int sampleSize;

    @JsonProperty("offset")
    private double offset = DEFAULT_OFFSET;

    @JsonProperty("trees")
    private List<IsolationNode> trees = new ArrayList<>();

    public IsolationForestModel() {}

    public IsolationForestModel(FeatureScaler scaler, int sampleSize, double offset, List<IsolationNode> trees) {
        this.scaler = scaler;
        this.sampleSize = sampleSize;
        this.offset = offset;
        this.trees = trees;
    }

    /**
     * @return score between 0.0 (normal) and 1.0 (anomalous)
     */
    public double anomalyScore(double[] point) {
        double[] x = scaler != null ? scaler.transform(point) : point;
        double avgPathLength = 0.0;
        for (IsolationNode tree : trees) {
            avgPathLength += tree.pathLength(x);
        }
        avgPathLength /= trees.size();

        double c = IsolationNode.averagePathLength(sampleSize);
        if (c <= 0) return 0.0;
        return Math.pow(2.0, -avgPathLength / c);
    }

    @Override
    public double[] decisionFunction(double[][] rows) {
        double[] decision = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            decision[i] = -anomalyScore(rows[i]) - offset;
        }
        return decision;
    }

    @Override
    public void validate(int featureCount) {
        if (trees == null || trees.isEmpty()) {
            throw new IllegalArgumentException("Isolation forest has no trees");
        }
        if (sampleSize < 1) {
            throw new IllegalArgumentException("Isolation forest sample_size must be positive, got " + sampleSize);
        }
        if (scaler != null) {
            scaler.validate(featureCount);
        }
        for (IsolationNode tree : trees) {
            tree.validate(featureCount);
        }
    }
}
