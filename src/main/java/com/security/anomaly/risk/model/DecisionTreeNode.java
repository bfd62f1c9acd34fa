package com.security.anomaly.risk.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Node of a classification tree. Internal nodes send {@code x[f] <= t} left; leaves carry
 * the positive-class probability.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DecisionTreeNode {

    @JsonProperty("f")
    private int feature;

    @JsonProperty("t")
    private double threshold;

    @JsonProperty("l")
    private DecisionTreeNode left;

    @JsonProperty("r")
    private DecisionTreeNode right;

    @JsonProperty("p")
    private double probability;

    public DecisionTreeNode() {}

    public static DecisionTreeNode split(int feature, double threshold, DecisionTreeNode left, DecisionTreeNode right) {
        DecisionTreeNode node = new DecisionTreeNode();
        node.feature = feature;
        node.threshold = threshold;
        node.left = left;
        node.right = right;
        return node;
    }

    public static DecisionTreeNode leaf(double probability) {
        DecisionTreeNode node = new DecisionTreeNode();
        node.probability = probability;
        return node;
    }

    public double predict(double[] row) {
        DecisionTreeNode node = this;
        while (!node.isLeaf()) {
            node = row[node.feature] <= node.threshold ? node.left : node.right;
        }
        return node.probability;
    }

    boolean isLeaf() {
        return left == null && right == null;
    }

    void validate(int featureCount) {
        if (isLeaf()) {
            if (probability < 0.0 || probability > 1.0) {
                throw new IllegalArgumentException("Leaf probability out of range: " + probability);
            }
            return;
        }
        if (left == null || right == null || feature < 0 || feature >= featureCount) {
            throw new IllegalArgumentException("Malformed tree node (feature=" + feature + ")");
        }
        left.validate(featureCount);
        right.validate(featureCount);
    }
}
