package com.security.anomaly.risk.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Node of an isolation tree. Internal nodes send {@code x[f] <= v} left; leaves record how
 * many training samples reached them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class IsolationNode {

    private static final double EULER_GAMMA = 0.5772156649;

    @JsonProperty("f")
    private int splitFeature;

    @JsonProperty("v")
    private double splitValue;

    @JsonProperty("l")
    private IsolationNode left;

    @JsonProperty("r")
    private IsolationNode right;

    @JsonProperty("s")
    private int size;

    public IsolationNode() {}

    public static IsolationNode internalNode(int splitFeature, double splitValue,
                                             IsolationNode left, IsolationNode right) {
        IsolationNode node = new IsolationNode();
        node.splitFeature = splitFeature;
        node.splitValue = splitValue;
        node.left = left;
        node.right = right;
        return node;
    }

    public static IsolationNode externalNode(int size) {
        IsolationNode node = new IsolationNode();
        node.size = size;
        return node;
    }

    public double pathLength(double[] point) {
        IsolationNode node = this;
        int depth = 0;
        while (!node.isExternal()) {
            node = point[node.splitFeature] <= node.splitValue ? node.left : node.right;
            depth++;
        }
        return depth + averagePathLength(node.size);
    }

    /**
     * Average path length of an unsuccessful BST search over {@code n} samples:
     * c(n) = 2H(n-1) - 2(n-1)/n, with H(i) approximated by ln(i) + Euler's constant.
     */
    public static double averagePathLength(int n) {
        if (n <= 1) return 0;
        if (n == 2) return 1;
        double harmonicNumber = Math.log(n - 1.0) + EULER_GAMMA;
        return 2.0 * harmonicNumber - (2.0 * (n - 1.0) / n);
    }

    public boolean isExternal() {
        return left == null && right == null;
    }

    void validate(int featureCount) {
        if (isExternal()) {
            if (size < 0) {
                throw new IllegalArgumentException("Negative leaf size: " + size);
            }
            return;
        }
        if (left == null || right == null || splitFeature < 0 || splitFeature >= featureCount) {
            throw new IllegalArgumentException("Malformed isolation node (feature=" + splitFeature + ")");
        }
        left.validate(featureCount);
        right.validate(featureCount);
    }
}
