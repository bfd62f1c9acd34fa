package com.security.anomaly.risk.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Random forest classifier: the probability is the mean of the trees' leaf probabilities.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RandomForestModel implements ClassifierModel {

    @JsonProperty("trees")
    private List<DecisionTreeNode> trees = new ArrayList<>();

    public RandomForestModel() {}

    public RandomForestModel(List<DecisionTreeNode> trees) {
        this.trees = trees;
    }

    @Override
    public double[] predictProba(double[][] rows) {
        double[] proba = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            double sum = 0.0;
            for (DecisionTreeNode tree : trees) {
                sum += tree.predict(rows[i]);
            }
            proba[i] = sum / trees.size();
        }
        return proba;
    }

    @Override
    public void validate(int featureCount) {
        if (trees == null || trees.isEmpty()) {
            throw new IllegalArgumentException("Random forest has no trees");
        }
        for (DecisionTreeNode tree : trees) {
            tree.validate(featureCount);
        }
    }
}
