package com.security.anomaly.risk.engine;

import com.security.anomaly.risk.domain.FeatureVector;
import com.security.anomaly.risk.domain.ScoredFeatures;
import com.security.anomaly.risk.model.ModelArtifact;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Turns a batch of feature vectors into risk scores in [0, 1] using the loaded artifact.
 */
@Slf4j
@Component
public class RiskScorer {

    /**
     * @return one scored entry per input vector, same order
     */
    public List<ScoredFeatures> score(ModelArtifact artifact, List<FeatureVector> features) {
        if (features.isEmpty()) {
            return Collections.emptyList();
        }
        double[][] rows = toMatrix(artifact.getFeatureCols(), features);

        double[] risk;
        switch (artifact.getMode()) {
            case SUPERVISED:
                risk = artifact.getClassifier().predictProba(rows);
                break;
            case UNSUPERVISED:
                risk = invertAndNormalize(artifact.getAnomalyModel().decisionFunction(rows));
                break;
            default:
                throw new IllegalStateException("Unsupported model mode: " + artifact.getMode());
        }

        List<ScoredFeatures> scored = new ArrayList<>(features.size());
        for (int i = 0; i < features.size(); i++) {
            scored.add(new ScoredFeatures(features.get(i), clamp(risk[i])));
        }
        log.debug("Scored {} IPs with {} model", scored.size(), artifact.getMode().getWireName());
        return scored;
    }

    /** Columns in {@code featureCols} order; a column the vector does not know is 0. */
    static double[][] toMatrix(List<String> featureCols, List<FeatureVector> features) {
        double[][] rows = new double[features.size()][featureCols.size()];
        for (int i = 0; i < features.size(); i++) {
            Map<String, Double> columns = features.get(i).asColumns();
            for (int j = 0; j < featureCols.size(); j++) {
                rows[i][j] = columns.getOrDefault(featureCols.get(j), 0.0);
            }
        }
        return rows;
    }

    /**
     * Higher decision value means more normal, so risk is {@code (max - v) / (max - min)}.
     * Relative to the batch: the most anomalous IP of every non-uniform batch scores 1.
     */
    static double[] invertAndNormalize(double[] decision) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : decision) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        double denom = max - min;
        if (denom == 0.0) {
            denom = 1.0;
        }
        double[] risk = new double[decision.length];
        for (int i = 0; i < decision.length; i++) {
            risk[i] = (max - decision[i]) / denom;
        }
        return risk;
    }

    private static double clamp(double v) {
        if (Double.isNaN(v)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, v));
    }
}
