package com.security.anomaly.risk.model;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A trained model plus everything needed to build its input matrix. Exactly one of
 * {@link #classifier} and {@link #anomalyModel} is set, matching {@link #mode}.
 */
@Value
@Builder
public class ModelArtifact {

    ModelMode mode;
    ClassifierModel classifier;
    AnomalyModel anomalyModel;

    List<String> featureCols;
    /** Window the model was trained on; null when the artifact does not say. */
    Integer windowSec;
    Set<Integer> attackEventTypes;
    Set<Integer> suspiciousEventTypes;

    String trainedAt;
    Integer labelSeverityThreshold;
    Map<String, Object> metrics;

    Path path;
}
