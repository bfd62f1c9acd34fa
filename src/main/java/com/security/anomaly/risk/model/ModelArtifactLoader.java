package com.security.anomaly.risk.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads a JSON model artifact and checks that the model can score rows of
 * {@code feature_cols} width.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ModelArtifactLoader {

    private static final TypeReference<List<String>> STRINGS = new TypeReference<>() {
    };
    private static final TypeReference<Set<Integer>> CODES = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Object>> METRICS = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    /**
     * @throws ArtifactUnavailableException when the file cannot be read or describes no usable model
     */
    public ModelArtifact load(Path path) {
        JsonNode root;
        try {
            root = objectMapper.readTree(path.toFile());
        } catch (IOException e) {
            throw new ArtifactUnavailableException("Cannot read model artifact " + path + ": " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ArtifactUnavailableException("Model artifact " + path + " is not a JSON object");
        }

        try {
            ModelMode mode = ModelMode.fromWireName(root.path("mode").asText("supervised"));
            JsonNode colsNode = root.get("feature_cols");
            List<String> featureCols = colsNode != null && colsNode.isArray()
                    ? objectMapper.convertValue(colsNode, STRINGS) : null;
            if (featureCols == null || featureCols.isEmpty() || featureCols.contains(null)) {
                throw new ArtifactUnavailableException("Model artifact " + path + " has no feature_cols");
            }
            JsonNode modelNode = root.get("model");
            if (modelNode == null || !modelNode.isObject()) {
                throw new ArtifactUnavailableException("Model artifact " + path + " has no model");
            }

            ModelArtifact.ModelArtifactBuilder builder = ModelArtifact.builder()
                    .mode(mode)
                    .featureCols(List.copyOf(featureCols))
                    .windowSec(root.hasNonNull("window_sec") ? root.get("window_sec").asInt() : null)
                    .attackEventTypes(codes(root, "attack_event_types"))
                    .suspiciousEventTypes(codes(root, "suspicious_event_types"))
                    .trainedAt(root.hasNonNull("trained_at") ? root.get("trained_at").asText() : null)
                    .labelSeverityThreshold(root.hasNonNull("label_severity_threshold")
                            ? root.get("label_severity_threshold").asInt() : null)
                    .metrics(root.hasNonNull("metrics") ? objectMapper.convertValue(root.get("metrics"), METRICS) : null)
                    .path(path);

            if (mode == ModelMode.SUPERVISED) {
                ClassifierModel classifier = objectMapper.treeToValue(modelNode, ClassifierModel.class);
                classifier.validate(featureCols.size());
                builder.classifier(classifier);
            } else {
                AnomalyModel anomalyModel = objectMapper.treeToValue(modelNode, AnomalyModel.class);
                anomalyModel.validate(featureCols.size());
                builder.anomalyModel(anomalyModel);
            }

            ModelArtifact artifact = builder.build();
            log.info("Loaded model artifact: path={} mode={} type={} features={}",
                    path, mode.getWireName(), modelNode.path("type").asText(), featureCols.size());
            return artifact;
        } catch (JsonProcessingException e) {
            throw new ArtifactUnavailableException("Invalid model in artifact " + path + ": " + e.getOriginalMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new ArtifactUnavailableException("Invalid model artifact " + path + ": " + e.getMessage(), e);
        }
    }

    private Set<Integer> codes(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        Set<Integer> codes = objectMapper.convertValue(node, CODES);
        return codes == null ? null : new LinkedHashSet<>(codes);
    }
}
