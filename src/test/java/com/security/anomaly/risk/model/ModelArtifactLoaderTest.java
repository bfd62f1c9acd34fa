package com.security.anomaly.risk.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.security.anomaly.testutil.TestArtifacts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for ModelArtifactLoader: JSON artifact parsing and model validation.
 */
class ModelArtifactLoaderTest {

    @TempDir
    Path dir;

    private ModelArtifactLoader loader;

    @BeforeEach
    void setUp() {
        loader = new ModelArtifactLoader(new ObjectMapper());
    }

    private Path write(String json) throws IOException {
        Path file = dir.resolve("ip_risk_model.json");
        Files.writeString(file, json);
        return file;
    }

    @Test
    void loadsSupervisedArtifact() throws Exception {
        Path file = write(TestArtifacts.LOGISTIC_JSON);

        ModelArtifact artifact = loader.load(file);

        assertThat(artifact.getMode()).isEqualTo(ModelMode.SUPERVISED);
        assertThat(artifact.getClassifier()).isInstanceOf(LogisticRegressionModel.class);
        assertThat(artifact.getAnomalyModel()).isNull();
        assertThat(artifact.getFeatureCols()).containsExactly("attack_type_count", "events_count");
        assertThat(artifact.getWindowSec()).isEqualTo(60);
        assertThat(artifact.getAttackEventTypes()).containsExactlyInAnyOrder(1, 2);
        assertThat(artifact.getSuspiciousEventTypes()).contains(10, 21);
        assertThat(artifact.getTrainedAt()).isEqualTo("2025-12-25T19:10:30Z");
        assertThat(artifact.getLabelSeverityThreshold()).isEqualTo(3);
        assertThat(artifact.getMetrics()).containsEntry("val_auc", 0.97);
        assertThat(artifact.getPath()).isEqualTo(file);

        // scaled: ((2 - 0.5) / 1, (4 - 4) / 2) = (1.5, 0); z = -1 + 2 * 1.5 = 2
        double[] proba = artifact.getClassifier().predictProba(new double[][]{{2.0, 4.0}});
        assertThat(proba[0]).isCloseTo(1.0 / (1.0 + Math.exp(-2.0)), within(1e-9));
    }

    @Test
    void loadsUnsupervisedArtifact() throws Exception {
        ModelArtifact artifact = loader.load(write(TestArtifacts.ISOLATION_FOREST_JSON));

        assertThat(artifact.getMode()).isEqualTo(ModelMode.UNSUPERVISED);
        assertThat(artifact.getAnomalyModel()).isInstanceOf(IsolationForestModel.class);
        assertThat(artifact.getClassifier()).isNull();
        assertThat(artifact.getAttackEventTypes()).isNull();
    }

    @Test
    void missingModeDefaultsToSupervised() throws Exception {
        ModelArtifact artifact = loader.load(write(TestArtifacts.LOGISTIC_JSON.replace("\"mode\": \"supervised\",", "")));

        assertThat(artifact.getMode()).isEqualTo(ModelMode.SUPERVISED);
    }

    @Test
    void loadsRandomForest() throws Exception {
        String json = """
                {
                  "mode": "supervised",
                  "feature_cols": ["events_count"],
                  "model": {
                    "type": "random_forest",
                    "trees": [
                      {"f": 0, "t": 5.0, "l": {"p": 0.1}, "r": {"p": 0.9}},
                      {"p": 0.5}
                    ]
                  }
                }
                """;

        ModelArtifact artifact = loader.load(write(json));

        double[] proba = artifact.getClassifier().predictProba(new double[][]{{3.0}, {8.0}});
        assertThat(proba[0]).isCloseTo(0.3, within(1e-9));
        assertThat(proba[1]).isCloseTo(0.7, within(1e-9));
    }

    @Test
    void rejectsModelFromOtherFamily() throws Exception {
        Path file = write(TestArtifacts.ISOLATION_FOREST_JSON.replace("\"unsupervised\"", "\"supervised\""));

        assertThatThrownBy(() -> loader.load(file))
                .isInstanceOf(ArtifactUnavailableException.class)
                .hasMessageContaining("Invalid model");
    }

    @Test
    void rejectsCoefficientCountMismatch() throws Exception {
        Path file = write(TestArtifacts.LOGISTIC_JSON.replace("[2.0, 0.5]", "[2.0]"));

        assertThatThrownBy(() -> loader.load(file))
                .isInstanceOf(ArtifactUnavailableException.class)
                .hasMessageContaining("coefficients");
    }

    @Test
    void rejectsUnknownMode() throws Exception {
        Path file = write(TestArtifacts.LOGISTIC_JSON.replace("\"supervised\"", "\"semi\""));

        assertThatThrownBy(() -> loader.load(file)).isInstanceOf(ArtifactUnavailableException.class);
    }

    @Test
    void rejectsArtifactWithoutFeatureCols() throws Exception {
        Path file = write("{\"mode\": \"supervised\", \"model\": {\"type\": \"logistic_regression\"}}");

        assertThatThrownBy(() -> loader.load(file))
                .isInstanceOf(ArtifactUnavailableException.class)
                .hasMessageContaining("feature_cols");
    }

    @Test
    void rejectsUnreadableFile() throws Exception {
        Path broken = write("{ not json");

        assertThatThrownBy(() -> loader.load(broken)).isInstanceOf(ArtifactUnavailableException.class);
        assertThatThrownBy(() -> loader.load(dir.resolve("missing.json"))).isInstanceOf(ArtifactUnavailableException.class);
    }
}
