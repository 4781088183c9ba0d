package com.alertsentinel.core.config;

import com.alertsentinel.core.evaluation.DetectorEvaluator;
import com.alertsentinel.core.model.AlertDetectorsConfig;
import com.alertsentinel.core.model.DetectorConfig;
import com.alertsentinel.core.model.DetectorConfigException;
import com.alertsentinel.core.model.DetectorGroup;
import com.alertsentinel.core.model.DetectorResult;
import com.alertsentinel.core.model.GroupOperator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AlertConfigLoader} and {@link AlertConfigParser}.
 */
class AlertConfigLoaderTest {

    @Test
    @DisplayName("Should load a nested tree from the classpath")
    void shouldLoadFromClasspath() {
        AlertDetectorsConfig config = AlertConfigLoader.fromClasspath("test-alert-detectors.yml");

        assertThat(config.getOperator()).isEqualTo(GroupOperator.OR);
        assertThat(config.getGroups()).hasSize(2);

        DetectorConfig threshold = (DetectorConfig) config.getGroups().get(0);
        assertThat(threshold.getType()).isEqualTo("threshold");
        assertThat(threshold.getDouble("lower_bound")).isEmpty();
        assertThat(threshold.getDouble("upper_bound")).contains(1000.0);

        DetectorGroup group = (DetectorGroup) config.getGroups().get(1);
        assertThat(group.getOperator()).isEqualTo(GroupOperator.AND);
        assertThat(group.getDetectors()).extracting(node -> ((DetectorConfig) node).getType())
                .containsExactly("mad", "iqr");
    }

    @Test
    @DisplayName("Should throw when the classpath resource is missing")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> AlertConfigLoader.fromClasspath("nonexistent.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should throw when the file is missing")
    void shouldThrowForMissingFile(@TempDir Path dir) {
        String path = dir.resolve("missing.yml").toString();

        assertThatThrownBy(() -> AlertConfigLoader.fromFile(path))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(path);
    }

    @Test
    @DisplayName("Should load from a file")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("alert.yml");
        Files.writeString(file, "type: and\ngroups:\n  - type: IQR\n    multiplier: 3\n");

        AlertDetectorsConfig config = AlertConfigLoader.fromFile(file.toString());

        assertThat(config).isEqualTo(AlertDetectorsConfig.single(
                DetectorConfig.builder("iqr").param("multiplier", 3).build()));
    }

    @Test
    @DisplayName("Should fall back to the default classpath resource")
    void shouldLoadDefault() {
        AlertDetectorsConfig config = AlertConfigLoader.load();

        assertThat(config.getOperator()).isEqualTo(GroupOperator.OR);
        assertThat(config.getGroups()).extracting(node -> ((DetectorConfig) node).getType())
                .containsExactly("threshold", "zscore");
    }

    @Test
    @DisplayName("Should parse the persisted JSON form")
    void shouldParseJson() {
        String json = "{\"type\": \"and\", \"groups\": ["
                + "{\"type\": \"zscore\", \"threshold\": 2.5, \"window\": 20},"
                + "{\"type\": \"OR\", \"detectors\": [{\"type\": \"threshold\", \"upper_bound\": 90}]}"
                + "]}";

        AlertDetectorsConfig config = AlertConfigLoader.fromJson(json);

        assertThat(config.getOperator()).isEqualTo(GroupOperator.AND);
        DetectorConfig zscore = (DetectorConfig) config.getGroups().get(0);
        assertThat(zscore.getDouble("threshold", 0)).isEqualTo(2.5);
        assertThat(zscore.getInt("window", 0)).isEqualTo(20);
        assertThat(config.getGroups().get(1).isGroup()).isTrue();
    }

    @Test
    @DisplayName("Should reject invalid JSON")
    void shouldRejectInvalidJson() {
        assertThatThrownBy(() -> AlertConfigLoader.fromJson("{\"type\": "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid alert detectors JSON");
    }

    @Test
    @DisplayName("Should reject a document that is not a map")
    void shouldRejectScalarDocument() {
        assertThatThrownBy(() -> AlertConfigLoader.fromYaml("- just\n- a list\n"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("must be a map");
    }

    @Test
    @DisplayName("Should reject malformed trees")
    void shouldRejectMalformedTrees() {
        assertThatThrownBy(() -> AlertConfigParser.parse(Map.of("groups", List.of())))
                .isInstanceOf(DetectorConfigException.class)
                .hasMessageContaining("'type'");
        assertThatThrownBy(() -> AlertConfigParser.parse(Map.of("type", "XOR", "groups", List.of())))
                .isInstanceOf(DetectorConfigException.class)
                .hasMessageContaining("Unknown group operator");
        assertThatThrownBy(() -> AlertConfigParser.parse(Map.of("type", "OR", "groups", "zscore")))
                .isInstanceOf(DetectorConfigException.class)
                .hasMessageContaining("'groups' must be a list");
        assertThatThrownBy(() -> AlertConfigParser.parse(Map.of("type", "OR", "groups", List.of("zscore"))))
                .isInstanceOf(DetectorConfigException.class)
                .hasMessageContaining("must be a map");
    }

    @Test
    @DisplayName("Should reject duplicate YAML keys")
    void shouldRejectDuplicateKeys() {
        assertThatThrownBy(() -> AlertConfigLoader.fromYaml("type: OR\ntype: AND\ngroups: []\n"))
                .isInstanceOf(RuntimeException.class);
    }

    @Test
    @DisplayName("A loaded config should evaluate end to end")
    void shouldEvaluateLoadedConfig() {
        AlertDetectorsConfig config = AlertConfigLoader.fromClasspath("test-alert-detectors.yml");
        double[] series = new double[20];
        Arrays.fill(series, 100);
        series[19] = 5000;

        DetectorResult result = new DetectorEvaluator().evaluateDetectors(config, series, null, "requests");

        assertThat(result.isBreaching()).isTrue();
        assertThat(result.getBreachIndices()).containsExactly(19);
        assertThat(result.getValue()).isEqualTo(5000.0);
        assertThat(result.getMessage()).startsWith("threshold: requests value 5000.00 is anomalous");
    }
}
