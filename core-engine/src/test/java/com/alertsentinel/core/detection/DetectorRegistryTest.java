package com.alertsentinel.core.detection;

import com.alertsentinel.core.model.DetectionResult;
import com.alertsentinel.core.model.DetectorConfig;
import com.alertsentinel.core.model.DetectorConfigException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DetectorRegistry}.
 */
class DetectorRegistryTest {

    @Test
    @DisplayName("Should create each built-in detector for its type key")
    void shouldCreateBuiltIns() {
        DetectorRegistry registry = new DetectorRegistry();

        assertThat(registry.getDetector(Map.of("type", "threshold"))).isInstanceOf(ThresholdDetector.class);
        assertThat(registry.getDetector(Map.of("type", "zscore"))).isInstanceOf(ZScoreDetector.class);
        assertThat(registry.getDetector(Map.of("type", "mad"))).isInstanceOf(MadDetector.class);
        assertThat(registry.getDetector(Map.of("type", "iqr"))).isInstanceOf(IqrDetector.class);
        assertThat(registry.getDetector(Map.of("type", "kmeans"))).isInstanceOf(KMeansDetector.class);
        assertThat(registry.getDetector(Map.of("type", "ensemble",
                "detectors", List.of(Map.of("type", "zscore"), Map.of("type", "mad")))))
                .isInstanceOf(EnsembleDetector.class);
    }

    @Test
    @DisplayName("Should match type keys case-insensitively")
    void shouldIgnoreCase() {
        assertThat(new DetectorRegistry().getDetector(Map.of("type", "ZScore")).getType()).isEqualTo("zscore");
    }

    @Test
    @DisplayName("Should list the registered types when the type is unknown")
    void shouldThrowForUnknownType() {
        DetectorRegistry registry = new DetectorRegistry();

        assertThatThrownBy(() -> registry.getDetector(Map.of("type", "not_a_real_type")))
                .isInstanceOf(DetectorConfigException.class)
                .hasMessageContaining("Unknown detector type")
                .hasMessageContaining("not_a_real_type")
                .hasMessageContaining("iqr")
                .hasMessageContaining("kmeans")
                .hasMessageContaining("mad")
                .hasMessageContaining("threshold")
                .hasMessageContaining("zscore");
    }

    @Test
    @DisplayName("Should throw when the type is missing")
    void shouldThrowForMissingType() {
        assertThatThrownBy(() -> new DetectorRegistry().getDetector(Map.of("window", 10)))
                .isInstanceOf(DetectorConfigException.class)
                .hasMessageContaining("missing 'type'");
    }

    @Test
    @DisplayName("Should propagate detector validation errors")
    void shouldPropagateValidationErrors() {
        assertThatThrownBy(() -> new DetectorRegistry().getDetector(Map.of("type", "zscore", "window", -1)))
                .isInstanceOf(DetectorConfigException.class);
    }

    @Test
    @DisplayName("Should include the outlier-model detectors when Smile is present")
    void shouldRegisterOutlierModels() {
        assertThat(new DetectorRegistry().getAvailableTypes())
                .contains("threshold", "zscore", "mad", "iqr", "kmeans", "ensemble",
                        "isolation_forest", "knn", "ecod", "copod");
    }

    @Test
    @DisplayName("Should accept custom detector types")
    void shouldRegisterCustomType() {
        DetectorRegistry registry = new DetectorRegistry();
        registry.register("Always", config -> new Detector() {
            @Override
            public DetectionResult detect(double[] series) {
                return DetectionResult.builder().anomaly(true).build();
            }

            @Override
            public DetectionResult detectBatch(double[] series) {
                return detect(series);
            }

            @Override
            public String getType() {
                return "always";
            }
        });

        assertThat(registry.isRegistered("always")).isTrue();
        assertThat(registry.getAvailableTypes()).contains("always", "zscore");
        assertThat(registry.getDetector(DetectorConfig.builder("always").build())
                .detect(new double[]{1}).isAnomaly()).isTrue();
    }

    @Test
    @DisplayName("Should register built-ins exactly once under concurrent first use")
    void shouldInitialiseOnceConcurrently() throws Exception {
        DetectorRegistry registry = new DetectorRegistry();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Set<String>>> tasks = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                tasks.add(registry::getAvailableTypes);
            }
            Set<String> expected = new DetectorRegistry().getAvailableTypes();
            for (Future<Set<String>> future : pool.invokeAll(tasks)) {
                assertThat(future.get()).isEqualTo(expected);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should expose a shared default registry")
    void shouldShareDefaultRegistry() {
        assertThat(DetectorRegistry.defaultRegistry()).isSameAs(DetectorRegistry.defaultRegistry());
    }
}
