package com.alertsentinel.core.detection;

import com.alertsentinel.core.model.DetectionResult;
import com.alertsentinel.core.model.DetectorConfig;
import com.alertsentinel.core.model.DetectorConfigException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link EnsembleDetector}.
 */
class EnsembleDetectorTest {

    private static final DetectorConfig ABOVE_50 = threshold(null, 50.0);
    private static final DetectorConfig ABOVE_80 = threshold(null, 80.0);
    private static final DetectorConfig BELOW_5 = threshold(5.0, null);

    private final DetectorRegistry registry = DetectorRegistry.defaultRegistry();

    @Test
    @DisplayName("Should require at least two detectors")
    void shouldRejectSingleDetector() {
        assertThatThrownBy(() -> ensemble("AND", ABOVE_50))
                .isInstanceOf(DetectorConfigException.class)
                .hasMessageContaining("at least 2 detectors required");
    }

    @Test
    @DisplayName("Should allow at most five detectors")
    void shouldRejectTooManyDetectors() {
        DetectorConfig[] six = Collections.nCopies(6, ABOVE_50).toArray(new DetectorConfig[0]);

        assertThatThrownBy(() -> ensemble("OR", six))
                .isInstanceOf(DetectorConfigException.class)
                .hasMessageContaining("at most 5");
    }

    @Test
    @DisplayName("Should reject a nested ensemble")
    void shouldRejectNestedEnsemble() {
        DetectorConfig inner = DetectorConfig.builder("ensemble")
                .param("detectors", List.of(ABOVE_50, ABOVE_80))
                .build();

        assertThatThrownBy(() -> ensemble("AND", inner, ABOVE_50))
                .isInstanceOf(DetectorConfigException.class)
                .hasMessageContaining("nested");
    }

    @Test
    @DisplayName("Should reject an unknown child type at construction")
    void shouldRejectUnknownChild() {
        DetectorConfig bogus = DetectorConfig.of(Map.of("type", "prophet"));

        assertThatThrownBy(() -> ensemble("AND", ABOVE_50, bogus))
                .isInstanceOf(DetectorConfigException.class)
                .hasMessageContaining("prophet");
    }

    @Test
    @DisplayName("Should reject a misconfigured child at construction")
    void shouldRejectInvalidChildParameters() {
        DetectorConfig badWindow = DetectorConfig.builder("zscore").param("window", 0).build();

        assertThatThrownBy(() -> ensemble("OR", ABOVE_50, badWindow))
                .isInstanceOf(DetectorConfigException.class)
                .hasMessageContaining("window");
    }

    @Test
    @DisplayName("AND and OR should match the boolean combination of their children")
    void shouldCombineLikeBooleans() {
        Detector a = registry.getDetector(ABOVE_50);
        Detector b = registry.getDetector(BELOW_5);
        EnsembleDetector and = ensemble("AND", ABOVE_50, BELOW_5);
        EnsembleDetector or = ensemble("OR", ABOVE_50, BELOW_5);

        for (double last : new double[]{0, 20, 100}) {
            double[] series = {10, 20, last};
            boolean aHit = a.detect(series).isAnomaly();
            boolean bHit = b.detect(series).isAnomaly();

            assertThat(and.detect(series).isAnomaly()).isEqualTo(aHit && bHit);
            assertThat(or.detect(series).isAnomaly()).isEqualTo(aHit || bHit);
        }
    }

    @Test
    @DisplayName("Should average the children's scores")
    void shouldAverageScores() {
        DetectionResult result = ensemble("OR", ABOVE_50, ABOVE_80).detect(new double[]{10, 60});

        assertThat(result.isAnomaly()).isTrue();
        assertThat(result.getScore()).isEqualTo(60.0);
        assertThat(result.getMetadata()).containsEntry("mode", "OR").containsKey("detector_results");
    }

    @Test
    @DisplayName("Should intersect triggered indices for AND and unite them for OR")
    void shouldCombineBatchIndices() {
        double[] series = {10, 60, 90, 20};

        DetectionResult and = ensemble("AND", ABOVE_50, ABOVE_80).detectBatch(series);
        DetectionResult or = ensemble("OR", ABOVE_50, ABOVE_80).detectBatch(series);

        assertThat(and.getTriggeredIndices()).containsExactly(2);
        assertThat(or.getTriggeredIndices()).containsExactly(1, 2);
        assertThat(ensemble("AND", ABOVE_80, BELOW_5).detectBatch(series).isAnomaly()).isFalse();
    }

    @Test
    @DisplayName("Should average per-point scores over the detectors that scored the point")
    void shouldAveragePerPointScores() {
        DetectorConfig zscore = DetectorConfig.builder("zscore").param("window", 3).build();
        DetectorConfig unbounded = threshold(null, null);

        DetectionResult result = ensemble("OR", zscore, unbounded).detectBatch(new double[]{1, 2, 3, 4, 5});

        assertThat(result.getAllScores()).hasSize(5);
        assertThat(result.getAllScores().get(0)).isEqualTo(1.0);
        double zAtThree = 2 / Math.sqrt(2.0 / 3);
        assertThat(result.getAllScores().get(3)).isCloseTo((4 + zAtThree) / 2, within(1e-9));
    }

    @Test
    @DisplayName("Should reuse its children across calls")
    void shouldBeRepeatable() {
        EnsembleDetector detector = ensemble("AND", ABOVE_50, ABOVE_80);
        double[] series = {10, 60, 90};

        assertThat(detector.detect(series)).isEqualTo(detector.detect(series));
        assertThat(detector.getDetectorTypes()).containsExactly("threshold", "threshold");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private EnsembleDetector ensemble(String mode, DetectorConfig... detectors) {
        return new EnsembleDetector(DetectorConfig.builder("ensemble")
                .param("mode", mode)
                .param("detectors", List.of(detectors))
                .build(), registry);
    }

    private static DetectorConfig threshold(Double lower, Double upper) {
        return DetectorConfig.builder("threshold")
                .param("lower_bound", lower)
                .param("upper_bound", upper)
                .build();
    }
}
