package com.alertsentinel.core.detection;

import com.alertsentinel.core.model.DetectionResult;
import com.alertsentinel.core.model.DetectorConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Objects;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link IqrDetector}.
 */
class IqrDetectorTest {

    private IqrDetector detector;

    @BeforeEach
    void setUp() {
        detector = new IqrDetector(DetectorConfig.builder("iqr")
                .param("window", 10)
                .param("multiplier", 1.5)
                .build());
    }

    @Test
    @DisplayName("Should fire above the upper fence and score the distance in IQRs")
    void shouldFireAboveUpperFence() {
        DetectionResult result = detector.detect(series(30));

        // 1..10 -> Q1 = 3.25, Q3 = 7.75, IQR = 4.5, upper fence = 14.5
        assertThat(result.isAnomaly()).isTrue();
        assertThat((Double) result.getMetadata().get("q1")).isCloseTo(3.25, within(1e-9));
        assertThat((Double) result.getMetadata().get("q3")).isCloseTo(7.75, within(1e-9));
        assertThat(result.getScore()).isCloseTo((30 - 14.5) / 4.5, within(1e-9));
    }

    @Test
    @DisplayName("Should fire below the lower fence")
    void shouldFireBelowLowerFence() {
        DetectionResult result = detector.detect(series(-10));

        assertThat(result.isAnomaly()).isTrue();
        assertThat(result.getScore()).isCloseTo((-3.5 + 10) / 4.5, within(1e-9));
    }

    @Test
    @DisplayName("Should score zero inside the fences")
    void shouldNotFireInsideFences() {
        DetectionResult result = detector.detect(series(5));

        assertThat(result.isAnomaly()).isFalse();
        assertThat(result.getScore()).isZero();
    }

    @Test
    @DisplayName("Should never fire on constant data, whatever the multiplier")
    void shouldNeverFireOnConstantData() {
        double[] constant = new double[40];
        Arrays.fill(constant, 5);
        IqrDetector tight = new IqrDetector(DetectorConfig.builder("iqr")
                .param("window", 10)
                .param("multiplier", 0.0)
                .build());

        DetectionResult result = tight.detectBatch(constant);

        assertThat(result.isAnomaly()).isFalse();
        assertThat(result.getTriggeredIndices()).isEmpty();
        assertThat(result.getAllScores().stream().filter(Objects::nonNull)).hasSize(30).containsOnly(0.0);
    }

    private static double[] series(double last) {
        return new double[]{1, 2, 3, 4, 5, 6, 7, 8, 9, 10, last};
    }
}
