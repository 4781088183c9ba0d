package com.alertsentinel.core.detection;

import com.alertsentinel.core.model.DetectorConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Properties shared by the rolling-window detectors.
 */
class RollingWindowPropertiesTest {

    private static final double[] NOISY = noisySeries();

    @Test
    @DisplayName("Raising the z-score threshold should only remove triggers")
    void zScoreThresholdIsMonotonic() {
        assertMonotonic("zscore", "threshold", 1.0, 2.0, 3.0);
    }

    @Test
    @DisplayName("Raising the MAD threshold should only remove triggers")
    void madThresholdIsMonotonic() {
        assertMonotonic("mad", "threshold", 1.0, 2.0, 3.5);
    }

    @Test
    @DisplayName("Raising the IQR multiplier should only remove triggers")
    void iqrMultiplierIsMonotonic() {
        assertMonotonic("iqr", "multiplier", 0.5, 1.5, 3.0);
    }

    @Test
    @DisplayName("Batch detection should be repeatable for every rolling detector")
    void batchDetectionIsIdempotent() {
        for (String type : List.of("zscore", "mad", "iqr")) {
            Detector detector = DetectorRegistry.defaultRegistry()
                    .getDetector(DetectorConfig.builder(type).param("window", 12).build());
            assertThat(detector.detectBatch(NOISY)).isEqualTo(detector.detectBatch(NOISY));
        }
    }

    private static void assertMonotonic(String type, String parameter, double... values) {
        List<Integer> previous = null;
        for (double value : values) {
            Detector detector = DetectorRegistry.defaultRegistry().getDetector(DetectorConfig.builder(type)
                    .param("window", 12)
                    .param(parameter, value)
                    .build());
            List<Integer> triggered = detector.getBreachPoints(NOISY);
            if (previous != null) {
                assertThat(previous).containsAll(triggered);
            }
            previous = triggered;
        }
    }

    private static double[] noisySeries() {
        Random random = new Random(7);
        double[] series = new double[200];
        for (int i = 0; i < series.length; i++) {
            series[i] = 100 + random.nextGaussian() * 5;
            if (i % 37 == 0) {
                series[i] += 40;
            }
        }
        return series;
    }
}
