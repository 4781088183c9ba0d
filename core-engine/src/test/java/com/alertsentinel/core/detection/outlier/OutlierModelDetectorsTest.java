package com.alertsentinel.core.detection.outlier;

import com.alertsentinel.core.detection.Detector;
import com.alertsentinel.core.model.DetectorConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link OutlierModelDetectors}.
 */
class OutlierModelDetectorsTest {

    @Test
    @DisplayName("Should register all four models when Smile is on the classpath")
    void shouldRegisterWhenAvailable() {
        Map<String, Function<DetectorConfig, Detector>> registered = new LinkedHashMap<>();

        boolean available = OutlierModelDetectors.registerIfAvailable(registered::put);

        assertThat(available).isTrue();
        assertThat(registered).containsOnlyKeys("isolation_forest", "knn", "ecod", "copod");
        assertThat(registered.get("knn").apply(DetectorConfig.builder("knn").build()))
                .isInstanceOf(KnnDetector.class);
    }

    @Test
    @DisplayName("Should register nothing when the probe class is missing")
    void shouldSkipWhenUnavailable() {
        Map<String, Function<DetectorConfig, Detector>> registered = new LinkedHashMap<>();

        boolean available = OutlierModelDetectors.registerIfAvailable(registered::put, "no.such.Library");

        assertThat(available).isFalse();
        assertThat(registered).isEmpty();
    }
}
