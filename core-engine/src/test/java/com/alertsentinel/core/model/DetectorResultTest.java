package com.alertsentinel.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the JSON shape of {@link DetectorResult} and {@link DetectionResult}.
 */
class DetectorResultTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("Should serialise DetectorResult with snake_case fields")
    void shouldSerialiseDetectorResult() throws Exception {
        DetectorResult result = new DetectorResult(true, List.of(11), 100.0, "zscore: anomalous");

        JsonNode json = mapper.readTree(mapper.writeValueAsString(result));

        assertThat(json.get("is_breaching").asBoolean()).isTrue();
        assertThat(json.get("breach_indices").get(0).asInt()).isEqualTo(11);
        assertThat(json.get("value").asDouble()).isEqualTo(100.0);
        assertThat(json.get("message").asText()).isEqualTo("zscore: anomalous");
    }

    @Test
    @DisplayName("Should keep null score slots when serialising DetectionResult")
    void shouldSerialiseNullScores() throws Exception {
        DetectionResult result = DetectionResult.builder()
                .allScores(Arrays.asList(null, 1.5))
                .metadata("mean", 10.0)
                .build();

        JsonNode json = mapper.readTree(mapper.writeValueAsString(result));

        assertThat(json.get("is_anomaly").asBoolean()).isFalse();
        assertThat(json.get("score").isNull()).isTrue();
        assertThat(json.get("all_scores").get(0).isNull()).isTrue();
        assertThat(json.get("all_scores").get(1).asDouble()).isEqualTo(1.5);
        assertThat(json.get("metadata").get("mean").asDouble()).isEqualTo(10.0);
    }

    @Test
    @DisplayName("Should expose the insufficient-data reason")
    void shouldExposeReason() {
        DetectionResult result = DetectionResult.insufficientData("Not enough data");

        assertThat(result.isAnomaly()).isFalse();
        assertThat(result.getScore()).isNull();
        assertThat(result.getTriggeredIndices()).isEmpty();
        assertThat(result.getReason()).isEqualTo("Not enough data");
    }
}
