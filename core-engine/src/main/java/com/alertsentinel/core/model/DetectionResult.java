package com.alertsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Verdict produced by a single detector.
 *
 * <p>
 * For single-point evaluation ({@code detect}) {@link #isAnomaly()} reflects
 * only the checked point. For batch evaluation ({@code detectBatch}) it is
 * {@code true} exactly when {@link #getTriggeredIndices()} is non-empty.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}, or {@link #insufficientData(String)} when the
 * series is too short to evaluate. Instances are immutable.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonPropertyOrder({"is_anomaly", "score", "triggered_indices", "all_scores", "metadata"})
public final class DetectionResult {

    /** Metadata key carrying a human-readable explanation for a skipped evaluation. */
    public static final String REASON_KEY = "reason";

    private final boolean anomaly;
    private final Double score;
    private final List<Integer> triggeredIndices;
    private final List<Double> allScores;
    private final Map<String, Object> metadata;

    private DetectionResult(Builder builder) {
        this.anomaly = builder.anomaly;
        this.score = builder.score;
        this.triggeredIndices = Collections.unmodifiableList(new ArrayList<>(builder.triggeredIndices));
        // allScores may legitimately hold nulls, so no List.copyOf here
        this.allScores = Collections.unmodifiableList(new ArrayList<>(builder.allScores));
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
    }

    /**
     * Create a new {@link Builder}.
     *
     * @return builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Non-anomalous result for a series that cannot be evaluated yet.
     *
     * @param reason human-readable explanation, stored under {@value #REASON_KEY}
     * @return a non-anomalous result with no score
     */
    public static DetectionResult insufficientData(String reason) {
        return builder().metadata(REASON_KEY, reason).build();
    }

    /**
     * Fluent builder for {@link DetectionResult}.
     */
    public static class Builder {
        private boolean anomaly;
        private Double score;
        private List<Integer> triggeredIndices = new ArrayList<>();
        private List<Double> allScores = new ArrayList<>();
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        public Builder anomaly(boolean anomaly) {
            this.anomaly = anomaly;
            return this;
        }

        public Builder score(Double score) {
            this.score = score;
            return this;
        }

        public Builder triggeredIndices(List<Integer> triggeredIndices) {
            this.triggeredIndices = Objects.requireNonNull(triggeredIndices, "triggeredIndices must not be null");
            return this;
        }

        public Builder allScores(List<Double> allScores) {
            this.allScores = Objects.requireNonNull(allScores, "allScores must not be null");
            return this;
        }

        public Builder metadata(String key, Object value) {
            metadata.put(Objects.requireNonNull(key, "metadata key must not be null"), value);
            return this;
        }

        public Builder metadata(Map<String, Object> values) {
            metadata.putAll(values);
            return this;
        }

        public DetectionResult build() {
            return new DetectionResult(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    @JsonProperty("is_anomaly")
    public boolean isAnomaly() {
        return anomaly;
    }

    /**
     * @return detector-specific anomaly magnitude, or {@code null} when undefined
     */
    @JsonProperty("score")
    public Double getScore() {
        return score;
    }

    @JsonProperty("triggered_indices")
    public List<Integer> getTriggeredIndices() {
        return triggeredIndices;
    }

    /**
     * @return per-point scores aligned with the input; {@code null} where no
     *         score could be computed
     */
    @JsonProperty("all_scores")
    public List<Double> getAllScores() {
        return allScores;
    }

    @JsonProperty("metadata")
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /**
     * @return the insufficient-data explanation, or {@code null} if the
     *         detector evaluated the series
     */
    @JsonIgnore
    public String getReason() {
        Object reason = metadata.get(REASON_KEY);
        return reason == null ? null : reason.toString();
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectionResult that))
            return false;
        return anomaly == that.anomaly
                && Objects.equals(score, that.score)
                && triggeredIndices.equals(that.triggeredIndices)
                && allScores.equals(that.allScores)
                && metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(anomaly, score, triggeredIndices, allScores, metadata);
    }

    @Override
    public String toString() {
        return "DetectionResult{" +
                "anomaly=" + anomaly +
                ", score=" + score +
                ", triggeredIndices=" + triggeredIndices +
                ", metadata=" + metadata +
                '}';
    }
}
