package com.alertsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * Alert-level verdict returned by the evaluator.
 *
 * <p>
 * "Breaching" is the alert vocabulary: a result breaches when the configured
 * detector tree says the alert should fire for the checked point.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"is_breaching", "breach_indices", "value", "message"})
public final class DetectorResult {

    private final boolean breaching;
    private final List<Integer> breachIndices;
    private final Double value;
    private final String message;

    public DetectorResult(boolean breaching, List<Integer> breachIndices, Double value, String message) {
        this.breaching = breaching;
        this.breachIndices = List.copyOf(Objects.requireNonNull(breachIndices, "breachIndices must not be null"));
        this.value = value;
        this.message = message;
    }

    /**
     * Non-breaching result carrying only an explanation.
     *
     * @param message human-readable explanation
     * @return non-breaching result
     */
    public static DetectorResult notBreaching(String message) {
        return new DetectorResult(false, List.of(), null, message);
    }

    @JsonProperty("is_breaching")
    public boolean isBreaching() {
        return breaching;
    }

    @JsonProperty("breach_indices")
    public List<Integer> getBreachIndices() {
        return breachIndices;
    }

    /**
     * @return the checked value, or {@code null} if no point was evaluated
     */
    @JsonProperty("value")
    public Double getValue() {
        return value;
    }

    @JsonProperty("message")
    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectorResult that))
            return false;
        return breaching == that.breaching
                && breachIndices.equals(that.breachIndices)
                && Objects.equals(value, that.value)
                && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(breaching, breachIndices, value, message);
    }

    @Override
    public String toString() {
        return "DetectorResult{" +
                "breaching=" + breaching +
                ", breachIndices=" + breachIndices +
                ", value=" + value +
                ", message='" + message + '\'' +
                '}';
    }
}
