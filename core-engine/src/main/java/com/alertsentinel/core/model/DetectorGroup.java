package com.alertsentinel.core.model;

import java.util.List;
import java.util.Objects;

/**
 * AND/OR combination of detector nodes. Groups may nest arbitrarily.
 *
 * @since 1.0.0
 */
public final class DetectorGroup implements DetectorNode {

    private final GroupOperator operator;
    private final List<DetectorNode> detectors;

    public DetectorGroup(GroupOperator operator, List<? extends DetectorNode> detectors) {
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.detectors = List.copyOf(Objects.requireNonNull(detectors, "detectors must not be null"));
    }

    public static DetectorGroup and(DetectorNode... detectors) {
        return new DetectorGroup(GroupOperator.AND, List.of(detectors));
    }

    public static DetectorGroup or(DetectorNode... detectors) {
        return new DetectorGroup(GroupOperator.OR, List.of(detectors));
    }

    public GroupOperator getOperator() {
        return operator;
    }

    public List<DetectorNode> getDetectors() {
        return detectors;
    }

    @Override
    public boolean isGroup() {
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectorGroup that))
            return false;
        return operator == that.operator && detectors.equals(that.detectors);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, detectors);
    }

    @Override
    public String toString() {
        return "DetectorGroup{" + operator + ", detectors=" + detectors + '}';
    }
}
