package com.alertsentinel.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Top-level detector configuration of an alert.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * type: OR
 * groups:
 *   - type: zscore
 *     threshold: 3.0
 *     window: 20
 *   - type: AND
 *     detectors:
 *       - type: threshold
 *         upper_bound: 500
 *       - type: mad
 *         threshold: 3.5
 * </pre>
 *
 * @since 1.0.0
 */
public final class AlertDetectorsConfig {

    private final GroupOperator operator;
    private final List<DetectorNode> groups;

    public AlertDetectorsConfig(GroupOperator operator, List<? extends DetectorNode> groups) {
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.groups = List.copyOf(Objects.requireNonNull(groups, "groups must not be null"));
    }

    /**
     * Convenience for an alert driven by a single detector.
     *
     * @param detector the only node
     * @return configuration with an AND operator around {@code detector}
     */
    public static AlertDetectorsConfig single(DetectorNode detector) {
        return new AlertDetectorsConfig(GroupOperator.AND, List.of(detector));
    }

    public GroupOperator getOperator() {
        return operator;
    }

    public List<DetectorNode> getGroups() {
        return groups;
    }

    /**
     * @return the configuration viewed as a root group
     */
    public DetectorGroup asGroup() {
        return new DetectorGroup(operator, groups);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlertDetectorsConfig that))
            return false;
        return operator == that.operator && groups.equals(that.groups);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, groups);
    }

    @Override
    public String toString() {
        return "AlertDetectorsConfig{" + operator + ", groups=" + groups + '}';
    }
}
