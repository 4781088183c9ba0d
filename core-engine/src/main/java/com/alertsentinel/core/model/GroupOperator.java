package com.alertsentinel.core.model;

import java.util.Locale;

/**
 * Boolean operator combining the verdicts of a group or ensemble.
 *
 * @since 1.0.0
 */
public enum GroupOperator {

    AND(" AND "),
    OR(" OR ");

    private final String joiner;

    GroupOperator(String joiner) {
        this.joiner = joiner;
    }

    /**
     * @return separator used when joining child messages
     */
    public String joiner() {
        return joiner;
    }

    /**
     * Case-insensitive lookup.
     *
     * @param value operator name, e.g. {@code "and"}
     * @return the operator
     * @throws DetectorConfigException if {@code value} is not AND or OR
     */
    public static GroupOperator parse(String value) {
        String normalised = value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
        return switch (normalised) {
            case "AND" -> AND;
            case "OR" -> OR;
            default -> throw new DetectorConfigException(
                    "Unknown group operator: '" + value + "'. Supported: AND, OR");
        };
    }

    /**
     * @param value candidate operator name
     * @return whether {@code value} names a group operator
     */
    public static boolean isOperator(Object value) {
        return value instanceof String s
                && ("AND".equalsIgnoreCase(s.trim()) || "OR".equalsIgnoreCase(s.trim()));
    }
}
