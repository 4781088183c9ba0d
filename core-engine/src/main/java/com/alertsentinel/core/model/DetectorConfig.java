package com.alertsentinel.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Configuration of a single detector.
 *
 * <p>
 * The {@code type} discriminant selects the detector implementation; every
 * other key is a kind-specific parameter (for example {@code window},
 * {@code threshold} or {@code lower_bound}). Parameters are kept as a
 * free-form map so that configurations persisted by the alerting layer can be
 * passed through without a rigid schema; detectors read them through the
 * typed accessors below.
 * </p>
 *
 * <p>
 * Instances are immutable. The {@code type} may be {@code null}: the registry
 * reports that as a configuration error when the detector is built.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorConfig implements DetectorNode {

    public static final String TYPE_KEY = "type";

    private final String type;
    private final Map<String, Object> parameters;

    private DetectorConfig(String type, Map<String, Object> parameters) {
        this.type = type;
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    /**
     * Build a configuration from a parsed map. The {@code type} entry becomes
     * the discriminant, all other entries become parameters.
     *
     * @param values parsed configuration; must not be {@code null}
     * @return immutable configuration
     */
    public static DetectorConfig of(Map<?, ?> values) {
        Objects.requireNonNull(values, "Detector config map must not be null");
        Map<String, Object> params = stringKeys(values);
        Object rawType = params.remove(TYPE_KEY);
        String type = rawType == null ? null : rawType.toString().trim().toLowerCase(Locale.ROOT);
        return new DetectorConfig(type, params);
    }

    /**
     * Copy a parsed map, turning its keys into strings.
     *
     * @param values parsed map, e.g. from YAML or JSON
     * @return mutable copy with string keys, in the original order
     */
    private static Map<String, Object> stringKeys(Map<?, ?> values) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : values.entrySet()) {
            copy.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return copy;
    }

    /**
     * Create a new {@link Builder}.
     *
     * @param type detector type key, e.g. {@code "zscore"}
     * @return builder instance
     */
    public static Builder builder(String type) {
        return new Builder(type);
    }

    /**
     * Fluent builder for programmatic configurations.
     */
    public static class Builder {
        private final String type;
        private final Map<String, Object> parameters = new LinkedHashMap<>();

        private Builder(String type) {
            this.type = type == null ? null : type.toLowerCase(Locale.ROOT);
        }

        public Builder param(String key, Object value) {
            parameters.put(Objects.requireNonNull(key, "Parameter key must not be null"), value);
            return this;
        }

        public DetectorConfig build() {
            return new DetectorConfig(type, parameters);
        }
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    /**
     * @return lower-case detector type, or {@code null} if none was declared
     */
    public String getType() {
        return type;
    }

    /**
     * @return unmodifiable view of all parameters except {@code type}
     */
    public Map<String, Object> getParameters() {
        return parameters;
    }

    public boolean has(String key) {
        return parameters.get(key) != null;
    }

    /**
     * Retrieve a numeric parameter, coercing JSON number types and
     * string-encoded numbers.
     *
     * @param key parameter name
     * @return the value, or empty if absent or {@code null}
     * @throws DetectorConfigException if the value is present but not numeric
     */
    public Optional<Double> getDouble(String key) {
        Object raw = parameters.get(key);
        if (raw == null) {
            return Optional.empty();
        }
        if (raw instanceof Number n) {
            return Optional.of(n.doubleValue());
        }
        if (raw instanceof String s) {
            try {
                return Optional.of(Double.parseDouble(s.trim()));
            } catch (NumberFormatException e) {
                throw invalid(key, "a number", raw, e);
            }
        }
        throw invalid(key, "a number", raw, null);
    }

    public double getDouble(String key, double defaultValue) {
        return getDouble(key).orElse(defaultValue);
    }

    /**
     * Retrieve an integral parameter. Whole doubles such as {@code 10.0} are
     * accepted because JSON round trips may produce them.
     *
     * @param key          parameter name
     * @param defaultValue value used when the parameter is absent
     * @return the parameter value
     * @throws DetectorConfigException if the value is not a whole number
     */
    public int getInt(String key, int defaultValue) {
        Optional<Double> value = getDouble(key);
        if (value.isEmpty()) {
            return defaultValue;
        }
        double d = value.get();
        if (d != Math.rint(d) || Double.isInfinite(d) || Math.abs(d) > Integer.MAX_VALUE) {
            throw invalid(key, "an integer", parameters.get(key), null);
        }
        return (int) d;
    }

    public Optional<String> getString(String key) {
        Object raw = parameters.get(key);
        return raw == null ? Optional.empty() : Optional.of(raw.toString());
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        Object raw = parameters.get(key);
        if (raw == null) {
            return defaultValue;
        }
        if (raw instanceof Boolean b) {
            return b;
        }
        if (raw instanceof String s && ("true".equalsIgnoreCase(s) || "false".equalsIgnoreCase(s))) {
            return Boolean.parseBoolean(s);
        }
        throw invalid(key, "a boolean", raw, null);
    }

    /**
     * @param key parameter name
     * @return the list as strings, or an empty list if absent
     * @throws DetectorConfigException if the value is not a list
     */
    public List<String> getStringList(String key) {
        Object raw = parameters.get(key);
        if (raw == null) {
            return List.of();
        }
        if (!(raw instanceof List<?> list)) {
            throw invalid(key, "a list", raw, null);
        }
        List<String> values = new ArrayList<>(list.size());
        for (Object item : list) {
            values.add(String.valueOf(item));
        }
        return Collections.unmodifiableList(values);
    }

    /**
     * @param key parameter name
     * @return the nested map, or an empty map if absent
     * @throws DetectorConfigException if the value is not a map
     */
    public Map<String, Object> getMap(String key) {
        Object raw = parameters.get(key);
        if (raw == null) {
            return Map.of();
        }
        if (!(raw instanceof Map<?, ?> map)) {
            throw invalid(key, "a map", raw, null);
        }
        return Collections.unmodifiableMap(stringKeys(map));
    }

    /**
     * Retrieve a list of nested detector configurations, given either as
     * parsed maps or as {@link DetectorConfig} instances.
     *
     * @param key parameter name
     * @return the nested configurations, or an empty list if absent
     * @throws DetectorConfigException if any entry is neither
     */
    public List<DetectorConfig> getConfigList(String key) {
        Object raw = parameters.get(key);
        if (raw == null) {
            return List.of();
        }
        if (!(raw instanceof List<?> list)) {
            throw invalid(key, "a list of detector configs", raw, null);
        }
        List<DetectorConfig> configs = new ArrayList<>(list.size());
        for (Object item : list) {
            if (item instanceof DetectorConfig config) {
                configs.add(config);
            } else if (item instanceof Map<?, ?> map) {
                configs.add(DetectorConfig.of(map));
            } else {
                throw invalid(key, "a list of detector configs", raw, null);
            }
        }
        return Collections.unmodifiableList(configs);
    }

    private DetectorConfigException invalid(String key, String expected, Object actual, Throwable cause) {
        String message = "Parameter '" + key + "' of detector '" + type + "' must be " + expected
                + ", got: " + actual;
        return cause == null ? new DetectorConfigException(message) : new DetectorConfigException(message, cause);
    }

    @Override
    public boolean isGroup() {
        return false;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectorConfig that))
            return false;
        return Objects.equals(type, that.type) && parameters.equals(that.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, parameters);
    }

    @Override
    public String toString() {
        return "DetectorConfig{type='" + type + "', parameters=" + parameters + '}';
    }
}
