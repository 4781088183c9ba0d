package com.alertsentinel.core.detection;

import com.alertsentinel.core.detection.outlier.OutlierModelDetectors;
import com.alertsentinel.core.model.DetectorConfig;
import com.alertsentinel.core.model.DetectorConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Name-keyed table of detector factories.
 *
 * <p>
 * This is the single point of extension when adding new detector types:
 * {@link #register(String, Function) register} a factory under the type key
 * that configurations declare.
 * </p>
 *
 * <h3>Built-in detectors</h3>
 * <p>
 * The statistical detectors, {@code kmeans} and {@code ensemble} register on
 * first use of the registry. The outlier-model detectors ({@code isolation_forest},
 * {@code knn}, {@code ecod}, {@code copod}) register only when their
 * machine-learning library is on the classpath; otherwise those keys are
 * simply absent.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Built-in registration happens exactly once, under a lock; lookups are
 * lock-free afterwards. Detectors returned by {@link #getDetector} are fresh
 * instances and are not shared.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorRegistry.class);

    private final Map<String, Function<DetectorConfig, Detector>> factories = new ConcurrentHashMap<>();
    private volatile boolean builtInsRegistered;

    private static final class Holder {
        private static final DetectorRegistry DEFAULT = new DetectorRegistry();
    }

    /**
     * @return the process-wide registry
     */
    public static DetectorRegistry defaultRegistry() {
        return Holder.DEFAULT;
    }

    /**
     * Register a factory. Registering the same key again replaces the
     * previous factory.
     *
     * @param type    detector type key, matched case-insensitively
     * @param factory builds a detector from its configuration
     * @return this registry
     */
    public DetectorRegistry register(String type, Function<DetectorConfig, Detector> factory) {
        Objects.requireNonNull(type, "Detector type must not be null");
        Objects.requireNonNull(factory, "Detector factory must not be null");
        ensureBuiltIns();
        put(type, factory);
        return this;
    }

    /**
     * Build a detector for the given configuration.
     *
     * @param config detector configuration; must not be {@code null}
     * @return a new detector instance
     * @throws DetectorConfigException if the type is missing or unknown, or
     *                                 the configuration is invalid for it
     */
    public Detector getDetector(DetectorConfig config) {
        Function<DetectorConfig, Detector> factory = requireRegistered(config);
        return factory.apply(config);
    }

    /**
     * Build a detector from a parsed configuration map.
     *
     * @param config map holding {@code type} and the detector parameters
     * @return a new detector instance
     * @throws DetectorConfigException if the type is missing or unknown
     */
    public Detector getDetector(Map<String, ?> config) {
        return getDetector(DetectorConfig.of(config));
    }

    /**
     * @return sorted, unmodifiable set of registered type keys
     */
    public Set<String> getAvailableTypes() {
        ensureBuiltIns();
        return Collections.unmodifiableSet(new TreeSet<>(factories.keySet()));
    }

    public boolean isRegistered(String type) {
        ensureBuiltIns();
        return type != null && factories.containsKey(type.toLowerCase(Locale.ROOT));
    }

    /**
     * Resolve the factory for a configuration without building the detector.
     *
     * @param config detector configuration
     * @return the registered factory
     * @throws DetectorConfigException if the type is missing or unknown
     */
    private Function<DetectorConfig, Detector> requireRegistered(DetectorConfig config) {
        Objects.requireNonNull(config, "DetectorConfig must not be null");
        ensureBuiltIns();
        if (config.getType() == null || config.getType().isBlank()) {
            throw new DetectorConfigException(
                    "Detector config is missing 'type'. Available detectors: " + getAvailableTypes());
        }
        Function<DetectorConfig, Detector> factory = factories.get(config.getType());
        if (factory == null) {
            throw new DetectorConfigException("Unknown detector type: '" + config.getType()
                    + "'. Available detectors: " + getAvailableTypes());
        }
        return factory;
    }

    private void ensureBuiltIns() {
        if (builtInsRegistered) {
            return;
        }
        synchronized (this) {
            if (builtInsRegistered) {
                return;
            }
            put(ThresholdDetector.TYPE, ThresholdDetector::new);
            put(ZScoreDetector.TYPE, ZScoreDetector::new);
            put(MadDetector.TYPE, MadDetector::new);
            put(IqrDetector.TYPE, IqrDetector::new);
            put(KMeansDetector.TYPE, KMeansDetector::new);
            put(EnsembleDetector.TYPE, config -> new EnsembleDetector(config, this));
            OutlierModelDetectors.registerIfAvailable(this::put);
            builtInsRegistered = true;
            LOG.info("Detector registry initialised with {} detector type(s): {}",
                    factories.size(), new TreeSet<>(factories.keySet()));
        }
    }

    private void put(String type, Function<DetectorConfig, Detector> factory) {
        factories.put(type.toLowerCase(Locale.ROOT), factory);
    }
}
