package com.alertsentinel.core.detection.outlier;

import com.alertsentinel.core.detection.Detector;
import com.alertsentinel.core.model.DetectorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Registers the outlier-model detectors when the Smile library is available.
 *
 * <p>
 * Smile is an optional dependency. Its absence is not an error: the four
 * detector types are left out of the registry and a single warning is logged.
 * Configurations naming them then fail with the registry's usual
 * "unknown detector type" error.
 * </p>
 *
 * @since 1.0.0
 */
public final class OutlierModelDetectors {

    private static final Logger LOG = LoggerFactory.getLogger(OutlierModelDetectors.class);

    static final String PROBE_CLASS = "smile.anomaly.IsolationForest";

    private static final AtomicBoolean WARNED = new AtomicBoolean();

    private OutlierModelDetectors() {
        // utility class — not instantiable
    }

    /**
     * Register the outlier-model detectors through {@code registrar} if Smile
     * can be loaded.
     *
     * @param registrar receives each type key with its factory
     * @return whether the detectors were registered
     */
    public static boolean registerIfAvailable(BiConsumer<String, Function<DetectorConfig, Detector>> registrar) {
        return registerIfAvailable(registrar, PROBE_CLASS);
    }

    static boolean registerIfAvailable(BiConsumer<String, Function<DetectorConfig, Detector>> registrar,
                                       String probeClass) {
        if (!isAvailable(probeClass)) {
            if (WARNED.compareAndSet(false, true)) {
                LOG.warn("Outlier-model detectors unavailable ({} not on classpath); "
                        + "isolation_forest, knn, ecod and copod are disabled", probeClass);
            }
            return false;
        }
        registrar.accept(IsolationForestDetector.TYPE, IsolationForestDetector::new);
        registrar.accept(KnnDetector.TYPE, KnnDetector::new);
        registrar.accept(EcodDetector.TYPE, EcodDetector::new);
        registrar.accept(CopodDetector.TYPE, CopodDetector::new);
        return true;
    }

    static boolean isAvailable(String probeClass) {
        try {
            Class.forName(probeClass, false, OutlierModelDetectors.class.getClassLoader());
            return true;
        } catch (ClassNotFoundException | LinkageError e) {
            LOG.debug("Capability probe for {} failed: {}", probeClass, e.toString());
            return false;
        }
    }
}
