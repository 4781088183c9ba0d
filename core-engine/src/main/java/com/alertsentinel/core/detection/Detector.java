package com.alertsentinel.core.detection;

import com.alertsentinel.core.model.DetectionResult;

import java.util.List;

/**
 * Contract for all anomaly detectors.
 * <p>
 * Implementations are <strong>stateless</strong> between calls: the verdict
 * depends only on the configuration and the series passed in, so calling a
 * method twice with the same series yields equal results.
 * </p>
 * <p>
 * A series that is too short to evaluate is not an error: detectors return a
 * non-anomalous {@link DetectionResult} whose {@code reason} explains the
 * shortfall.
 * </p>
 */
public interface Detector {

    /**
     * Decide whether the last point of the series is anomalous.
     *
     * @param series values in chronological order
     * @return verdict for the last point
     */
    DetectionResult detect(double[] series);

    /**
     * Evaluate every point that has enough history.
     *
     * @param series values in chronological order
     * @return verdict listing every anomalous index, with per-point scores
     */
    DetectionResult detectBatch(double[] series);

    /**
     * @param series values in chronological order
     * @return indices of all anomalous points
     */
    default List<Integer> getBreachPoints(double[] series) {
        return detectBatch(series).getTriggeredIndices();
    }

    /**
     * Return the registry key of this detector.
     *
     * @return detector type, e.g. {@code "zscore"}
     */
    String getType();
}
