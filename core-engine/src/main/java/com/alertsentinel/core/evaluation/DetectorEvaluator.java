package com.alertsentinel.core.evaluation;

import com.alertsentinel.core.detection.Detector;
import com.alertsentinel.core.detection.DetectorRegistry;
import com.alertsentinel.core.model.AlertDetectorsConfig;
import com.alertsentinel.core.model.DetectionResult;
import com.alertsentinel.core.model.DetectorConfig;
import com.alertsentinel.core.model.DetectorConfigException;
import com.alertsentinel.core.model.DetectorGroup;
import com.alertsentinel.core.model.DetectorNode;
import com.alertsentinel.core.model.DetectorResult;
import com.alertsentinel.core.model.GroupOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Entry point of the engine: evaluates an alert's detector tree against a
 * series.
 *
 * <h3>Evaluation</h3>
 * <p>
 * The series is cut after the checked index, so every leaf detector judges
 * that point as its most recent one. Leaves are built fresh from the
 * registry on every call; groups combine their children depth-first:
 * </p>
 * <ul>
 * <li>AND — breaching when every child breaches; breach indices are the
 * intersection over the children that breached</li>
 * <li>OR — breaching when any child breaches; breach indices are the union
 * over breaching children</li>
 * </ul>
 *
 * <h3>Degenerate inputs</h3>
 * <p>
 * Empty configurations, empty series and out-of-range indices yield a
 * non-breaching result with an explanatory message. Only configuration
 * errors ({@link DetectorConfigException}) propagate.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Stateless apart from the registry, so one instance may serve concurrent
 * evaluations.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectorEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorEvaluator.class);

    /** Deepest group nesting accepted below the root. */
    public static final int MAX_GROUP_DEPTH = 10;

    static final String NO_DETECTORS = "No detectors configured";
    static final String EMPTY_GROUP = "Empty detector group";

    private final DetectorRegistry registry;

    public DetectorEvaluator() {
        this(DetectorRegistry.defaultRegistry());
    }

    public DetectorEvaluator(DetectorRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "DetectorRegistry must not be null");
    }

    /**
     * Evaluate the most recent point.
     *
     * @see #evaluateDetectors(AlertDetectorsConfig, double[], List, String, Integer)
     */
    public DetectorResult evaluateDetectors(AlertDetectorsConfig config, double[] data,
                                            List<String> timestamps, String seriesLabel) {
        return evaluateDetectors(config, data, timestamps, seriesLabel, null);
    }

    /**
     * Evaluate the detector tree at one point of the series.
     *
     * @param config      detector tree; must not be {@code null}
     * @param data        values in chronological order; must not be {@code null}
     * @param timestamps  ISO-8601 timestamps aligned with {@code data}, used in
     *                    messages only; may be {@code null}
     * @param seriesLabel human-readable series name for messages; may be {@code null}
     * @param checkIndex  index to check, negative counts from the end;
     *                    {@code null} means the last point
     * @return the combined verdict
     * @throws DetectorConfigException if any detector in the tree is misconfigured
     */
    public DetectorResult evaluateDetectors(AlertDetectorsConfig config, double[] data,
                                            List<String> timestamps, String seriesLabel,
                                            Integer checkIndex) {
        Objects.requireNonNull(config, "AlertDetectorsConfig must not be null");
        Objects.requireNonNull(data, "Series must not be null");

        if (config.getGroups().isEmpty()) {
            return DetectorResult.notBreaching(NO_DETECTORS);
        }
        if (data.length == 0) {
            return DetectorResult.notBreaching("No data points to evaluate");
        }

        int index = checkIndex == null ? data.length - 1
                : checkIndex < 0 ? data.length + checkIndex : checkIndex;
        if (index < 0 || index >= data.length) {
            LOG.trace("Check index {} outside series of length {}, skipping", checkIndex, data.length);
            return DetectorResult.notBreaching(String.format(
                    "Check index %d is out of range for a series of %d point(s)", checkIndex, data.length));
        }

        Evaluation evaluation = new Evaluation(Arrays.copyOf(data, index + 1), timestamps, seriesLabel, index);
        DetectorResult result = evaluation.evaluateGroup(config.asGroup(), 0);
        if (result.isBreaching()) {
            LOG.debug("Alert breached at index {}: {}", index, result.getMessage());
        }
        return result;
    }

    /**
     * Re-evaluate the whole tree at every index and collect the breaching
     * ones, for chart overlays.
     *
     * @param config     detector tree
     * @param data       values in chronological order
     * @param timestamps timestamps aligned with {@code data}; may be {@code null}
     * @return breaching indices in ascending order
     */
    public List<Integer> getAllBreachPoints(AlertDetectorsConfig config, double[] data, List<String> timestamps) {
        Objects.requireNonNull(config, "AlertDetectorsConfig must not be null");
        Objects.requireNonNull(data, "Series must not be null");

        List<Integer> breaches = new ArrayList<>();
        for (int i = 0; i < data.length; i++) {
            if (evaluateDetectors(config, data, timestamps, null, i).isBreaching()) {
                breaches.add(i);
            }
        }
        return breaches;
    }

    /**
     * State of one evaluation call.
     */
    private final class Evaluation {
        private final double[] series;
        private final List<String> timestamps;
        private final String label;
        private final int index;

        Evaluation(double[] series, List<String> timestamps, String label, int index) {
            this.series = series;
            this.timestamps = timestamps;
            this.label = label == null || label.isBlank() ? "series" : label;
            this.index = index;
        }

        DetectorResult evaluateNode(DetectorNode node, int depth) {
            if (node instanceof DetectorGroup group) {
                return evaluateGroup(group, depth + 1);
            }
            if (node instanceof DetectorConfig leaf) {
                return evaluateLeaf(leaf);
            }
            throw new DetectorConfigException("Unsupported detector node: " + node);
        }

        DetectorResult evaluateGroup(DetectorGroup group, int depth) {
            if (depth > MAX_GROUP_DEPTH) {
                throw new DetectorConfigException(
                        "Detector groups are nested deeper than " + MAX_GROUP_DEPTH + " levels");
            }
            if (group.getDetectors().isEmpty()) {
                return DetectorResult.notBreaching(EMPTY_GROUP);
            }

            List<DetectorResult> results = new ArrayList<>();
            List<String> messages = new ArrayList<>();
            for (DetectorNode child : group.getDetectors()) {
                DetectorResult result = evaluateNode(child, depth);
                results.add(result);
                if (result.getMessage() != null) {
                    boolean compound = child.isGroup() && group.getDetectors().size() > 1
                            && ((DetectorGroup) child).getDetectors().size() > 1;
                    messages.add(compound ? "(" + result.getMessage() + ")" : result.getMessage());
                }
            }
            return combine(group.getOperator(), results, messages);
        }

        DetectorResult evaluateLeaf(DetectorConfig leaf) {
            Detector detector = registry.getDetector(leaf);
            DetectionResult detection = detector.detect(series);
            double value = series[series.length - 1];
            String name = detector.getType();

            String message;
            if (detection.getReason() != null) {
                message = name + ": " + detection.getReason();
            } else {
                message = String.format(Locale.ROOT, "%s: %s value %s%s is %s%s",
                        name,
                        label,
                        format(value),
                        timestampSuffix(),
                        detection.isAnomaly() ? "anomalous" : "within the expected range",
                        detection.getScore() == null ? "" : " (score " + format(detection.getScore()) + ")");
            }
            return new DetectorResult(detection.isAnomaly(),
                    detection.isAnomaly() ? List.of(index) : List.of(), value, message);
        }

        private String timestampSuffix() {
            if (timestamps == null || index >= timestamps.size() || timestamps.get(index) == null) {
                return "";
            }
            return " at " + timestamps.get(index);
        }
    }

    static DetectorResult combine(GroupOperator operator, List<DetectorResult> results, List<String> messages) {
        boolean breaching;
        Set<Integer> indices = new TreeSet<>();
        if (operator == GroupOperator.AND) {
            breaching = results.stream().allMatch(DetectorResult::isBreaching);
            // indices are the intersection over the breaching children, even when the group does not breach
            List<DetectorResult> breachingChildren = results.stream()
                    .filter(DetectorResult::isBreaching)
                    .toList();
            if (!breachingChildren.isEmpty()) {
                indices.addAll(breachingChildren.get(0).getBreachIndices());
                for (DetectorResult result : breachingChildren) {
                    indices.retainAll(result.getBreachIndices());
                }
            }
        } else {
            breaching = results.stream().anyMatch(DetectorResult::isBreaching);
            for (DetectorResult result : results) {
                if (result.isBreaching()) {
                    indices.addAll(result.getBreachIndices());
                }
            }
        }

        Double value = results.stream()
                .filter(DetectorResult::isBreaching)
                .map(DetectorResult::getValue)
                .filter(Objects::nonNull)
                .findFirst()
                .orElse(results.stream()
                        .map(DetectorResult::getValue)
                        .filter(Objects::nonNull)
                        .findFirst()
                        .orElse(null));

        String message = messages.isEmpty() ? null : String.join(operator.joiner(), messages);
        return new DetectorResult(breaching, new ArrayList<>(indices), value, message);
    }

    private static String format(double v) {
        if (Double.isInfinite(v) || Double.isNaN(v)) {
            return Double.toString(v);
        }
        return String.format(Locale.ROOT, "%.2f", v);
    }
}
