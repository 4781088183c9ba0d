package com.alertsentinel.core.detection;

import com.alertsentinel.core.model.DetectionResult;
import com.alertsentinel.core.model.DetectorConfig;
import com.alertsentinel.core.model.DetectorConfigException;
import com.alertsentinel.core.model.GroupOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Flat AND/OR combination of two to five detectors.
 *
 * <p>
 * Configuration:
 * </p>
 *
 * <pre>
 * type: ensemble
 * mode: AND            # or OR
 * detectors:
 *   - type: zscore
 *     threshold: 3
 *   - type: iqr
 *     multiplier: 1.5
 * </pre>
 *
 * <p>
 * The combined score is the mean of the children's defined scores. In batch
 * mode AND intersects the children's triggered indices and OR unites them;
 * per-point scores average the children that scored that point.
 * </p>
 *
 * <h3>State</h3>
 * <p>
 * Children are built on first use and reused for the lifetime of this
 * instance. The cache is not synchronised: share an ensemble between threads
 * only after it has been used once.
 * </p>
 *
 * @since 1.0.0
 */
public class EnsembleDetector extends AbstractDetector {

    public static final String TYPE = "ensemble";

    static final int MIN_DETECTORS = 2;
    static final int MAX_DETECTORS = 5;

    private static final Logger LOG = LoggerFactory.getLogger(EnsembleDetector.class);

    private final GroupOperator mode;
    private final List<DetectorConfig> childConfigs;
    private final DetectorRegistry registry;

    private List<Detector> children;

    /**
     * @param config   ensemble configuration
     * @param registry registry used to build the children
     * @throws DetectorConfigException if the child count is outside 2..5, a
     *                                 child is itself an ensemble, or a child
     *                                 type is unknown or misconfigured
     */
    public EnsembleDetector(DetectorConfig config, DetectorRegistry registry) {
        super(config);
        this.registry = Objects.requireNonNull(registry, "DetectorRegistry must not be null");
        this.mode = GroupOperator.parse(config.getString("mode").orElse("AND"));
        this.childConfigs = config.getConfigList("detectors");

        if (childConfigs.size() < MIN_DETECTORS) {
            throw new DetectorConfigException("Ensemble: at least " + MIN_DETECTORS
                    + " detectors required, got " + childConfigs.size());
        }
        if (childConfigs.size() > MAX_DETECTORS) {
            throw new DetectorConfigException("Ensemble: at most " + MAX_DETECTORS
                    + " detectors allowed, got " + childConfigs.size());
        }
        for (DetectorConfig child : childConfigs) {
            if (TYPE.equals(child.getType())) {
                throw new DetectorConfigException("Ensemble: nested ensembles are not supported");
            }
            // built once to surface parameter errors now; the instances used for detection are built lazily
            registry.getDetector(child);
        }
    }

    @Override
    public DetectionResult detect(double[] series) {
        Objects.requireNonNull(series, "Series must not be null");
        List<DetectionResult> results = new ArrayList<>();
        for (Detector child : children()) {
            results.add(child.detect(series));
        }

        boolean anomaly = mode == GroupOperator.AND
                ? results.stream().allMatch(DetectionResult::isAnomaly)
                : results.stream().anyMatch(DetectionResult::isAnomaly);
        if (anomaly) {
            LOG.debug("Detector [{}] fired: mode={} children={}", TYPE, mode, results.size());
        }

        return DetectionResult.builder()
                .anomaly(anomaly)
                .score(meanScore(results))
                .triggeredIndices(anomaly ? List.of(series.length - 1) : List.of())
                .metadata(summary(results))
                .build();
    }

    @Override
    public DetectionResult detectBatch(double[] series) {
        Objects.requireNonNull(series, "Series must not be null");
        List<DetectionResult> results = new ArrayList<>();
        for (Detector child : children()) {
            results.add(child.detectBatch(series));
        }

        Set<Integer> combined = null;
        for (DetectionResult result : results) {
            if (combined == null) {
                combined = new TreeSet<>(result.getTriggeredIndices());
            } else if (mode == GroupOperator.AND) {
                combined.retainAll(result.getTriggeredIndices());
            } else {
                combined.addAll(result.getTriggeredIndices());
            }
        }
        List<Integer> triggered = new ArrayList<>(combined);

        List<Double> allScores = new ArrayList<>(series.length);
        for (int i = 0; i < series.length; i++) {
            double sum = 0;
            int count = 0;
            for (DetectionResult result : results) {
                List<Double> scores = result.getAllScores();
                Double score = i < scores.size() ? scores.get(i) : null;
                if (score != null) {
                    sum += score;
                    count++;
                }
            }
            allScores.add(count == 0 ? null : sum / count);
        }

        return DetectionResult.builder()
                .anomaly(!triggered.isEmpty())
                .score(meanScore(results))
                .triggeredIndices(triggered)
                .allScores(allScores)
                .metadata(summary(results))
                .build();
    }

    private List<Detector> children() {
        if (children == null) {
            List<Detector> built = new ArrayList<>(childConfigs.size());
            for (DetectorConfig childConfig : childConfigs) {
                built.add(registry.getDetector(childConfig));
            }
            children = List.copyOf(built);
        }
        return children;
    }

    private static Double meanScore(List<DetectionResult> results) {
        double sum = 0;
        int count = 0;
        for (DetectionResult result : results) {
            if (result.getScore() != null) {
                sum += result.getScore();
                count++;
            }
        }
        return count == 0 ? null : sum / count;
    }

    private Map<String, Object> summary(List<DetectionResult> results) {
        List<Map<String, Object>> perDetector = new ArrayList<>();
        for (int i = 0; i < results.size(); i++) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("type", childConfigs.get(i).getType());
            entry.put("is_anomaly", results.get(i).isAnomaly());
            entry.put("score", results.get(i).getScore());
            perDetector.add(entry);
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("mode", mode.name());
        metadata.put("detector_results", perDetector);
        return metadata;
    }

    public GroupOperator getMode() {
        return mode;
    }

    /**
     * @return the child types, in configuration order
     */
    public List<String> getDetectorTypes() {
        List<String> types = new ArrayList<>();
        for (DetectorConfig child : childConfigs) {
            types.add(child.getType());
        }
        return types;
    }

    @Override
    public String getType() {
        return TYPE;
    }
}
