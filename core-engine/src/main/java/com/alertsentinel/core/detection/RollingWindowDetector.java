package com.alertsentinel.core.detection;

import com.alertsentinel.core.model.DetectionResult;
import com.alertsentinel.core.model.DetectorConfig;
import com.alertsentinel.core.model.DetectorConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base class for detectors that compare a point against a baseline computed
 * over the trailing {@code window} points.
 *
 * <h3>Baseline</h3>
 * <p>
 * The baseline for index {@code i} is {@code series[i - window .. i - 1]}:
 * the point under test never influences its own baseline. Consequently a
 * series needs at least {@code window + 1} points, and in batch mode the first
 * {@code window} score slots are {@code null}.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class RollingWindowDetector extends AbstractDetector {

    private static final Logger LOG = LoggerFactory.getLogger(RollingWindowDetector.class);

    static final int DEFAULT_WINDOW = 30;

    protected final int window;

    protected RollingWindowDetector(DetectorConfig config) {
        super(config);
        this.window = config.getInt("window", DEFAULT_WINDOW);
        if (window < 1) {
            throw new DetectorConfigException(
                    "window must be >= 1 for detector '" + getType() + "', got: " + window);
        }
    }

    /**
     * Score one point against its baseline.
     *
     * @param baseline the trailing window, excluding {@code value}
     * @param value    the point under test
     * @return score, verdict and diagnostics
     */
    protected abstract WindowScore score(double[] baseline, double value);

    @Override
    public DetectionResult detect(double[] series) {
        double[] data = prepare(series);
        int n = data.length;
        if (n < window + 1) {
            LOG.trace("Detector [{}]: {} point(s) available, {} required, skipping", getType(), n, window + 1);
            return DetectionResult.insufficientData(shortfall(n));
        }

        int last = n - 1;
        WindowScore result = score(Arrays.copyOfRange(data, last - window, last), data[last]);
        if (result.anomaly) {
            LOG.debug("Detector [{}] fired: value={} score={} {}", getType(), data[last], result.score, result.metadata);
        }
        return DetectionResult.builder()
                .anomaly(result.anomaly)
                .score(result.score)
                .triggeredIndices(result.anomaly ? List.of(last) : List.of())
                .metadata(result.metadata)
                .metadata("value", data[last])
                .build();
    }

    @Override
    public DetectionResult detectBatch(double[] series) {
        double[] data = prepare(series);
        int n = data.length;
        if (n < window + 1) {
            return DetectionResult.builder()
                    .allScores(nullScores(n))
                    .metadata(DetectionResult.REASON_KEY, shortfall(n))
                    .build();
        }

        List<Double> allScores = nullScores(window);
        List<Integer> triggered = new ArrayList<>();
        WindowScore latest = null;
        for (int i = window; i < n; i++) {
            latest = score(Arrays.copyOfRange(data, i - window, i), data[i]);
            allScores.add(latest.score);
            if (latest.anomaly) {
                triggered.add(i);
            }
        }
        if (!triggered.isEmpty()) {
            LOG.debug("Detector [{}] flagged {} of {} point(s)", getType(), triggered.size(), n - window);
        }

        return DetectionResult.builder()
                .anomaly(!triggered.isEmpty())
                .score(latest.score)
                .triggeredIndices(triggered)
                .allScores(allScores)
                .metadata(latest.metadata)
                .build();
    }

    public int getWindow() {
        return window;
    }

    private String shortfall(int available) {
        return String.format("Not enough data: %s needs at least %d points, got %d",
                getType(), window + 1, available);
    }

    /**
     * Outcome of scoring one point.
     */
    protected static final class WindowScore {
        final double score;
        final boolean anomaly;
        final Map<String, Object> metadata = new LinkedHashMap<>();

        protected WindowScore(double score, boolean anomaly) {
            this.score = score;
            this.anomaly = anomaly;
        }

        protected WindowScore with(String key, Object value) {
            metadata.put(key, value);
            return this;
        }
    }
}
