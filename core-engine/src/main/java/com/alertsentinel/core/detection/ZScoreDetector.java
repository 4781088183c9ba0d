package com.alertsentinel.core.detection;

import com.alertsentinel.core.model.DetectorConfig;
import com.alertsentinel.core.model.DetectorConfigException;

/**
 * Z-score detector.
 *
 * <p>
 * Scores a point by its distance from the rolling mean in units of the rolling
 * (population) standard deviation; the point is anomalous when the score
 * exceeds {@code threshold} (default 3.0).
 * </p>
 *
 * <h3>Constant baseline</h3>
 * <p>
 * When the baseline has zero spread, any value different from it scores
 * {@link Double#POSITIVE_INFINITY} and is anomalous; an equal value scores 0.
 * </p>
 *
 * @since 1.0.0
 */
public class ZScoreDetector extends RollingWindowDetector {

    public static final String TYPE = "zscore";

    static final double DEFAULT_THRESHOLD = 3.0;

    private final double threshold;

    public ZScoreDetector(DetectorConfig config) {
        super(config);
        this.threshold = config.getDouble("threshold", DEFAULT_THRESHOLD);
        if (threshold <= 0) {
            throw new DetectorConfigException("zscore threshold must be > 0, got: " + threshold);
        }
    }

    @Override
    protected WindowScore score(double[] baseline, double value) {
        double mean = Stats.mean(baseline);
        double std = Stats.stdDev(baseline, mean);

        double score;
        if (std == 0) {
            score = value != mean ? Double.POSITIVE_INFINITY : 0.0;
        } else {
            score = Math.abs(value - mean) / std;
        }

        return new WindowScore(score, score > threshold)
                .with("mean", mean)
                .with("std", std)
                .with("threshold", threshold);
    }

    public double getThreshold() {
        return threshold;
    }

    @Override
    public String getType() {
        return TYPE;
    }
}
