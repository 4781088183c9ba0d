package com.alertsentinel.core.detection;

import com.alertsentinel.core.model.DetectorConfig;
import com.alertsentinel.core.model.DetectorConfigException;

/**
 * Interquartile-range (Tukey fences) detector.
 *
 * <p>
 * A point is anomalous when it falls outside
 * {@code [Q1 - multiplier * IQR, Q3 + multiplier * IQR]} of the rolling
 * window. The score is the distance beyond the nearer fence in units of IQR,
 * 0 inside the fences. A zero IQR is never anomalous and scores 0.
 * </p>
 *
 * @since 1.0.0
 */
public class IqrDetector extends RollingWindowDetector {

    public static final String TYPE = "iqr";

    static final double DEFAULT_MULTIPLIER = 1.5;

    private final double multiplier;

    public IqrDetector(DetectorConfig config) {
        super(config);
        this.multiplier = config.getDouble("multiplier", DEFAULT_MULTIPLIER);
        if (multiplier < 0) {
            throw new DetectorConfigException("iqr multiplier must be >= 0, got: " + multiplier);
        }
    }

    @Override
    protected WindowScore score(double[] baseline, double value) {
        double q1 = Stats.percentile(baseline, 25.0);
        double q3 = Stats.percentile(baseline, 75.0);
        double iqr = q3 - q1;
        double lowerFence = q1 - multiplier * iqr;
        double upperFence = q3 + multiplier * iqr;

        double score = 0.0;
        boolean anomaly = false;
        if (iqr > 0) {
            if (value < lowerFence) {
                score = (lowerFence - value) / iqr;
                anomaly = true;
            } else if (value > upperFence) {
                score = (value - upperFence) / iqr;
                anomaly = true;
            }
        }

        return new WindowScore(score, anomaly)
                .with("q1", q1)
                .with("q3", q3)
                .with("iqr", iqr)
                .with("lower_fence", lowerFence)
                .with("upper_fence", upperFence)
                .with("multiplier", multiplier);
    }

    public double getMultiplier() {
        return multiplier;
    }

    @Override
    public String getType() {
        return TYPE;
    }
}
