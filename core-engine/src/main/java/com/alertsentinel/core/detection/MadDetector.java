package com.alertsentinel.core.detection;

import com.alertsentinel.core.model.DetectorConfig;
import com.alertsentinel.core.model.DetectorConfigException;

/**
 * Median-absolute-deviation detector.
 *
 * <p>
 * A robust alternative to the z-score: the baseline is the rolling median and
 * the spread is the MAD scaled by {@value #MAD_SCALE}, which estimates the
 * standard deviation for normally distributed data. A zero spread is never
 * anomalous.
 * </p>
 *
 * @since 1.0.0
 */
public class MadDetector extends RollingWindowDetector {

    public static final String TYPE = "mad";

    /** Consistency constant relating MAD to σ under normality. */
    static final double MAD_SCALE = 1.4826;
    static final double DEFAULT_THRESHOLD = 3.0;

    private final double threshold;

    public MadDetector(DetectorConfig config) {
        super(config);
        this.threshold = config.getDouble("threshold", DEFAULT_THRESHOLD);
        if (threshold <= 0) {
            throw new DetectorConfigException("mad threshold must be > 0, got: " + threshold);
        }
    }

    @Override
    protected WindowScore score(double[] baseline, double value) {
        double median = Stats.median(baseline);
        double[] deviations = new double[baseline.length];
        for (int i = 0; i < baseline.length; i++) {
            deviations[i] = Math.abs(baseline[i] - median);
        }
        double mad = Stats.median(deviations);
        double scaledMad = mad * MAD_SCALE;

        double score = scaledMad == 0 ? 0.0 : Math.abs(value - median) / scaledMad;

        return new WindowScore(score, scaledMad != 0 && score > threshold)
                .with("median", median)
                .with("mad", mad)
                .with("scaled_mad", scaledMad)
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
