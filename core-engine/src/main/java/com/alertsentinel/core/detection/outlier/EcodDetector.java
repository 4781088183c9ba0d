package com.alertsentinel.core.detection.outlier;

import com.alertsentinel.core.model.DetectorConfig;

/**
 * Empirical-CDF outlier detection (ECOD): each cell contributes the largest
 * of its left-tail, right-tail and skewness-selected scores.
 *
 * @since 1.0.0
 */
public class EcodDetector extends EmpiricalTailDetector {

    public static final String TYPE = "ecod";

    public EcodDetector(DetectorConfig config) {
        super(config);
    }

    @Override
    protected double combine(double left, double right, double skew) {
        return Math.max(skew, Math.max(left, right));
    }

    @Override
    public String getType() {
        return TYPE;
    }
}
