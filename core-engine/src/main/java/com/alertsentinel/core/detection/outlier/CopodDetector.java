package com.alertsentinel.core.detection.outlier;

import com.alertsentinel.core.model.DetectorConfig;

/**
 * Copula-based outlier detection (COPOD): each cell contributes the larger
 * of its skewness-selected score and the mean of both tail scores.
 *
 * @since 1.0.0
 */
public class CopodDetector extends EmpiricalTailDetector {

    public static final String TYPE = "copod";

    public CopodDetector(DetectorConfig config) {
        super(config);
    }

    @Override
    protected double combine(double left, double right, double skew) {
        return Math.max(skew, (left + right) / 2);
    }

    @Override
    public String getType() {
        return TYPE;
    }
}
