package com.alertsentinel.core.detection;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;

/**
 * Window statistics shared by the statistical detectors.
 */
final class Stats {

    private Stats() {
        // utility class — not instantiable
    }

    static double mean(double[] values) {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /** Population standard deviation. */
    static double stdDev(double[] values, double mean) {
        double sumSquaredDiff = 0;
        for (double v : values) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / values.length);
    }

    /**
     * Percentile with linear interpolation between closest ranks.
     *
     * @param values sample, not modified
     * @param p      percentile in (0, 100]
     */
    static double percentile(double[] values, double p) {
        if (values.length == 1) {
            return values[0];
        }
        // Percentile caches sorted work arrays, so a fresh instance per call
        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        return percentile.evaluate(values, p);
    }

    static double median(double[] values) {
        return percentile(values, 50.0);
    }
}
