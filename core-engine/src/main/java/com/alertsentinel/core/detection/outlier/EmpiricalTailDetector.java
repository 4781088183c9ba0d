package com.alertsentinel.core.detection.outlier;

import com.alertsentinel.core.model.DetectorConfig;
import org.apache.commons.math3.stat.descriptive.moment.Skewness;

import java.util.Arrays;

/**
 * Base class for the empirical-distribution models (ECOD, COPOD).
 *
 * <p>
 * For every feature column the left and right tail probabilities of each
 * value are estimated from the column's empirical CDF and turned into
 * negative log-probabilities. The column's skewness picks the tail that
 * matters; subclasses decide how the tails are combined per column. The row
 * score is the sum over columns.
 * </p>
 */
abstract class EmpiricalTailDetector extends OutlierModelDetector {

    protected EmpiricalTailDetector(DetectorConfig config) {
        super(config);
    }

    /**
     * Combine the tail scores of one cell.
     *
     * @param left  {@code -log P(X <= x)}
     * @param right {@code -log P(X >= x)}
     * @param skew  tail chosen by the column's skewness sign
     * @return the cell's contribution to the row score
     */
    protected abstract double combine(double left, double right, double skew);

    @Override
    protected double[] scoreSamples(double[][] samples) {
        int n = samples.length;
        int dims = samples[0].length;
        double[] scores = new double[n];

        for (int d = 0; d < dims; d++) {
            double[] column = new double[n];
            for (int i = 0; i < n; i++) {
                column[i] = samples[i][d];
            }
            double[] sorted = column.clone();
            Arrays.sort(sorted);
            double skewSign = skewSign(column);

            for (int i = 0; i < n; i++) {
                double left = -Math.log(countAtMost(sorted, column[i]) / (double) n);
                double right = -Math.log(countAtLeast(sorted, column[i]) / (double) n);
                // sign(s - 1) and sign(s + 1) select the left tail, the right tail, or both
                double skew = left * -Math.signum(skewSign - 1) + right * Math.signum(skewSign + 1);
                scores[i] += combine(left, right, skew);
            }
        }
        return scores;
    }

    private static double skewSign(double[] column) {
        double skewness = new Skewness().evaluate(column);
        return Double.isNaN(skewness) ? 0.0 : Math.signum(skewness);
    }

    /** Number of values {@code <= x} in a sorted array. */
    static int countAtMost(double[] sorted, double x) {
        int lo = 0;
        int hi = sorted.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (sorted[mid] <= x) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    /** Number of values {@code >= x} in a sorted array. */
    static int countAtLeast(double[] sorted, double x) {
        int lo = 0;
        int hi = sorted.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (sorted[mid] < x) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return sorted.length - lo;
    }
}
