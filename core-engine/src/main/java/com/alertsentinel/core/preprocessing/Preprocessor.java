package com.alertsentinel.core.preprocessing;

import java.util.Objects;

/**
 * Series transformations applied before detection.
 *
 * <p>
 * Steps always run in the order smoothing → differencing → lag expansion and
 * never change the series length, so indices reported by detectors refer to
 * positions in the raw input.
 * </p>
 *
 * @since 1.0.0
 */
public final class Preprocessor {

    private Preprocessor() {
        // utility class — not instantiable
    }

    /**
     * Apply smoothing and differencing.
     *
     * @param series  raw values; must not be {@code null}
     * @param options preprocessing switches; must not be {@code null}
     * @return a new array of the same length
     */
    public static double[] preprocess(double[] series, PreprocessingOptions options) {
        Objects.requireNonNull(series, "Series must not be null");
        Objects.requireNonNull(options, "PreprocessingOptions must not be null");

        double[] out = series.clone();
        if (options.getSmoothing() > 0) {
            out = smooth(out, options.getSmoothing());
        }
        if (options.isDiffs()) {
            out = diff(out);
        }
        return out;
    }

    /**
     * Preprocess and expand into a lag matrix using {@link PreprocessingOptions#getLags()}.
     *
     * @param series  raw values
     * @param options preprocessing switches
     * @return {@code series.length} rows of {@code lags + 1} columns
     */
    public static double[][] preprocessToMatrix(double[] series, PreprocessingOptions options) {
        return lagMatrix(preprocess(series, options), options.getLags());
    }

    /**
     * Centered moving average. The series is edge-padded by {@code window / 2}
     * on the left and {@code window - 1 - window / 2} on the right so that the
     * output keeps the input length.
     *
     * @param series values to smooth
     * @param window averaging window, {@code > 0}
     * @return smoothed copy
     */
    public static double[] smooth(double[] series, int window) {
        int n = series.length;
        if (window <= 1 || n == 0) {
            return series.clone();
        }
        int left = window / 2;
        int right = window - 1 - left;
        double[] padded = new double[n + left + right];
        for (int i = 0; i < padded.length; i++) {
            int src = Math.min(n - 1, Math.max(0, i - left));
            padded[i] = series[src];
        }

        double[] out = new double[n];
        double sum = 0;
        for (int i = 0; i < window; i++) {
            sum += padded[i];
        }
        out[0] = sum / window;
        for (int i = 1; i < n; i++) {
            sum += padded[i + window - 1] - padded[i - 1];
            out[i] = sum / window;
        }
        return out;
    }

    /**
     * First differences with the first element differenced against itself.
     *
     * @param series values to difference
     * @return differenced copy; {@code out[0] == 0}
     */
    public static double[] diff(double[] series) {
        double[] out = new double[series.length];
        for (int i = 1; i < series.length; i++) {
            out[i] = series[i] - series[i - 1];
        }
        return out;
    }

    /**
     * Lag expansion. Column 0 is the value itself, column {@code k} the value
     * {@code k} steps earlier; the first {@code k} rows of column {@code k}
     * are back-filled with the first value.
     *
     * @param series values to expand
     * @param lags   number of lag columns, clamped to [0, 10]
     * @return feature matrix of {@code series.length} rows
     */
    public static double[][] lagMatrix(double[] series, int lags) {
        int cols = Math.max(0, Math.min(PreprocessingOptions.MAX_LAGS, lags)) + 1;
        double[][] matrix = new double[series.length][cols];
        for (int i = 0; i < series.length; i++) {
            for (int k = 0; k < cols; k++) {
                matrix[i][k] = i >= k ? series[i - k] : series[0];
            }
        }
        return matrix;
    }
}
