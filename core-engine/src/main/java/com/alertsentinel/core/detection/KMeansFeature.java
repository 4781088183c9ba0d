package com.alertsentinel.core.detection;

import com.alertsentinel.core.model.DetectorConfigException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Derived features appended to a point's K-Means feature vector.
 *
 * @since 1.0.0
 */
public enum KMeansFeature {

    DIFF_1("diff_1", 1),
    LAG_1("lag_1", 1),
    LAG_2("lag_2", 2),
    LAG_3("lag_3", 3),
    LAG_4("lag_4", 4),
    LAG_5("lag_5", 5),
    SMOOTHED_3("smoothed_3", 2),
    SMOOTHED_5("smoothed_5", 4),
    SMOOTHED_7("smoothed_7", 6);

    private final String key;
    private final int lookback;

    KMeansFeature(String key, int lookback) {
        this.key = key;
        this.lookback = lookback;
    }

    public String key() {
        return key;
    }

    /**
     * @return number of earlier points the feature reads
     */
    public int lookback() {
        return lookback;
    }

    /**
     * Compute the feature for index {@code i}. Requires {@code i >= lookback()}.
     *
     * @param data series
     * @param i    index of the point
     * @return feature value
     */
    double valueAt(double[] data, int i) {
        return switch (this) {
            case DIFF_1 -> data[i] - data[i - 1];
            case LAG_1, LAG_2, LAG_3, LAG_4, LAG_5 -> data[i - lookback];
            case SMOOTHED_3, SMOOTHED_5, SMOOTHED_7 -> trailingMean(data, i, lookback + 1);
        };
    }

    private static double trailingMean(double[] data, int i, int width) {
        double sum = 0;
        for (int j = i - width + 1; j <= i; j++) {
            sum += data[j];
        }
        return sum / width;
    }

    /**
     * @param key configuration key, e.g. {@code "lag_2"}
     * @return the feature
     * @throws DetectorConfigException if {@code key} is unknown
     */
    public static KMeansFeature fromKey(String key) {
        String normalised = key == null ? "" : key.trim().toLowerCase(Locale.ROOT);
        for (KMeansFeature feature : values()) {
            if (feature.key.equals(normalised)) {
                return feature;
            }
        }
        throw new DetectorConfigException("Unknown kmeans feature: '" + key + "'. Supported: "
                + Arrays.stream(values()).map(KMeansFeature::key).collect(Collectors.joining(", ")));
    }
}
