package com.alertsentinel.core.preprocessing;

import com.alertsentinel.core.model.DetectorConfig;
import com.alertsentinel.core.model.DetectorConfigException;

import java.util.Map;
import java.util.Objects;

/**
 * Preprocessing switches read from a detector's optional
 * {@code preprocessing} block:
 *
 * <pre>
 * preprocessing:
 *   smoothing: 3   # centered moving-average window, 0 = off
 *   diffs: true    # first differences, applied after smoothing
 *   lags: 2        # lag columns for multivariate detectors, clamped to [0, 10]
 * </pre>
 *
 * @since 1.0.0
 */
public final class PreprocessingOptions {

    public static final String CONFIG_KEY = "preprocessing";
    public static final int MAX_LAGS = 10;

    public static final PreprocessingOptions NONE = new PreprocessingOptions(0, false, 0);

    private final int smoothing;
    private final boolean diffs;
    private final int lags;

    public PreprocessingOptions(int smoothing, boolean diffs, int lags) {
        this.smoothing = Math.max(0, smoothing);
        this.diffs = diffs;
        this.lags = Math.max(0, Math.min(MAX_LAGS, lags));
    }

    /**
     * @param config detector configuration; must not be {@code null}
     * @return options from the {@code preprocessing} block, or {@link #NONE}
     * @throws DetectorConfigException if the block holds malformed values
     */
    public static PreprocessingOptions from(DetectorConfig config) {
        Objects.requireNonNull(config, "DetectorConfig must not be null");
        Map<String, Object> block = config.getMap(CONFIG_KEY);
        if (block.isEmpty()) {
            return NONE;
        }
        // reuse the typed accessors of DetectorConfig for the nested block
        DetectorConfig nested = DetectorConfig.of(block);
        return new PreprocessingOptions(
                nested.getInt("smoothing", 0),
                nested.getBoolean("diffs", false),
                nested.getInt("lags", 0));
    }

    public int getSmoothing() {
        return smoothing;
    }

    public boolean isDiffs() {
        return diffs;
    }

    public int getLags() {
        return lags;
    }

    @Override
    public String toString() {
        return "PreprocessingOptions{smoothing=" + smoothing + ", diffs=" + diffs + ", lags=" + lags + '}';
    }
}
