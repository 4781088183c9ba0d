package com.alertsentinel.core.detection;

import com.alertsentinel.core.model.DetectorConfig;
import com.alertsentinel.core.preprocessing.PreprocessingOptions;
import com.alertsentinel.core.preprocessing.Preprocessor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Base class holding a detector's configuration and preprocessing options.
 *
 * @since 1.0.0
 */
public abstract class AbstractDetector implements Detector {

    protected final DetectorConfig config;
    protected final PreprocessingOptions preprocessing;

    protected AbstractDetector(DetectorConfig config) {
        this.config = Objects.requireNonNull(config, "DetectorConfig must not be null");
        this.preprocessing = PreprocessingOptions.from(config);
    }

    public DetectorConfig getConfig() {
        return config;
    }

    /**
     * Copy the series and apply smoothing and differencing.
     *
     * @param series raw values
     * @return preprocessed values of the same length
     */
    protected double[] prepare(double[] series) {
        Objects.requireNonNull(series, "Series must not be null");
        return Preprocessor.preprocess(series, preprocessing);
    }

    /**
     * @param size number of slots
     * @return mutable list of {@code size} null scores
     */
    protected static List<Double> nullScores(int size) {
        return new ArrayList<>(Collections.nCopies(size, (Double) null));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + config.getParameters() + '}';
    }
}
