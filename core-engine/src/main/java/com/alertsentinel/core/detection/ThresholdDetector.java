package com.alertsentinel.core.detection;

import com.alertsentinel.core.model.DetectionResult;
import com.alertsentinel.core.model.DetectorConfig;
import com.alertsentinel.core.model.DetectorConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Threshold detector.
 *
 * <p>
 * Flags a value below {@code lower_bound} or above {@code upper_bound}. Both
 * bounds are optional; with neither set the detector never fires. The score
 * is the value itself. No history is needed.
 * </p>
 *
 * @since 1.0.0
 */
public class ThresholdDetector extends AbstractDetector {

    public static final String TYPE = "threshold";

    private static final Logger LOG = LoggerFactory.getLogger(ThresholdDetector.class);

    private final Double lowerBound;
    private final Double upperBound;

    /**
     * @param config the detector configuration
     * @throws DetectorConfigException if {@code lower_bound > upper_bound}
     */
    public ThresholdDetector(DetectorConfig config) {
        super(config);
        this.lowerBound = config.getDouble("lower_bound").orElse(null);
        this.upperBound = config.getDouble("upper_bound").orElse(null);

        if (lowerBound != null && upperBound != null && lowerBound > upperBound) {
            throw new DetectorConfigException(
                    "lower_bound must not exceed upper_bound, got: " + lowerBound + " > " + upperBound);
        }
    }

    @Override
    public DetectionResult detect(double[] series) {
        double[] data = prepare(series);
        if (data.length == 0) {
            return DetectionResult.insufficientData("Not enough data: threshold needs at least 1 point, got 0");
        }

        int last = data.length - 1;
        double v = data[last];
        boolean breach = breaches(v);
        if (breach) {
            LOG.debug("Detector [{}] fired: value={} bounds=[{}, {}]", TYPE, v, lowerBound, upperBound);
        }

        return DetectionResult.builder()
                .anomaly(breach)
                .score(v)
                .triggeredIndices(breach ? List.of(last) : List.of())
                .metadata("lower_bound", lowerBound)
                .metadata("upper_bound", upperBound)
                .metadata("value", v)
                .build();
    }

    @Override
    public DetectionResult detectBatch(double[] series) {
        double[] data = prepare(series);
        List<Double> allScores = new ArrayList<>(data.length);
        List<Integer> triggered = new ArrayList<>();
        for (int i = 0; i < data.length; i++) {
            allScores.add(data[i]);
            if (breaches(data[i])) {
                triggered.add(i);
            }
        }

        return DetectionResult.builder()
                .anomaly(!triggered.isEmpty())
                .score(data.length == 0 ? null : data[data.length - 1])
                .triggeredIndices(triggered)
                .allScores(allScores)
                .metadata("lower_bound", lowerBound)
                .metadata("upper_bound", upperBound)
                .build();
    }

    private boolean breaches(double v) {
        return (lowerBound != null && v < lowerBound) || (upperBound != null && v > upperBound);
    }

    public Double getLowerBound() {
        return lowerBound;
    }

    public Double getUpperBound() {
        return upperBound;
    }

    @Override
    public String getType() {
        return TYPE;
    }
}
