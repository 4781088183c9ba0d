package com.alertsentinel.core.detection.outlier;

import com.alertsentinel.core.detection.AbstractDetector;
import com.alertsentinel.core.model.DetectionResult;
import com.alertsentinel.core.model.DetectorConfig;
import com.alertsentinel.core.model.DetectorConfigException;
import com.alertsentinel.core.preprocessing.Preprocessor;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Base class for unsupervised outlier models.
 *
 * <p>
 * The preprocessed series is expanded into a lag matrix (one row per point,
 * {@code preprocessing.lags + 1} columns), the model scores every row, and
 * rows scoring above the {@code 1 - contamination} quantile of all scores are
 * anomalous. Higher scores always mean "more unusual".
 * </p>
 *
 * @since 1.0.0
 */
public abstract class OutlierModelDetector extends AbstractDetector {

    private static final Logger LOG = LoggerFactory.getLogger(OutlierModelDetector.class);

    static final int MIN_SAMPLES = 10;
    static final double DEFAULT_CONTAMINATION = 0.1;

    protected final double contamination;

    protected OutlierModelDetector(DetectorConfig config) {
        super(config);
        this.contamination = config.getDouble("contamination", DEFAULT_CONTAMINATION);
        if (contamination <= 0 || contamination > 0.5) {
            throw new DetectorConfigException(
                    getType() + " contamination must be in (0, 0.5], got: " + contamination);
        }
    }

    /**
     * Fit the model on {@code samples} and score each of them.
     *
     * @param samples feature matrix, at least {@value #MIN_SAMPLES} rows
     * @return one score per row
     */
    protected abstract double[] scoreSamples(double[][] samples);

    @Override
    public DetectionResult detect(double[] series) {
        DetectionResult batch = detectBatch(series);
        if (batch.getReason() != null) {
            return DetectionResult.insufficientData(batch.getReason());
        }
        int last = series.length - 1;
        boolean anomaly = batch.getTriggeredIndices().contains(last);
        return DetectionResult.builder()
                .anomaly(anomaly)
                .score(batch.getAllScores().get(last))
                .triggeredIndices(anomaly ? List.of(last) : List.of())
                .metadata(batch.getMetadata())
                .build();
    }

    @Override
    public DetectionResult detectBatch(double[] series) {
        double[] data = prepare(series);
        int n = data.length;
        if (n < MIN_SAMPLES) {
            return DetectionResult.builder()
                    .allScores(nullScores(n))
                    .metadata(DetectionResult.REASON_KEY, String.format(
                            "Not enough data: %s needs at least %d points, got %d", getType(), MIN_SAMPLES, n))
                    .build();
        }

        double[][] samples = Preprocessor.lagMatrix(data, preprocessing.getLags());
        double[] scores = scoreSamples(samples);
        double threshold = new Percentile()
                .withEstimationType(Percentile.EstimationType.R_7)
                .evaluate(scores, 100.0 * (1.0 - contamination));

        List<Double> allScores = new ArrayList<>(n);
        List<Integer> triggered = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            allScores.add(scores[i]);
            if (scores[i] > threshold) {
                triggered.add(i);
            }
        }
        if (!triggered.isEmpty()) {
            LOG.debug("Detector [{}] flagged {} of {} point(s), threshold={}", getType(), triggered.size(), n, threshold);
        }

        return DetectionResult.builder()
                .anomaly(!triggered.isEmpty())
                .score(scores[n - 1])
                .triggeredIndices(triggered)
                .allScores(allScores)
                .metadata("threshold", threshold)
                .metadata("contamination", contamination)
                .build();
    }

    public double getContamination() {
        return contamination;
    }
}
