package com.alertsentinel.core.detection.outlier;

import com.alertsentinel.core.model.DetectorConfig;
import com.alertsentinel.core.model.DetectorConfigException;
import smile.anomaly.IsolationForest;
import smile.anomaly.IsolationTree;
import smile.math.MathEx;

import java.util.ArrayList;
import java.util.List;

/**
 * Isolation forest backed by Smile.
 *
 * <p>
 * Parameters: {@code n_estimators} (trees, default 100), {@code sampling_rate}
 * (fraction of points per tree, default 0.7) and {@code random_state}
 * (seed, default 42) so repeated evaluations agree.
 * </p>
 *
 * @since 1.0.0
 */
public class IsolationForestDetector extends OutlierModelDetector {

    public static final String TYPE = "isolation_forest";

    private final int estimators;
    private final double samplingRate;
    private final long randomState;

    public IsolationForestDetector(DetectorConfig config) {
        super(config);
        this.estimators = config.getInt("n_estimators", 100);
        this.samplingRate = config.getDouble("sampling_rate", 0.7);
        this.randomState = config.getInt("random_state", 42);
        if (estimators < 1) {
            throw new DetectorConfigException("isolation_forest n_estimators must be >= 1, got: " + estimators);
        }
        if (samplingRate <= 0 || samplingRate > 1) {
            throw new DetectorConfigException(
                    "isolation_forest sampling_rate must be in (0, 1], got: " + samplingRate);
        }
    }

    @Override
    protected double[] scoreSamples(double[][] samples) {
        int n = samples.length;
        int subsample = Math.max(2, (int) Math.round(n * samplingRate));
        int maxDepth = (int) Math.ceil(Math.log(subsample) / Math.log(2));

        // the seed is per thread, so every tree must be grown on this one
        MathEx.setSeed(randomState);
        IsolationTree[] trees = new IsolationTree[estimators];
        for (int t = 0; t < estimators; t++) {
            int[] order = MathEx.permutate(n);
            List<double[]> rows = new ArrayList<>(subsample);
            for (int i = 0; i < Math.min(subsample, n); i++) {
                rows.add(samples[order[i]]);
            }
            // extension level 0 is the classic axis-parallel isolation forest
            trees[t] = new IsolationTree(rows, maxDepth, 0);
        }
        IsolationForest forest = new IsolationForest(subsample, 0, trees);

        double[] scores = new double[n];
        for (int i = 0; i < n; i++) {
            scores[i] = forest.score(samples[i]);
        }
        return scores;
    }

    @Override
    public String getType() {
        return TYPE;
    }
}
