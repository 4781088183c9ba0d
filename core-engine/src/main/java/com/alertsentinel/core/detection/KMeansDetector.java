package com.alertsentinel.core.detection;

import com.alertsentinel.core.model.DetectionResult;
import com.alertsentinel.core.model.DetectorConfig;
import com.alertsentinel.core.model.DetectorConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * K-Means clustering detector.
 *
 * <p>
 * Each point with enough history is turned into a feature vector (the value
 * followed by the configured {@link KMeansFeature}s), the vectors are
 * clustered, and one cluster is designated anomalous:
 * </p>
 * <ul>
 * <li>{@code smallest} — the cluster with the fewest members</li>
 * <li>{@code furthest} — the cluster whose centroid is furthest from the mean
 * of all centroids</li>
 * </ul>
 * <p>
 * A point is anomalous when it belongs to that cluster. Its score is the
 * distance to its own centroid. With a single cluster no cluster stands out,
 * so nothing is flagged.
 * </p>
 *
 * @since 1.0.0
 */
public class KMeansDetector extends AbstractDetector {

    public static final String TYPE = "kmeans";

    private static final Logger LOG = LoggerFactory.getLogger(KMeansDetector.class);

    /** Floor applied before lookback and cluster-count checks. */
    static final int MIN_POINTS = 10;
    static final int MAX_ITERATIONS = 100;
    static final int DEFAULT_CLUSTERS = 3;

    /**
     * How the anomalous cluster is chosen.
     */
    public enum AnomalyMethod {
        SMALLEST,
        FURTHEST;

        static AnomalyMethod parse(String value) {
            return switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "smallest" -> SMALLEST;
                case "furthest" -> FURTHEST;
                default -> throw new DetectorConfigException(
                        "Unknown kmeans anomaly_method: '" + value + "'. Supported: smallest, furthest");
            };
        }
    }

    private final int clusters;
    private final List<KMeansFeature> features;
    private final AnomalyMethod anomalyMethod;
    private final int lookback;

    public KMeansDetector(DetectorConfig config) {
        super(config);
        this.clusters = config.getInt("n_clusters", DEFAULT_CLUSTERS);
        if (clusters < 1) {
            throw new DetectorConfigException("kmeans n_clusters must be >= 1, got: " + clusters);
        }
        this.features = config.getStringList("features").stream()
                .map(KMeansFeature::fromKey)
                .toList();
        this.anomalyMethod = AnomalyMethod.parse(config.getString("anomaly_method").orElse("smallest"));
        this.lookback = features.stream().mapToInt(KMeansFeature::lookback).max().orElse(0);
    }

    @Override
    public DetectionResult detect(double[] series) {
        double[] data = prepare(series);
        Fit fit = fit(data);
        if (fit.reason != null) {
            return DetectionResult.insufficientData(fit.reason);
        }

        int last = data.length - 1;
        int row = last - lookback;
        int label = fit.clustering.labels()[row];
        boolean anomaly = label == fit.anomalyCluster;
        double score = KMeansClustering.distance(fit.vectors[row], fit.clustering.centroids()[label]);
        if (anomaly) {
            LOG.debug("Detector [{}] fired: value={} cluster={} sizes={}",
                    TYPE, data[last], label, Arrays.toString(fit.clustering.sizes()));
        }

        return DetectionResult.builder()
                .anomaly(anomaly)
                .score(score)
                .triggeredIndices(anomaly ? List.of(last) : List.of())
                .metadata("cluster", label)
                .metadata("anomaly_cluster", fit.anomalyCluster)
                .metadata("cluster_sizes", sizes(fit.clustering))
                .metadata("iterations", fit.clustering.iterations())
                .build();
    }

    @Override
    public DetectionResult detectBatch(double[] series) {
        double[] data = prepare(series);
        Fit fit = fit(data);
        if (fit.reason != null) {
            return DetectionResult.builder()
                    .allScores(nullScores(data.length))
                    .metadata(DetectionResult.REASON_KEY, fit.reason)
                    .build();
        }

        List<Double> allScores = nullScores(lookback);
        List<Integer> triggered = new ArrayList<>();
        int[] labels = fit.clustering.labels();
        for (int row = 0; row < fit.vectors.length; row++) {
            allScores.add(KMeansClustering.distance(fit.vectors[row], fit.clustering.centroids()[labels[row]]));
            if (labels[row] == fit.anomalyCluster) {
                triggered.add(row + lookback);
            }
        }

        return DetectionResult.builder()
                .anomaly(!triggered.isEmpty())
                .score(allScores.get(allScores.size() - 1))
                .triggeredIndices(triggered)
                .allScores(allScores)
                .metadata("anomaly_cluster", fit.anomalyCluster)
                .metadata("cluster_sizes", sizes(fit.clustering))
                .metadata("iterations", fit.clustering.iterations())
                .build();
    }

    private Fit fit(double[] data) {
        int n = data.length;
        if (n < MIN_POINTS) {
            return Fit.insufficient(String.format(
                    "Not enough data: kmeans needs at least %d points, got %d", MIN_POINTS, n));
        }
        double[][] vectors = featureVectors(data);
        if (vectors.length < clusters) {
            return Fit.insufficient(String.format(
                    "Not enough data: kmeans needs at least %d feature vectors for %d clusters, got %d",
                    clusters, clusters, vectors.length));
        }

        KMeansClustering clustering = KMeansClustering.fit(vectors, clusters, MAX_ITERATIONS);
        int anomalyCluster;
        if (clusters < 2) {
            // one cluster holds every point, so neither method may single it out
            anomalyCluster = -1;
        } else if (anomalyMethod == AnomalyMethod.SMALLEST) {
            anomalyCluster = clustering.smallestCluster();
        } else {
            anomalyCluster = clustering.furthestCluster();
        }
        return new Fit(vectors, clustering, anomalyCluster, null);
    }

    /**
     * Vector {@code r} describes point {@code r + lookback}; earlier points
     * lack the history their features need.
     */
    double[][] featureVectors(double[] data) {
        int rows = Math.max(0, data.length - lookback);
        double[][] vectors = new double[rows][];
        for (int r = 0; r < rows; r++) {
            int i = r + lookback;
            double[] vector = new double[features.size() + 1];
            vector[0] = data[i];
            for (int f = 0; f < features.size(); f++) {
                vector[f + 1] = features.get(f).valueAt(data, i);
            }
            vectors[r] = vector;
        }
        return vectors;
    }

    private static List<Integer> sizes(KMeansClustering clustering) {
        return Arrays.stream(clustering.sizes()).boxed().toList();
    }

    public int getClusters() {
        return clusters;
    }

    public List<KMeansFeature> getFeatures() {
        return features;
    }

    public AnomalyMethod getAnomalyMethod() {
        return anomalyMethod;
    }

    /**
     * @return history needed by the configured features
     */
    public int getLookback() {
        return lookback;
    }

    @Override
    public String getType() {
        return TYPE;
    }

    private static final class Fit {
        final double[][] vectors;
        final KMeansClustering clustering;
        final int anomalyCluster;
        final String reason;

        Fit(double[][] vectors, KMeansClustering clustering, int anomalyCluster, String reason) {
            this.vectors = vectors;
            this.clustering = clustering;
            this.anomalyCluster = anomalyCluster;
            this.reason = reason;
        }

        static Fit insufficient(String reason) {
            return new Fit(null, null, -1, reason);
        }
    }
}
