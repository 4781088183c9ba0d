package com.alertsentinel.core.detection.outlier;

import com.alertsentinel.core.model.DetectorConfig;
import com.alertsentinel.core.model.DetectorConfigException;
import smile.neighbor.KDTree;
import smile.neighbor.Neighbor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * k-nearest-neighbour distance detector backed by Smile's KD-tree.
 *
 * <p>
 * A point's score is derived from the distances to its {@code n_neighbors}
 * nearest other points (default 5), aggregated by {@code method}:
 * {@code largest} (k-th distance, default), {@code mean} or {@code median}.
 * </p>
 *
 * @since 1.0.0
 */
public class KnnDetector extends OutlierModelDetector {

    public static final String TYPE = "knn";

    private final int neighbours;
    private final String method;

    public KnnDetector(DetectorConfig config) {
        super(config);
        this.neighbours = config.getInt("n_neighbors", 5);
        this.method = config.getString("method").orElse("largest").toLowerCase(Locale.ROOT);
        if (neighbours < 1) {
            throw new DetectorConfigException("knn n_neighbors must be >= 1, got: " + neighbours);
        }
        if (!List.of("largest", "mean", "median").contains(method)) {
            throw new DetectorConfigException(
                    "Unknown knn method: '" + method + "'. Supported: largest, mean, median");
        }
    }

    @Override
    protected double[] scoreSamples(double[][] samples) {
        int n = samples.length;
        int k = Math.min(neighbours, n - 2);
        Integer[] ids = new Integer[n];
        for (int i = 0; i < n; i++) {
            ids[i] = i;
        }
        KDTree<Integer> tree = new KDTree<>(samples, ids);

        double[] scores = new double[n];
        for (int i = 0; i < n; i++) {
            final int self = i;
            // one extra neighbour covers trees that return the query point itself
            Neighbor<double[], Integer>[] found = tree.search(samples[i], k + 1);
            List<Double> distances = new ArrayList<>(found.length);
            Arrays.stream(found)
                    .filter(neighbor -> neighbor != null && neighbor.index != self)
                    .sorted(Comparator.comparingDouble(neighbor -> neighbor.distance))
                    .limit(k)
                    .forEach(neighbor -> distances.add(neighbor.distance));
            scores[i] = aggregate(distances);
        }
        return scores;
    }

    private double aggregate(List<Double> distances) {
        if (distances.isEmpty()) {
            return 0.0;
        }
        return switch (method) {
            case "mean" -> distances.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
            case "median" -> {
                double[] sorted = distances.stream().mapToDouble(Double::doubleValue).sorted().toArray();
                int mid = sorted.length / 2;
                yield sorted.length % 2 == 1 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2;
            }
            default -> distances.get(distances.size() - 1);
        };
    }

    @Override
    public String getType() {
        return TYPE;
    }
}
