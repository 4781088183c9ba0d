package com.alertsentinel.core.detection;

import java.util.Arrays;

/**
 * Deterministic Lloyd's k-means.
 *
 * <p>
 * Centroid {@code k} starts at vector {@code k * (n / clusters)}, so the
 * outcome depends only on the input order. Iteration stops once no label
 * changes, or after {@code maxIterations} rounds. A cluster that loses all of
 * its points keeps its previous centroid.
 * </p>
 */
final class KMeansClustering {

    private final double[][] centroids;
    private final int[] labels;
    private final int[] sizes;
    private final int iterations;

    private KMeansClustering(double[][] centroids, int[] labels, int[] sizes, int iterations) {
        this.centroids = centroids;
        this.labels = labels;
        this.sizes = sizes;
        this.iterations = iterations;
    }

    /**
     * @param vectors       feature vectors, at least {@code clusters} of them
     * @param clusters      number of clusters, {@code >= 1}
     * @param maxIterations iteration cap
     */
    static KMeansClustering fit(double[][] vectors, int clusters, int maxIterations) {
        int n = vectors.length;
        int dims = vectors[0].length;
        int step = n / clusters;

        double[][] centroids = new double[clusters][];
        for (int k = 0; k < clusters; k++) {
            centroids[k] = vectors[k * step].clone();
        }

        int[] labels = new int[n];
        Arrays.fill(labels, -1);
        int iteration = 0;
        while (iteration < maxIterations) {
            iteration++;
            boolean changed = false;
            for (int i = 0; i < n; i++) {
                int nearest = nearest(centroids, vectors[i]);
                if (nearest != labels[i]) {
                    labels[i] = nearest;
                    changed = true;
                }
            }
            if (!changed) {
                break;
            }

            double[][] sums = new double[clusters][dims];
            int[] counts = new int[clusters];
            for (int i = 0; i < n; i++) {
                counts[labels[i]]++;
                for (int d = 0; d < dims; d++) {
                    sums[labels[i]][d] += vectors[i][d];
                }
            }
            for (int k = 0; k < clusters; k++) {
                if (counts[k] == 0) {
                    continue;
                }
                for (int d = 0; d < dims; d++) {
                    centroids[k][d] = sums[k][d] / counts[k];
                }
            }
        }

        int[] sizes = new int[clusters];
        for (int label : labels) {
            sizes[label]++;
        }
        return new KMeansClustering(centroids, labels, sizes, iteration);
    }

    /** Index of the closest centroid; ties go to the lower index. */
    static int nearest(double[][] centroids, double[] vector) {
        int best = 0;
        double bestDistance = Double.POSITIVE_INFINITY;
        for (int k = 0; k < centroids.length; k++) {
            double d = distance(centroids[k], vector);
            if (d < bestDistance) {
                bestDistance = d;
                best = k;
            }
        }
        return best;
    }

    static double distance(double[] a, double[] b) {
        double sum = 0;
        for (int d = 0; d < a.length; d++) {
            double diff = a[d] - b[d];
            sum += diff * diff;
        }
        return Math.sqrt(sum);
    }

    /** Cluster with the fewest points; ties go to the lower index. */
    int smallestCluster() {
        int smallest = 0;
        for (int k = 1; k < sizes.length; k++) {
            if (sizes[k] < sizes[smallest]) {
                smallest = k;
            }
        }
        return smallest;
    }

    /** Cluster whose centroid lies furthest from the mean of all centroids. */
    int furthestCluster() {
        int dims = centroids[0].length;
        double[] center = new double[dims];
        for (double[] centroid : centroids) {
            for (int d = 0; d < dims; d++) {
                center[d] += centroid[d] / centroids.length;
            }
        }
        int furthest = 0;
        double furthestDistance = -1;
        for (int k = 0; k < centroids.length; k++) {
            double d = distance(centroids[k], center);
            if (d > furthestDistance) {
                furthestDistance = d;
                furthest = k;
            }
        }
        return furthest;
    }

    double[][] centroids() {
        return centroids;
    }

    int[] labels() {
        return labels;
    }

    int[] sizes() {
        return sizes;
    }

    int iterations() {
        return iterations;
    }
}
