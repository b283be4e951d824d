package com.finance.anomaly.engine.timeseries;

import lombok.Value;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Lloyd's k-means with k-means++ seeding. Deterministic for a given seed: the random source is only
 * used to pick seeds, and distance ties resolve to the lowest cluster index.
 */
public class KMeansClusterer {

    private final int maxIterations;
    private final long seed;

    public KMeansClusterer(int maxIterations, long seed) {
        this.maxIterations = maxIterations;
        this.seed = seed;
    }

    @Value
    public static class Result {
        int[] assignments;
        // Euclidean distance of each point to its centroid
        double[] distances;
        double[][] centroids;

        public int clusterCount() {
            return centroids.length;
        }

        public int size(int cluster) {
            int count = 0;
            for (int a : assignments) {
                if (a == cluster) count++;
            }
            return count;
        }
    }

    /**
     * Clusters the rows of {@code points}. {@code k} is reduced to the number of distinct points.
     */
    public Result cluster(double[][] points, int k) {
        int n = points.length;
        if (n == 0) {
            return new Result(new int[0], new double[0], new double[0][]);
        }
        int clusters = Math.max(1, Math.min(k, distinctCount(points)));
        Random random = new Random(seed);

        double[][] centroids = seed(points, clusters, random);
        int[] assignments = new int[n];
        Arrays.fill(assignments, -1);

        for (int iteration = 0; iteration < maxIterations; iteration++) {
            boolean changed = false;
            for (int i = 0; i < n; i++) {
                int nearest = nearest(points[i], centroids);
                if (nearest != assignments[i]) {
                    assignments[i] = nearest;
                    changed = true;
                }
            }
            if (!changed) break;
            centroids = recompute(points, assignments, centroids);
        }

        double[] distances = new double[n];
        for (int i = 0; i < n; i++) {
            distances[i] = Math.sqrt(squaredDistance(points[i], centroids[assignments[i]]));
        }
        return new Result(assignments, distances, centroids);
    }

    private static double[][] seed(double[][] points, int k, Random random) {
        int n = points.length;
        List<double[]> chosen = new ArrayList<>();
        chosen.add(points[random.nextInt(n)].clone());

        double[] nearestSq = new double[n];
        while (chosen.size() < k) {
            double total = 0.0;
            for (int i = 0; i < n; i++) {
                double best = Double.MAX_VALUE;
                for (double[] c : chosen) {
                    best = Math.min(best, squaredDistance(points[i], c));
                }
                nearestSq[i] = best;
                total += best;
            }
            if (total == 0.0) break;

            double target = random.nextDouble() * total;
            int pick = n - 1;
            double cumulative = 0.0;
            for (int i = 0; i < n; i++) {
                cumulative += nearestSq[i];
                if (cumulative >= target && nearestSq[i] > 0.0) {
                    pick = i;
                    break;
                }
            }
            chosen.add(points[pick].clone());
        }
        return chosen.toArray(new double[0][]);
    }

    private static double[][] recompute(double[][] points, int[] assignments, double[][] previous) {
        int k = previous.length;
        int dims = points[0].length;
        double[][] sums = new double[k][dims];
        int[] counts = new int[k];
        for (int i = 0; i < points.length; i++) {
            counts[assignments[i]]++;
            for (int d = 0; d < dims; d++) {
                sums[assignments[i]][d] += points[i][d];
            }
        }

        double[][] centroids = new double[k][];
        for (int c = 0; c < k; c++) {
            if (counts[c] == 0) {
                // Empty cluster: restart it on the point worst served by the previous centroids
                centroids[c] = points[farthestPoint(points, assignments, previous)].clone();
                continue;
            }
            centroids[c] = new double[dims];
            for (int d = 0; d < dims; d++) {
                centroids[c][d] = sums[c][d] / counts[c];
            }
        }
        return centroids;
    }

    private static int farthestPoint(double[][] points, int[] assignments, double[][] centroids) {
        int farthest = 0;
        double best = -1.0;
        for (int i = 0; i < points.length; i++) {
            double distance = squaredDistance(points[i], centroids[assignments[i]]);
            if (distance > best) {
                best = distance;
                farthest = i;
            }
        }
        return farthest;
    }

    private static int nearest(double[] point, double[][] centroids) {
        int nearest = 0;
        double best = Double.MAX_VALUE;
        for (int c = 0; c < centroids.length; c++) {
            double distance = squaredDistance(point, centroids[c]);
            if (distance < best) {
                best = distance;
                nearest = c;
            }
        }
        return nearest;
    }

    private static double squaredDistance(double[] a, double[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            double d = a[i] - b[i];
            sum += d * d;
        }
        return sum;
    }

    private static int distinctCount(double[][] points) {
        Set<List<Double>> distinct = new LinkedHashSet<>();
        for (double[] point : points) {
            List<Double> key = new ArrayList<>(point.length);
            for (double v : point) key.add(v);
            distinct.add(key);
        }
        return distinct.size();
    }
}
