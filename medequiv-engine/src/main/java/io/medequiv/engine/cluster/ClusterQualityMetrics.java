package io.medequiv.engine.cluster;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Random;

/// Internal validation scores of a fitted partition.
///
/// | Score | Better | Cost |
/// |-------|--------|------|
/// | silhouette | higher | `O(s * n)` for a sample of `s` points |
/// | Davies-Bouldin | lower | `O(n + k^2)` |
/// | Calinski-Harabasz | higher | `O(n)` |
///
/// The silhouette uses a deterministic sample of at most [#sampleLimit()]
/// points, drawn with a fixed seed, so repeated evaluation of the same
/// snapshot gives the same score.
public final class ClusterQualityMetrics {

    private static final Logger logger = LogManager.getLogger(ClusterQualityMetrics.class);

    /// Default cap on the number of silhouette sample points
    public static final int DEFAULT_SAMPLE_LIMIT = 2000;

    private final int sampleLimit;
    private final long sampleSeed;

    /// Create metrics with the default sample limit and seed 0
    public ClusterQualityMetrics() {
        this(DEFAULT_SAMPLE_LIMIT, 0L);
    }

    /// @param sampleLimit maximum number of silhouette sample points
    /// @param sampleSeed seed of the sample selection
    public ClusterQualityMetrics(int sampleLimit, long sampleSeed) {
        if (sampleLimit < 1) {
            throw new IllegalArgumentException("sampleLimit must be positive, got " + sampleLimit);
        }
        this.sampleLimit = sampleLimit;
        this.sampleSeed = sampleSeed;
    }

    public int sampleLimit() {
        return sampleLimit;
    }

    /// Score the fitted assignments of a snapshot.
    ///
    /// @param snapshot the snapshot
    /// @return the quality scores
    public ClusterQuality evaluate(ClusterModelSnapshot snapshot) {
        List<ClusterAssignment> fitted = snapshot.assignments().stream().filter(ClusterAssignment::fitted).toList();
        double[][] points = new double[fitted.size()][];
        int[] labels = new int[fitted.size()];
        for (int i = 0; i < points.length; i++) {
            points[i] = fitted.get(i).vector();
            labels[i] = fitted.get(i).label();
        }
        return evaluate(points, labels, snapshot.centroids());
    }

    /// @param points the fitted points
    /// @param labels label of each point
    /// @param centroids cluster centroids
    /// @return the quality scores
    public ClusterQuality evaluate(double[][] points, int[] labels, double[][] centroids) {
        int k = centroids.length;
        int[] sizes = new int[k];
        for (int label : labels) {
            sizes[label]++;
        }
        int populated = 0;
        for (int size : sizes) {
            if (size > 0) {
                populated++;
            }
        }
        int[] sample = sample(points.length);
        ClusterQuality quality = new ClusterQuality(
            silhouette(points, labels, sizes, populated, sample),
            daviesBouldin(points, labels, centroids, sizes, populated),
            calinskiHarabasz(points, labels, centroids, sizes, populated),
            sample.length);
        logger.debug("cluster quality: {}", quality);
        return quality;
    }

    private int[] sample(int n) {
        int[] indices = new int[n];
        for (int i = 0; i < n; i++) {
            indices[i] = i;
        }
        if (n <= sampleLimit) {
            return indices;
        }
        // partial Fisher-Yates
        Random random = new Random(sampleSeed);
        for (int i = 0; i < sampleLimit; i++) {
            int j = i + random.nextInt(n - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
        }
        int[] sample = new int[sampleLimit];
        System.arraycopy(indices, 0, sample, 0, sampleLimit);
        return sample;
    }

    private static double silhouette(double[][] points, int[] labels, int[] sizes, int populated, int[] sample) {
        int n = points.length;
        if (populated < 2 || populated >= n) {
            return Double.NaN;
        }
        int k = sizes.length;
        double total = 0.0d;
        for (int i : sample) {
            int own = labels[i];
            if (sizes[own] <= 1) {
                continue;
            }
            double[] sums = new double[k];
            for (int j = 0; j < n; j++) {
                if (j != i) {
                    sums[labels[j]] += VectorMath.euclidean(points[i], points[j]);
                }
            }
            double a = sums[own] / (sizes[own] - 1);
            double b = Double.POSITIVE_INFINITY;
            for (int c = 0; c < k; c++) {
                if (c != own && sizes[c] > 0) {
                    b = Math.min(b, sums[c] / sizes[c]);
                }
            }
            double denominator = Math.max(a, b);
            total += denominator == 0.0d ? 0.0d : (b - a) / denominator;
        }
        return total / sample.length;
    }

    private static double daviesBouldin(double[][] points, int[] labels, double[][] centroids, int[] sizes,
                                        int populated) {
        if (populated < 2) {
            return Double.NaN;
        }
        int k = centroids.length;
        double[] scatter = new double[k];
        for (int i = 0; i < points.length; i++) {
            scatter[labels[i]] += VectorMath.euclidean(points[i], centroids[labels[i]]);
        }
        for (int c = 0; c < k; c++) {
            if (sizes[c] > 0) {
                scatter[c] /= sizes[c];
            }
        }
        double total = 0.0d;
        for (int i = 0; i < k; i++) {
            if (sizes[i] == 0) {
                continue;
            }
            double worst = 0.0d;
            for (int j = 0; j < k; j++) {
                if (j == i || sizes[j] == 0) {
                    continue;
                }
                double separation = VectorMath.euclidean(centroids[i], centroids[j]);
                // coincident centroids count as infinitely separated
                if (separation > 0.0d) {
                    worst = Math.max(worst, (scatter[i] + scatter[j]) / separation);
                }
            }
            total += worst;
        }
        return total / populated;
    }

    private static double calinskiHarabasz(double[][] points, int[] labels, double[][] centroids, int[] sizes,
                                           int populated) {
        int n = points.length;
        if (populated < 2 || n <= populated) {
            return Double.NaN;
        }
        int dims = points[0].length;
        double[] mean = new double[dims];
        for (double[] point : points) {
            for (int d = 0; d < dims; d++) {
                mean[d] += point[d];
            }
        }
        for (int d = 0; d < dims; d++) {
            mean[d] /= n;
        }
        double between = 0.0d;
        for (int c = 0; c < centroids.length; c++) {
            if (sizes[c] > 0) {
                between += sizes[c] * VectorMath.squaredDistance(centroids[c], mean);
            }
        }
        double within = 0.0d;
        for (int i = 0; i < n; i++) {
            within += VectorMath.squaredDistance(points[i], centroids[labels[i]]);
        }
        if (within == 0.0d) {
            return 1.0d;
        }
        return (between / (populated - 1)) / (within / (n - populated));
    }
}
