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

import io.medequiv.engine.encode.FeatureVector;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/// K-Means with k-means++ seeding and multiple restarts.
///
/// ## Algorithm
///
/// For each restart `r`:
/// 1. Seed `k` centroids with k-means++ using a generator derived from
///    `seed` and `r`: the first uniformly, each next one with probability
///    proportional to the squared distance to the nearest chosen centroid.
/// 2. Assign every point to its nearest centroid (ties to the lowest label).
/// 3. While some cluster is empty, move its centroid onto the point farthest
///    from its nearest surviving centroid and reassign. More than
///    `maxReseedAttempts` reseeds fail the restart.
/// 4. Move each centroid to the mean of its points and reassign. Stop when
///    the largest centroid shift is below `tolerance` or after
///    `maxIterations` updates.
///
/// The restart with the lowest inertia wins; the earliest wins ties. Final
/// labels are the nearest-centroid labels of the final centroids, so
/// [ClusterModelSnapshot#predict] agrees with every fitted assignment.
///
/// ## Thread Safety
///
/// Stateless; one instance may run concurrent fits.
public final class KMeansClusterModel implements ClusterModel {

    private static final Logger logger = LogManager.getLogger(KMeansClusterModel.class);

    private static final long RESTART_SEED_MIX = 0x9E3779B97F4A7C15L;

    private final Seeder seeder;

    /// K-Means seeded with k-means++.
    public KMeansClusterModel() {
        this(KMeansClusterModel::seedPlusPlus);
    }

    KMeansClusterModel(Seeder seeder) {
        this.seeder = seeder;
    }

    @Override
    public String name() {
        return "kmeans";
    }

    @Override
    public ClusterModelSnapshot fit(List<FeatureVector> vectors, ClusteringParameters parameters) {
        int k = parameters.k();
        int n = vectors.size();
        if (n < k) {
            throw new InsufficientDataException(n, k);
        }
        double[][] points = new double[n][];
        for (int i = 0; i < n; i++) {
            points[i] = vectors.get(i).values();
            if (points[i].length != points[0].length) {
                throw new IllegalArgumentException("vector " + vectors.get(i).cum() + " has "
                    + points[i].length + " dimensions, expected " + points[0].length);
            }
        }

        Run best = null;
        int failed = 0;
        for (int r = 0; r < parameters.nRestarts(); r++) {
            Random random = new Random(parameters.seed() ^ (RESTART_SEED_MIX * (r + 1)));
            try {
                Run run = runOnce(points, parameters, random, r);
                logger.debug("restart {}: inertia {} after {} iterations (converged={}, reseeds={})",
                    r, run.inertia, run.iterations, run.converged, run.reseeds);
                if (best == null || run.inertia < best.inertia) {
                    best = run;
                }
            } catch (DegenerateClusterException e) {
                failed++;
                logger.warn("restart {} failed: {}", r, e.getMessage());
            }
        }
        if (best == null) {
            throw new DegenerateClusterException(
                "all " + parameters.nRestarts() + " restarts failed to keep " + k + " clusters populated");
        }

        List<ClusterAssignment> assignments = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            assignments.add(new ClusterAssignment(vectors.get(i).cum(), best.labels[i], points[i], true));
        }
        logger.info("fitted {} clusters over {} vectors: restart {} of {}, inertia {}, {} iterations, converged={}",
            k, n, best.restart, parameters.nRestarts(), best.inertia, best.iterations, best.converged);

        return ClusterModelSnapshot.builder()
            .centroids(best.centroids)
            .assignments(assignments)
            .inertia(best.inertia)
            .iterations(best.iterations)
            .converged(best.converged)
            .restart(best.restart)
            .failedRestarts(failed)
            .reseeds(best.reseeds)
            .build();
    }

    private Run runOnce(double[][] points, ClusteringParameters parameters, Random random, int restart) {
        int k = parameters.k();
        double[][] centroids = seeder.seed(points, k, random);
        int[] labels = assign(points, centroids);
        int iterations = 0;
        int reseeds = 0;
        boolean converged = false;

        while (true) {
            int empty = firstEmpty(labels, k);
            if (empty >= 0) {
                if (reseeds >= parameters.maxReseedAttempts()) {
                    throw new DegenerateClusterException("cluster " + empty + " still empty after "
                        + reseeds + " reseeds in restart " + restart);
                }
                reseed(points, centroids, labels, empty);
                reseeds++;
                labels = assign(points, centroids);
                continue;
            }
            if (converged || iterations >= parameters.maxIterations()) {
                break;
            }
            double[][] updated = means(points, labels, centroids);
            double shift = 0.0d;
            for (int c = 0; c < k; c++) {
                shift = Math.max(shift, VectorMath.euclidean(centroids[c], updated[c]));
            }
            centroids = updated;
            labels = assign(points, centroids);
            iterations++;
            converged = shift == 0.0d || shift < parameters.tolerance();
        }

        double inertia = 0.0d;
        for (int i = 0; i < points.length; i++) {
            inertia += VectorMath.squaredDistance(points[i], centroids[labels[i]]);
        }
        return new Run(restart, centroids, labels, inertia, iterations, converged, reseeds);
    }

    private static double[][] seedPlusPlus(double[][] points, int k, Random random) {
        int n = points.length;
        double[][] centroids = new double[k][];
        centroids[0] = points[random.nextInt(n)].clone();
        double[] nearest = new double[n];
        for (int i = 0; i < n; i++) {
            nearest[i] = VectorMath.squaredDistance(points[i], centroids[0]);
        }
        for (int c = 1; c < k; c++) {
            double total = 0.0d;
            for (double d : nearest) {
                total += d;
            }
            int chosen;
            if (total <= 0.0d) {
                chosen = random.nextInt(n);
            } else {
                double target = random.nextDouble() * total;
                double cumulative = 0.0d;
                chosen = -1;
                for (int i = 0; i < n; i++) {
                    if (nearest[i] <= 0.0d) {
                        continue;
                    }
                    cumulative += nearest[i];
                    chosen = i;
                    if (cumulative > target) {
                        break;
                    }
                }
            }
            centroids[c] = points[chosen].clone();
            for (int i = 0; i < n; i++) {
                nearest[i] = Math.min(nearest[i], VectorMath.squaredDistance(points[i], centroids[c]));
            }
        }
        return centroids;
    }

    private static int[] assign(double[][] points, double[][] centroids) {
        int[] labels = new int[points.length];
        for (int i = 0; i < points.length; i++) {
            labels[i] = VectorMath.nearest(centroids, points[i]);
        }
        return labels;
    }

    private static int firstEmpty(int[] labels, int k) {
        boolean[] seen = new boolean[k];
        for (int label : labels) {
            seen[label] = true;
        }
        for (int c = 0; c < k; c++) {
            if (!seen[c]) {
                return c;
            }
        }
        return -1;
    }

    // moves the empty centroid onto the point farthest from its own surviving centroid
    private static void reseed(double[][] points, double[][] centroids, int[] labels, int empty) {
        int farthest = 0;
        double farthestDistance = -1.0d;
        for (int i = 0; i < points.length; i++) {
            double d = VectorMath.squaredDistance(points[i], centroids[labels[i]]);
            if (d > farthestDistance) {
                farthestDistance = d;
                farthest = i;
            }
        }
        centroids[empty] = points[farthest].clone();
    }

    private static double[][] means(double[][] points, int[] labels, double[][] previous) {
        int k = previous.length;
        int dims = points[0].length;
        double[][] sums = new double[k][dims];
        int[] counts = new int[k];
        for (int i = 0; i < points.length; i++) {
            int label = labels[i];
            counts[label]++;
            for (int d = 0; d < dims; d++) {
                sums[label][d] += points[i][d];
            }
        }
        for (int c = 0; c < k; c++) {
            if (counts[c] == 0) {
                sums[c] = previous[c].clone();
                continue;
            }
            for (int d = 0; d < dims; d++) {
                sums[c][d] /= counts[c];
            }
        }
        return sums;
    }

    /// Chooses the initial centroids of one restart.
    @FunctionalInterface
    interface Seeder {
        /// @param points the data, not to be modified
        /// @param k number of centroids
        /// @param random the restart's generator
        /// @return `k` fresh centroid arrays
        double[][] seed(double[][] points, int k, Random random);
    }

    private static final class Run {
        private final int restart;
        private final double[][] centroids;
        private final int[] labels;
        private final double inertia;
        private final int iterations;
        private final boolean converged;
        private final int reseeds;

        private Run(int restart, double[][] centroids, int[] labels, double inertia, int iterations,
                    boolean converged, int reseeds) {
            this.restart = restart;
            this.centroids = centroids;
            this.labels = labels;
            this.inertia = inertia;
            this.iterations = iterations;
            this.converged = converged;
            this.reseeds = reseeds;
        }
    }
}
