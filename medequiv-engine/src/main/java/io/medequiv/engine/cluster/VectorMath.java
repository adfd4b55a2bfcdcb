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

/// Distance helpers over dense `double[]` vectors.
public final class VectorMath {

    private VectorMath() {
    }

    /// @param a first vector
    /// @param b second vector, same length
    /// @return squared Euclidean distance
    public static double squaredDistance(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("dimension mismatch: " + a.length + " vs " + b.length);
        }
        double sum = 0.0d;
        for (int i = 0; i < a.length; i++) {
            double diff = a[i] - b[i];
            sum += diff * diff;
        }
        return sum;
    }

    /// @param a first vector
    /// @param b second vector, same length
    /// @return Euclidean distance
    public static double euclidean(double[] a, double[] b) {
        return Math.sqrt(squaredDistance(a, b));
    }

    /// Find the nearest centroid; on equal distance the lowest index wins.
    ///
    /// @param centroids candidate centroids
    /// @param point the point
    /// @return index of the nearest centroid
    public static int nearest(double[][] centroids, double[] point) {
        int best = 0;
        double bestDistance = Double.POSITIVE_INFINITY;
        for (int c = 0; c < centroids.length; c++) {
            double d = squaredDistance(centroids[c], point);
            if (d < bestDistance) {
                bestDistance = d;
                best = c;
            }
        }
        return best;
    }

    /// @param source rows to copy
    /// @return a deep copy
    public static double[][] copy(double[][] source) {
        double[][] copy = new double[source.length][];
        for (int i = 0; i < source.length; i++) {
            copy[i] = source[i].clone();
        }
        return copy;
    }
}
