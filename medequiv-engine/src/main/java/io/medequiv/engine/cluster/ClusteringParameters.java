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

import com.google.gson.annotations.SerializedName;
import io.medequiv.engine.config.InvalidConfigurationException;

/// Parameters of one clustering fit.
///
/// @param k number of clusters
/// @param seed base seed; restart `r` derives its generator from `seed` and `r`
/// @param maxIterations iteration cap per restart
/// @param tolerance largest centroid shift that counts as converged
/// @param nRestarts number of independently seeded restarts
/// @param maxReseedAttempts empty-cluster reseeds allowed per restart
public record ClusteringParameters(
    @SerializedName("k") int k,
    @SerializedName("seed") long seed,
    @SerializedName("max_iterations") int maxIterations,
    @SerializedName("tolerance") double tolerance,
    @SerializedName("n_restarts") int nRestarts,
    @SerializedName("max_reseed_attempts") int maxReseedAttempts
) {

    public static final int DEFAULT_K = 15;
    public static final long DEFAULT_SEED = 42L;
    public static final int DEFAULT_MAX_ITERATIONS = 300;
    public static final double DEFAULT_TOLERANCE = 1e-4;
    public static final int DEFAULT_RESTARTS = 10;
    public static final int DEFAULT_MAX_RESEED_ATTEMPTS = 10;

    /// @throws InvalidConfigurationException if any value is out of range
    public ClusteringParameters {
        if (k < 1) {
            throw new InvalidConfigurationException("k must be positive, got " + k);
        }
        if (maxIterations < 1) {
            throw new InvalidConfigurationException("max_iterations must be positive, got " + maxIterations);
        }
        if (!Double.isFinite(tolerance) || tolerance < 0.0d) {
            throw new InvalidConfigurationException("tolerance must be a finite non-negative number, got " + tolerance);
        }
        if (nRestarts < 1) {
            throw new InvalidConfigurationException("n_restarts must be positive, got " + nRestarts);
        }
        if (maxReseedAttempts < 0) {
            throw new InvalidConfigurationException("max_reseed_attempts cannot be negative, got " + maxReseedAttempts);
        }
    }

    /// @param k number of clusters
    /// @return parameters with `k` clusters and every other value at its default
    public static ClusteringParameters defaults(int k) {
        return new ClusteringParameters(k, DEFAULT_SEED, DEFAULT_MAX_ITERATIONS, DEFAULT_TOLERANCE,
            DEFAULT_RESTARTS, DEFAULT_MAX_RESEED_ATTEMPTS);
    }

    /// @param k the new cluster count
    /// @return a copy with a different cluster count
    public ClusteringParameters withK(int k) {
        return new ClusteringParameters(k, seed, maxIterations, tolerance, nRestarts, maxReseedAttempts);
    }
}
