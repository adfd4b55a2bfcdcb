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

import io.medequiv.engine.config.InvalidConfigurationException;
import io.medequiv.engine.encode.FeatureVector;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/// Chooses a cluster count with the elbow heuristic.
///
/// Fits every `k` in `[kMin, kMax]` (capped at the number of vectors) and
/// picks the `k` where the second difference of the inertia curve is
/// smallest. With fewer than three candidates the smallest `k` is returned.
/// Candidates whose every restart degenerates are left off the curve.
public final class ElbowKSelector {

    private static final Logger logger = LogManager.getLogger(ElbowKSelector.class);

    private final ClusterModel model;

    /// @param model the algorithm to fit each candidate with
    public ElbowKSelector(ClusterModel model) {
        this.model = model;
    }

    /// @param vectors vectors to fit
    /// @param kMin smallest candidate
    /// @param kMax largest candidate, inclusive
    /// @param base parameters for every fit; `k` is overridden
    /// @return the selection with the full inertia curve
    /// @throws DegenerateClusterException if no candidate could be fitted
    public Selection select(List<FeatureVector> vectors, int kMin, int kMax, ClusteringParameters base) {
        if (kMin < 1 || kMax < kMin) {
            throw new InvalidConfigurationException("invalid k range " + kMin + ".." + kMax);
        }
        int upper = Math.min(kMax, vectors.size());
        if (upper < kMin) {
            throw new InsufficientDataException(vectors.size(), kMin);
        }
        List<Integer> ks = new ArrayList<>();
        List<Double> inertias = new ArrayList<>();
        DegenerateClusterException lastFailure = null;
        for (int k = kMin; k <= upper; k++) {
            ClusterModelSnapshot snapshot;
            try {
                snapshot = model.fit(vectors, base.withK(k));
            } catch (DegenerateClusterException e) {
                logger.warn("skipping elbow candidate k={}: {}", k, e.getMessage());
                lastFailure = e;
                continue;
            }
            ks.add(k);
            inertias.add(snapshot.inertia());
            logger.debug("elbow candidate k={} inertia={}", k, snapshot.inertia());
        }
        if (ks.isEmpty()) {
            throw lastFailure;
        }

        int chosen = ks.get(0);
        if (ks.size() >= 3) {
            double bestSecond = Double.POSITIVE_INFINITY;
            for (int i = 0; i + 2 < inertias.size(); i++) {
                double second = (inertias.get(i + 2) - inertias.get(i + 1)) - (inertias.get(i + 1) - inertias.get(i));
                if (second < bestSecond) {
                    bestSecond = second;
                    chosen = ks.get(i + 1);
                }
            }
        }
        logger.info("elbow selection chose k={} from {}..{}", chosen, kMin, upper);
        return new Selection(chosen, List.copyOf(ks), List.copyOf(inertias));
    }

    /// Outcome of an elbow search.
    /// @param k the chosen cluster count
    /// @param candidates every `k` that was fitted
    /// @param inertias inertia of each candidate
    public record Selection(int k, List<Integer> candidates, List<Double> inertias) {
    }
}
