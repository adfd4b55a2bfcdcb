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

import java.util.List;

/// A partitioning algorithm over weighted feature vectors.
///
/// Implementations must be deterministic for a given input order and
/// [ClusteringParameters#seed()], and must terminate within
/// [ClusteringParameters#maxIterations()] iterations per restart.
public interface ClusterModel {

    /// Partition the vectors.
    ///
    /// @param vectors the vectors to fit, all of the same dimensionality
    /// @param parameters clustering parameters
    /// @return the fitted snapshot, one fitted assignment per vector
    /// @throws InsufficientDataException if there are fewer vectors than clusters
    /// @throws DegenerateClusterException if no restart produced a usable partition
    ClusterModelSnapshot fit(List<FeatureVector> vectors, ClusteringParameters parameters);

    /// @return a short name for logs and reports
    String name();
}
