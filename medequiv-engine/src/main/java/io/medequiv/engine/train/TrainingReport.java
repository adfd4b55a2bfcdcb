package io.medequiv.engine.train;

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
import io.medequiv.engine.cluster.ClusterQuality;

import java.util.List;

/// Batch-level summary of one training run.
///
/// @param totalRecords records in the batch
/// @param eligibleRecords records passing the eligibility rules
/// @param fittedRecords eligible records whose vectors were clustered
/// @param predictedRecords ineligible records labeled by prediction
/// @param excludedRecords records with a failed numeric transform
/// @param unknownCategories categorical values encoded with the sentinel
/// @param k cluster count used
/// @param kCandidates cluster counts tried by the elbow search, empty if `k` was fixed
/// @param kInertias inertia of each elbow candidate
/// @param inertia inertia of the chosen partition
/// @param iterations iterations of the winning restart
/// @param converged whether the winning restart converged
/// @param failedRestarts restarts abandoned because a cluster stayed empty
/// @param quality quality scores of the partition
/// @param durationMillis wall-clock duration of the run
public record TrainingReport(
    @SerializedName("total_records") int totalRecords,
    @SerializedName("eligible_records") int eligibleRecords,
    @SerializedName("fitted_records") int fittedRecords,
    @SerializedName("predicted_records") int predictedRecords,
    @SerializedName("excluded_records") int excludedRecords,
    @SerializedName("unknown_categories") int unknownCategories,
    @SerializedName("k") int k,
    @SerializedName("k_candidates") List<Integer> kCandidates,
    @SerializedName("k_inertias") List<Double> kInertias,
    @SerializedName("inertia") double inertia,
    @SerializedName("iterations") int iterations,
    @SerializedName("converged") boolean converged,
    @SerializedName("failed_restarts") int failedRestarts,
    @SerializedName("quality") ClusterQuality quality,
    @SerializedName("duration_millis") long durationMillis
) {

    public TrainingReport {
        kCandidates = kCandidates == null ? List.of() : List.copyOf(kCandidates);
        kInertias = kInertias == null ? List.of() : List.copyOf(kInertias);
    }
}
