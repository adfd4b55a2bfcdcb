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

/// Internal validation scores of one partition.
///
/// A score that is undefined for the partition (a single cluster, or every
/// point in its own cluster) is `NaN`.
///
/// @param silhouette mean silhouette coefficient, higher is better, in [-1, 1]
/// @param daviesBouldin Davies-Bouldin index, lower is better
/// @param calinskiHarabasz Calinski-Harabasz index, higher is better
/// @param sampleSize number of points the silhouette was computed on
public record ClusterQuality(
    @SerializedName("silhouette") double silhouette,
    @SerializedName("davies_bouldin") double daviesBouldin,
    @SerializedName("calinski_harabasz") double calinskiHarabasz,
    @SerializedName("sample_size") int sampleSize
) {
}
