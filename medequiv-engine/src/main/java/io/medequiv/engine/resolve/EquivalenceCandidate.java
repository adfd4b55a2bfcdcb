package io.medequiv.engine.resolve;

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

/// One ranked substitute.
///
/// @param cum candidate identity
/// @param productName candidate commercial name
/// @param distance Euclidean distance to the query in the weighted space
/// @param label shared cluster label
/// @param similarity attribute similarity to the query record, null for vector queries
public record EquivalenceCandidate(
    @SerializedName("cum") String cum,
    @SerializedName("product_name") String productName,
    @SerializedName("distance") double distance,
    @SerializedName("label") int label,
    @SerializedName("similarity") SimilarityScore similarity
) {

    /// @return the similarity total, or NaN when there was no query record
    public double similarityScore() {
        return similarity == null ? Double.NaN : similarity.total();
    }
}
