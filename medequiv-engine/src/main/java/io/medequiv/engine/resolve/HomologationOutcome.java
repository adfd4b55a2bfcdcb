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

/// Result of homologating one CUM in a bulk run.
///
/// @param cum the requested CUM
/// @param status the outcome kind
/// @param equivalentCum best substitute, null unless FOUND
/// @param equivalentProduct product name of the substitute, null unless FOUND
/// @param distance distance to the substitute, null unless FOUND
/// @param similarity attribute similarity of the substitute, null unless FOUND
/// @param reason failure description, null unless UNRESOLVABLE
public record HomologationOutcome(
    @SerializedName("cum") String cum,
    @SerializedName("status") Status status,
    @SerializedName("equivalent_cum") String equivalentCum,
    @SerializedName("equivalent_product") String equivalentProduct,
    @SerializedName("distance") Double distance,
    @SerializedName("similarity") Double similarity,
    @SerializedName("reason") String reason
) {

    /// Outcome kinds.
    public enum Status {
        /// a substitute was found
        FOUND,
        /// the query resolved but no candidate survived
        NO_EQUIVALENT,
        /// the query could not be resolved
        UNRESOLVABLE
    }

    static HomologationOutcome found(String cum, EquivalenceCandidate best) {
        return new HomologationOutcome(cum, Status.FOUND, best.cum(), best.productName(), best.distance(),
            best.similarityScore(), null);
    }

    static HomologationOutcome noEquivalent(String cum) {
        return new HomologationOutcome(cum, Status.NO_EQUIVALENT, null, null, null, null, null);
    }

    static HomologationOutcome unresolvable(String cum, String reason) {
        return new HomologationOutcome(cum, Status.UNRESOLVABLE, null, null, null, null, reason);
    }
}
