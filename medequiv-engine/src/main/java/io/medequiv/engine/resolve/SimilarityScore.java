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

/// Attribute-level similarity of a candidate to the query record, as computed
/// by [SimilarityScorer].
///
/// Each attribute score is in `[0, 1]` before weighting. The total is the
/// weighted sum plus the ingredient bonus, so it can exceed 1.
///
/// @param total weighted sum plus ingredient bonus
/// @param atc 1 when the ATC codes are equal, else 0
/// @param route 1 when the routes are equal, else 0
/// @param form 1 when the pharmaceutical forms are equal, else 0.5
/// @param quantity banded min/max ratio of the quantities
/// @param ingredientMatch how the active ingredients compare
/// @param ingredientBonus bonus added for the ingredient match
public record SimilarityScore(
    @SerializedName("total") double total,
    @SerializedName("atc") double atc,
    @SerializedName("route") double route,
    @SerializedName("form") double form,
    @SerializedName("quantity") double quantity,
    @SerializedName("ingredient_match") IngredientMatch ingredientMatch,
    @SerializedName("ingredient_bonus") double ingredientBonus
) {

    /// Comparison of the active ingredient strings.
    public enum IngredientMatch {
        /// identical strings
        EXACT,
        /// a word longer than three characters of the query occurs in the candidate
        PARTIAL,
        /// neither
        NONE
    }
}
