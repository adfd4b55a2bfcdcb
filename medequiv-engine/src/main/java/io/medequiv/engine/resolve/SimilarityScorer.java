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

import io.medequiv.engine.model.CategoricalAttribute;
import io.medequiv.engine.model.MedicationRecord;

/// Hierarchical attribute similarity between a query record and a candidate.
///
/// ## Weights
///
/// | Attribute | Weight | Score |
/// |-----------|--------|-------|
/// | ATC code | 0.40 | 1 equal, 0 otherwise |
/// | route | 0.30 | 1 equal, 0 otherwise |
/// | pharmaceutical form | 0.20 | 1 equal, 0.5 otherwise |
/// | quantity | 0.10 | see below |
///
/// Quantity score: with both quantities positive, `r = min / max`; `r < 0.5`
/// scores 0.1, `r < 0.8` scores 0.4, otherwise `r`. A missing or
/// non-positive quantity scores 0.3.
///
/// The active ingredient adds a bonus on top of the weighted sum: 0.15 for
/// an exact match, 0.10 when a word of more than three characters of the
/// query ingredient occurs in the candidate's. The best possible total is
/// therefore 1.15.
///
/// Stateless and thread safe.
public final class SimilarityScorer {

    public static final double ATC_WEIGHT = 0.40d;
    public static final double ROUTE_WEIGHT = 0.30d;
    public static final double FORM_WEIGHT = 0.20d;
    public static final double QUANTITY_WEIGHT = 0.10d;

    public static final double EXACT_INGREDIENT_BONUS = 0.15d;
    public static final double PARTIAL_INGREDIENT_BONUS = 0.10d;

    /// Highest reachable total.
    public static final double MAX_SCORE = ATC_WEIGHT + ROUTE_WEIGHT + FORM_WEIGHT + QUANTITY_WEIGHT
        + EXACT_INGREDIENT_BONUS;

    private static final double FORM_MISMATCH = 0.5d;
    private static final double QUANTITY_MISSING = 0.3d;
    private static final double QUANTITY_FAR = 0.1d;
    private static final double QUANTITY_NEAR = 0.4d;
    private static final int MIN_PARTIAL_WORD = 4;

    /// @param query the record being replaced
    /// @param candidate the proposed substitute
    /// @return the score with its per-attribute breakdown
    public SimilarityScore score(MedicationRecord query, MedicationRecord candidate) {
        double atc = same(CategoricalAttribute.ATC, query, candidate) ? 1.0d : 0.0d;
        double route = same(CategoricalAttribute.ROUTE, query, candidate) ? 1.0d : 0.0d;
        double form = same(CategoricalAttribute.PHARMACEUTICAL_FORM, query, candidate) ? 1.0d : FORM_MISMATCH;
        double quantity = quantityScore(query.quantity(), candidate.quantity());

        SimilarityScore.IngredientMatch match = ingredientMatch(
            CategoricalAttribute.ACTIVE_INGREDIENT.valueOf(query),
            CategoricalAttribute.ACTIVE_INGREDIENT.valueOf(candidate));
        double bonus = switch (match) {
            case EXACT -> EXACT_INGREDIENT_BONUS;
            case PARTIAL -> PARTIAL_INGREDIENT_BONUS;
            case NONE -> 0.0d;
        };

        double total = atc * ATC_WEIGHT + route * ROUTE_WEIGHT + form * FORM_WEIGHT + quantity * QUANTITY_WEIGHT
            + bonus;
        return new SimilarityScore(total, atc, route, form, quantity, match, bonus);
    }

    /// @param query quantity of the query record
    /// @param candidate quantity of the candidate
    /// @return the banded quantity score
    public static double quantityScore(double query, double candidate) {
        if (!(query > 0.0d) || !(candidate > 0.0d)) {
            return QUANTITY_MISSING;
        }
        double ratio = Math.min(query, candidate) / Math.max(query, candidate);
        if (ratio < 0.5d) {
            return QUANTITY_FAR;
        }
        if (ratio < 0.8d) {
            return QUANTITY_NEAR;
        }
        return ratio;
    }

    /// @param query active ingredient of the query record
    /// @param candidate active ingredient of the candidate
    /// @return the kind of match
    public static SimilarityScore.IngredientMatch ingredientMatch(String query, String candidate) {
        if (query.equals(candidate)) {
            return SimilarityScore.IngredientMatch.EXACT;
        }
        for (String word : query.split("\\s+")) {
            if (word.length() >= MIN_PARTIAL_WORD && candidate.contains(word)) {
                return SimilarityScore.IngredientMatch.PARTIAL;
            }
        }
        return SimilarityScore.IngredientMatch.NONE;
    }

    private static boolean same(CategoricalAttribute attribute, MedicationRecord a, MedicationRecord b) {
        return attribute.valueOf(a).equals(attribute.valueOf(b));
    }
}
