package io.medequiv.engine.encode;

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

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Decides homologation eligibility and derives per-category validity ratios.
///
/// With the default rules a record is eligible when its registration is
/// active or in renewal, its CUM is active, and it is not a medical sample.
/// Classification is a pure function of the record and the rules.
public final class ValidityClassifier {

    private final EligibilityRules rules;

    /// Create a classifier with [EligibilityRules#DEFAULTS]
    public ValidityClassifier() {
        this(EligibilityRules.DEFAULTS);
    }

    /// @param rules the eligibility rules
    public ValidityClassifier(EligibilityRules rules) {
        this.rules = Objects.requireNonNull(rules, "rules cannot be null");
    }

    /// @return the rules in use
    public EligibilityRules rules() {
        return rules;
    }

    /// @param record a registry record
    /// @return whether the record may be offered as a substitute
    public boolean classify(MedicationRecord record) {
        return rules.registrationStatuses().contains(record.registrationStatus())
            && rules.cumStatuses().contains(record.cumStatus())
            && !(rules.excludeMedicalSamples() && record.medicalSample());
    }

    /// Count the eligible occurrences of each value of a column.
    ///
    /// @param values the column values, aligned with `eligible`
    /// @param eligible eligibility of each row
    /// @return the validity statistics of the column
    public CategoryValidityStats validityStats(List<String> values, boolean[] eligible) {
        if (values.size() != eligible.length) {
            throw new IllegalArgumentException(
                "values and eligibility flags differ in length: " + values.size() + " vs " + eligible.length);
        }
        Map<String, Integer> counts = new HashMap<>();
        int totalEligible = 0;
        for (int i = 0; i < eligible.length; i++) {
            if (eligible[i]) {
                String value = values.get(i);
                counts.merge(value == null ? "" : value, 1, Integer::sum);
                totalEligible++;
            }
        }
        return new CategoryValidityStats(counts, totalEligible);
    }

    /// Convenience form of [#validityStats(List, boolean[])] for a record batch.
    ///
    /// @param attribute the column to read
    /// @param records the batch
    /// @return the validity statistics of the column
    public CategoryValidityStats validityStats(CategoricalAttribute attribute, List<MedicationRecord> records) {
        boolean[] eligible = new boolean[records.size()];
        for (int i = 0; i < eligible.length; i++) {
            eligible[i] = classify(records.get(i));
        }
        return validityStats(records.stream().map(attribute::valueOf).toList(), eligible);
    }
}
