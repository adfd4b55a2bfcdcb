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
import io.medequiv.engine.model.RegistrationStatus;

import java.util.Locale;

/// Hard filters a caller may apply to the candidates of a query.
///
/// Each filter is a predicate over the raw attributes of a candidate,
/// independent of the clustering.
public enum CandidateFilter {
    /// registration status is ACTIVE
    REGISTRATION_ACTIVE(false),
    /// not a free medical sample
    NOT_MEDICAL_SAMPLE(false),
    /// same ATC code as the query record
    ATC_EXACT_MATCH(true),
    /// covered by the health benefits plan
    COVERAGE_IN_PBS(false);

    private final boolean needsQueryRecord;

    CandidateFilter(boolean needsQueryRecord) {
        this.needsQueryRecord = needsQueryRecord;
    }

    /// @return whether the filter compares against the query record
    public boolean needsQueryRecord() {
        return needsQueryRecord;
    }

    /// @param candidate the candidate record
    /// @param query the query record, null for vector queries
    /// @return whether the candidate passes
    public boolean test(MedicationRecord candidate, MedicationRecord query) {
        switch (this) {
            case REGISTRATION_ACTIVE:
                return candidate.registrationStatus() == RegistrationStatus.ACTIVE;
            case NOT_MEDICAL_SAMPLE:
                return !candidate.medicalSample();
            case ATC_EXACT_MATCH:
                if (query == null) {
                    throw new IllegalArgumentException("ATC_EXACT_MATCH needs a query record");
                }
                return CategoricalAttribute.ATC.valueOf(candidate).equals(CategoricalAttribute.ATC.valueOf(query));
            case COVERAGE_IN_PBS:
                return candidate.pbsCoverage();
            default:
                throw new IllegalStateException("unhandled filter " + this);
        }
    }

    /// Parse a filter name such as `atc_exact_match` or `ATC-EXACT-MATCH`.
    /// @param name the name
    /// @return the filter
    /// @throws IllegalArgumentException for an unknown name
    public static CandidateFilter parse(String name) {
        String key = name.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (CandidateFilter filter : values()) {
            if (filter.name().equals(key)) {
                return filter;
            }
        }
        throw new IllegalArgumentException("unknown filter '" + name + "'");
    }
}
