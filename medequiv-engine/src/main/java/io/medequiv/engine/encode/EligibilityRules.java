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

import com.google.gson.annotations.SerializedName;
import io.medequiv.engine.model.CumStatus;
import io.medequiv.engine.model.RegistrationStatus;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/// Regulatory rules deciding whether a record may be offered as a substitute.
///
/// @param registrationStatuses accepted registration statuses
/// @param cumStatuses accepted CUM statuses
/// @param excludeMedicalSamples whether free medical samples are ineligible
public record EligibilityRules(
    @SerializedName("registration_statuses") Set<RegistrationStatus> registrationStatuses,
    @SerializedName("cum_statuses") Set<CumStatus> cumStatuses,
    @SerializedName("exclude_medical_samples") boolean excludeMedicalSamples
) {

    /// Active or in-renewal registration, active CUM, not a sample.
    public static final EligibilityRules DEFAULTS = new EligibilityRules(
        EnumSet.of(RegistrationStatus.ACTIVE, RegistrationStatus.IN_RENEWAL),
        EnumSet.of(CumStatus.ACTIVE),
        true);

    public EligibilityRules {
        if (registrationStatuses == null || registrationStatuses.isEmpty()) {
            throw new IllegalArgumentException("at least one registration status must be accepted");
        }
        if (cumStatuses == null || cumStatuses.isEmpty()) {
            throw new IllegalArgumentException("at least one CUM status must be accepted");
        }
        registrationStatuses = Collections.unmodifiableSet(EnumSet.copyOf(registrationStatuses));
        cumStatuses = Collections.unmodifiableSet(EnumSet.copyOf(cumStatuses));
    }
}
