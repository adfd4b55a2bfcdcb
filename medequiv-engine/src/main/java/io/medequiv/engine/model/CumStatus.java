package io.medequiv.engine.model;

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

/// Status of the individual CUM code within its registration.
public enum CumStatus {
    /// the code may be dispensed ("Activo")
    ACTIVE,
    /// the code was withdrawn ("Inactivo")
    INACTIVE,
    /// any other value
    OTHER;

    /// Parse an enum name or registry label; unrecognized labels map to [#OTHER].
    /// @param label the raw status label
    /// @return the matching status
    public static CumStatus parse(String label) {
        switch (RegistrationStatus.normalizeLabel(label)) {
            case "ACTIVE":
            case "ACTIVO":
                return ACTIVE;
            case "INACTIVE":
            case "INACTIVO":
                return INACTIVE;
            default:
                return OTHER;
        }
    }
}
