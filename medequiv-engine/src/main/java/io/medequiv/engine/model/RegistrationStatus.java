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

import java.text.Normalizer;
import java.util.Locale;

/// Sanitary registration status of a product, as published by the regulator.
public enum RegistrationStatus {

    /// registration in force ("Vigente")
    ACTIVE,
    /// registration lapsed ("Vencido")
    EXPIRED,
    /// renewal filed and pending ("En tramite renovacion")
    IN_RENEWAL,
    /// any other regulator status
    OTHER;

    /// Parse either an enum name or a registry label.
    ///
    /// Matching ignores case, accents and surrounding whitespace. Blank or
    /// unrecognized labels map to [#OTHER].
    ///
    /// @param label the raw status label
    /// @return the matching status
    public static RegistrationStatus parse(String label) {
        String key = normalizeLabel(label);
        if (key.isEmpty()) {
            return OTHER;
        }
        switch (key) {
            case "ACTIVE":
            case "VIGENTE":
                return ACTIVE;
            case "EXPIRED":
            case "VENCIDO":
                return EXPIRED;
            case "IN_RENEWAL":
            case "EN TRAMITE RENOV":
            case "EN TRAMITE RENOVACION":
            case "EN TRAMITE DE RENOVACION":
                return IN_RENEWAL;
            default:
                return OTHER;
        }
    }

    /// Upper-case, strip accents and collapse whitespace.
    /// @param label a raw label, possibly null
    /// @return the normalized key, never null
    static String normalizeLabel(String label) {
        if (label == null) {
            return "";
        }
        String stripped = Normalizer.normalize(label.trim(), Normalizer.Form.NFD)
            .replaceAll("\\p{M}", "");
        return stripped.replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
    }
}
