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

import java.util.function.Function;

/// The categorical columns of a [MedicationRecord] that are frequency encoded.
public enum CategoricalAttribute {

    ATC(MedicationRecord::atcCode),
    ROUTE(MedicationRecord::route),
    ACTIVE_INGREDIENT(MedicationRecord::activeIngredient),
    PHARMACEUTICAL_FORM(MedicationRecord::pharmaceuticalForm),
    MEASUREMENT_UNIT(MedicationRecord::measurementUnit);

    private final Function<MedicationRecord, String> accessor;

    CategoricalAttribute(Function<MedicationRecord, String> accessor) {
        this.accessor = accessor;
    }

    /// Read this attribute from a record; null is read as the empty category.
    /// @param record the record
    /// @return the raw category value, never null
    public String valueOf(MedicationRecord record) {
        String value = accessor.apply(record);
        return value == null ? "" : value;
    }
}
