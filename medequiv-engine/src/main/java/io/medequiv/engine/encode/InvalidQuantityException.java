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

import io.medequiv.engine.EquivalenceEngineException;

/// A quantity cannot feed a logarithm or ratio.
///
/// Raised per record; the training pipeline excludes the record from the run
/// and lists it for manual review instead of failing the batch.
public class InvalidQuantityException extends EquivalenceEngineException {

    private final String field;
    private final double value;

    /// @param field the offending quantity field
    /// @param value the offending value
    /// @param reason why the value is unusable
    public InvalidQuantityException(String field, double value, String reason) {
        super(field + "=" + value + ": " + reason);
        this.field = field;
        this.value = value;
    }

    /// @return the offending quantity field
    public String field() {
        return field;
    }

    /// @return the offending value
    public double value() {
        return value;
    }
}
