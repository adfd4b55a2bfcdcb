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

/// Encoding of one attribute value of one record.
///
/// @param score adjusted frequency score, meaningful only within its batch
/// @param knownCategory false when the value was absent from the frequency table
/// @param probAmongValid share of eligible records carrying this value
public record EncodedFeature(double score, boolean knownCategory, double probAmongValid) {

    /// @return 1 when the value occurs among eligible records, else 0
    public double validIndicator() {
        return probAmongValid > 0.0d ? 1.0d : 0.0d;
    }
}
