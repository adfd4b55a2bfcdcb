package io.medequiv.engine.train;

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

/// A record left out of a training run because a numeric transform failed.
///
/// @param cum record identity
/// @param field the offending field
/// @param value the offending value
/// @param reason human readable cause
public record ExcludedRecord(
    @SerializedName("cum") String cum,
    @SerializedName("field") String field,
    @SerializedName("value") double value,
    @SerializedName("reason") String reason
) {
}
