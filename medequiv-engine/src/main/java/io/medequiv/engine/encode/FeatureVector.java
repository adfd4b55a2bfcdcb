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

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// The weighted feature vector of one record, plus its informative metadata.
///
/// Only [#values()] takes part in distance computation.
public final class FeatureVector {

    @SerializedName("cum")
    private final String cum;

    @SerializedName("values")
    private final double[] values;

    @SerializedName("metadata")
    private final Map<String, String> metadata;

    /// @param cum the record identity
    /// @param values weighted component values, in [FeatureLayout] order
    /// @param metadata informative fields
    public FeatureVector(String cum, double[] values, Map<String, String> metadata) {
        this.cum = Objects.requireNonNull(cum, "cum cannot be null");
        this.values = Arrays.copyOf(values, values.length);
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /// @return the record identity
    public String cum() {
        return cum;
    }

    /// @return a copy of the weighted values
    public double[] values() {
        return Arrays.copyOf(values, values.length);
    }

    /// @return the informative metadata
    public Map<String, String> metadata() {
        return metadata;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FeatureVector)) {
            return false;
        }
        FeatureVector that = (FeatureVector) o;
        return cum.equals(that.cum) && Arrays.equals(values, that.values) && metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(cum, metadata) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "FeatureVector{cum=" + cum + ", values=" + Arrays.toString(values) + "}";
    }
}
