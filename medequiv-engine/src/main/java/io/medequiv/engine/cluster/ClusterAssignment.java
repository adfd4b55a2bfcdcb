package io.medequiv.engine.cluster;

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
import java.util.Objects;

/// Cluster membership of one record.
///
/// `fitted` is false for records that were labeled by prediction after the
/// fit, such as expired registrations kept only as query subjects.
public final class ClusterAssignment {

    @SerializedName("cum")
    private final String cum;

    @SerializedName("label")
    private final int label;

    @SerializedName("vector")
    private final double[] vector;

    @SerializedName("fitted")
    private final boolean fitted;

    /// @param cum record identity
    /// @param label cluster label
    /// @param vector weighted feature vector
    /// @param fitted whether the vector took part in the fit
    public ClusterAssignment(String cum, int label, double[] vector, boolean fitted) {
        this.cum = Objects.requireNonNull(cum, "cum cannot be null");
        this.label = label;
        this.vector = vector.clone();
        this.fitted = fitted;
    }

    public String cum() {
        return cum;
    }

    public int label() {
        return label;
    }

    /// @return a copy of the weighted vector
    public double[] vector() {
        return vector.clone();
    }

    /// Distance without copying the stored vector.
    /// @param other a vector of the same dimensionality
    /// @return Euclidean distance to `other`
    public double distanceTo(double[] other) {
        return VectorMath.euclidean(vector, other);
    }

    public boolean fitted() {
        return fitted;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ClusterAssignment)) {
            return false;
        }
        ClusterAssignment that = (ClusterAssignment) o;
        return label == that.label && fitted == that.fitted && cum.equals(that.cum)
            && Arrays.equals(vector, that.vector);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(cum, label, fitted) + Arrays.hashCode(vector);
    }

    @Override
    public String toString() {
        return "ClusterAssignment{cum=" + cum + ", label=" + label + ", fitted=" + fitted + "}";
    }
}
