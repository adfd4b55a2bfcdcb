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

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/// Per-value counts among eligible records of one attribute column.
public final class CategoryValidityStats {

    @SerializedName("eligible_counts")
    private final Map<String, Integer> eligibleCounts;

    @SerializedName("total_eligible")
    private final int totalEligible;

    CategoryValidityStats(Map<String, Integer> eligibleCounts, int totalEligible) {
        this.eligibleCounts = Collections.unmodifiableMap(new TreeMap<>(eligibleCounts));
        this.totalEligible = totalEligible;
    }

    /// @return the number of eligible records in the batch
    public int totalEligible() {
        return totalEligible;
    }

    /// @param value a category value
    /// @return number of eligible records with this value
    public int eligibleCount(String value) {
        Integer count = eligibleCounts.get(value == null ? "" : value);
        return count == null ? 0 : count;
    }

    /// @param value a category value
    /// @return eligible records with the value over all eligible records, 0 if none
    public double probAmongValid(String value) {
        if (totalEligible == 0) {
            return 0.0d;
        }
        return (double) eligibleCount(value) / totalEligible;
    }

    /// @param value a category value
    /// @return whether at least one eligible record carries the value
    public boolean observedAmongValid(String value) {
        return eligibleCount(value) > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CategoryValidityStats)) {
            return false;
        }
        CategoryValidityStats that = (CategoryValidityStats) o;
        return totalEligible == that.totalEligible && eligibleCounts.equals(that.eligibleCounts);
    }

    @Override
    public int hashCode() {
        return 31 * eligibleCounts.hashCode() + totalEligible;
    }
}
