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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Frequency table of one categorical attribute over one training batch.
///
/// ## Invariants
///
/// - every rank is a strictly positive integer
/// - `count(a) > count(b)` implies `rank(a) < rank(b)`
/// - equal counts share the same rank
/// - rank 1 is held by the most frequent value(s)
///
/// Ranks follow competition ranking: counts `{700, 300, 300, 10}` produce
/// ranks `{1, 2, 2, 4}`.
///
/// Tables are immutable values produced by [CategoricalEncoder#fit]. Scores
/// derived from a table are only comparable with other scores from the same
/// table.
public final class CategoricalFrequencyTable {

    /// Orders entries by descending count, then by raw value.
    public static final Comparator<Entry> ENTRY_ORDER =
        Comparator.comparingInt(Entry::count).reversed().thenComparing(Entry::value);

    @SerializedName("frequency_divisor")
    private final int frequencyDivisor;

    @SerializedName("max_rank")
    private final int maxRank;

    @SerializedName("total_count")
    private final long totalCount;

    @SerializedName("entries")
    private final Map<String, Entry> entries;

    CategoricalFrequencyTable(int frequencyDivisor, List<Entry> sortedEntries) {
        this.frequencyDivisor = frequencyDivisor;
        Map<String, Entry> byValue = new LinkedHashMap<>();
        int max = 0;
        long total = 0;
        for (Entry entry : sortedEntries) {
            byValue.put(entry.value(), entry);
            max = Math.max(max, entry.rank());
            total += entry.count();
        }
        this.entries = Collections.unmodifiableMap(byValue);
        this.maxRank = max;
        this.totalCount = total;
    }

    /// @return the divisor applied to counts in the fractional score term
    public int frequencyDivisor() {
        return frequencyDivisor;
    }

    /// @return the largest rank in the table, 0 for an empty table
    public int maxRank() {
        return maxRank;
    }

    /// @return the score given to values absent from the table
    public double sentinelScore() {
        return maxRank + 1;
    }

    /// @return the number of observations the table was built from
    public long totalCount() {
        return totalCount;
    }

    /// @return number of distinct values
    public int size() {
        return entries.size();
    }

    /// @param value a category value
    /// @return whether the value was observed in the batch
    public boolean contains(String value) {
        return entries.containsKey(value);
    }

    /// @param value a category value
    /// @return the entry for the value, or null if it was never observed
    public Entry entry(String value) {
        return entries.get(value);
    }

    /// @param value a category value
    /// @return the occurrence count, 0 for unseen values
    public int count(String value) {
        Entry entry = entries.get(value);
        return entry == null ? 0 : entry.count();
    }

    /// @return all entries, by descending count then ascending value
    public List<Entry> entries() {
        List<Entry> sorted = new ArrayList<>(entries.values());
        sorted.sort(ENTRY_ORDER);
        return sorted;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CategoricalFrequencyTable)) {
            return false;
        }
        CategoricalFrequencyTable that = (CategoricalFrequencyTable) o;
        return frequencyDivisor == that.frequencyDivisor && entries.equals(that.entries);
    }

    @Override
    public int hashCode() {
        return Objects.hash(frequencyDivisor, entries);
    }

    @Override
    public String toString() {
        return "CategoricalFrequencyTable{size=" + entries.size() + ", maxRank=" + maxRank + "}";
    }

    /// One distinct category value.
    /// @param value the raw value
    /// @param rank the competition rank by descending count
    /// @param count the number of occurrences in the batch
    public record Entry(
        @SerializedName("value") String value,
        @SerializedName("rank") int rank,
        @SerializedName("count") int count
    ) {
    }
}
