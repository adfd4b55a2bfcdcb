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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Adjusted frequency ranking of categorical values.
///
/// ## Algorithm
///
/// ```
/// rank(x)  = 1 + |{ y : count(y) > count(x) }|
/// score(x) = rank(x) + count(x) / divisor
/// ```
///
/// The rank keeps the ordinal "commonness" of a value. The fractional term
/// separates values that share a rank only when their counts differ, and can
/// never reorder values across ranks as long as every count is below the
/// divisor (10000 by default). A batch that violates this bound is rejected;
/// callers re-scale by choosing a larger divisor.
///
/// ## Example
///
/// ```text
/// ORAL     x700  -> rank 1, score 1.07
/// TOPICA   x300  -> rank 2, score 2.03
/// INHALADA x300  -> rank 2, score 2.03
/// ```
///
/// Values that were never observed encode to the sentinel `maxRank + 1` and
/// are reported as unknown; they never raise an error.
///
/// ## Thread Safety
///
/// The encoder holds no per-batch state: [#fit] returns the table and every
/// encode call takes it as an argument. Instances can be shared freely.
public final class CategoricalEncoder {

    private static final Logger logger = LogManager.getLogger(CategoricalEncoder.class);

    /// Default divisor of the fractional count term
    public static final int DEFAULT_FREQUENCY_DIVISOR = 10_000;

    private final int frequencyDivisor;

    /// Create an encoder with the default divisor
    public CategoricalEncoder() {
        this(DEFAULT_FREQUENCY_DIVISOR);
    }

    /// Create an encoder with a custom divisor
    /// @param frequencyDivisor divisor of the fractional count term, must exceed every count
    public CategoricalEncoder(int frequencyDivisor) {
        if (frequencyDivisor < 2) {
            throw new IllegalArgumentException("frequencyDivisor must be at least 2, got " + frequencyDivisor);
        }
        this.frequencyDivisor = frequencyDivisor;
    }

    /// @return the divisor of the fractional count term
    public int frequencyDivisor() {
        return frequencyDivisor;
    }

    /// Build the frequency table of one attribute column.
    ///
    /// @param values every value of the column in the training batch, nulls read as ""
    /// @return the frequency table
    /// @throws FrequencyDivisorException if any value occurs `frequencyDivisor` times or more
    public CategoricalFrequencyTable fit(Collection<String> values) {
        Objects.requireNonNull(values, "values cannot be null");

        Map<String, Integer> counts = new HashMap<>();
        for (String value : values) {
            counts.merge(value == null ? "" : value, 1, Integer::sum);
        }

        List<CategoricalFrequencyTable.Entry> unranked = new ArrayList<>(counts.size());
        for (Map.Entry<String, Integer> e : counts.entrySet()) {
            if (e.getValue() >= frequencyDivisor) {
                throw new FrequencyDivisorException(e.getKey(), e.getValue(), frequencyDivisor);
            }
            unranked.add(new CategoricalFrequencyTable.Entry(e.getKey(), 0, e.getValue()));
        }
        unranked.sort(CategoricalFrequencyTable.ENTRY_ORDER);

        // competition ranking over the count-descending order
        List<CategoricalFrequencyTable.Entry> ranked = new ArrayList<>(unranked.size());
        int rank = 0;
        int previousCount = -1;
        for (int i = 0; i < unranked.size(); i++) {
            CategoricalFrequencyTable.Entry entry = unranked.get(i);
            if (entry.count() != previousCount) {
                rank = i + 1;
                previousCount = entry.count();
            }
            ranked.add(new CategoricalFrequencyTable.Entry(entry.value(), rank, entry.count()));
        }

        CategoricalFrequencyTable table = new CategoricalFrequencyTable(frequencyDivisor, ranked);
        logger.debug("fitted frequency table: {} distinct values over {} observations, max rank {}",
            table.size(), table.totalCount(), table.maxRank());
        return table;
    }

    /// Score one value against a table.
    ///
    /// @param value the category value, null reads as ""
    /// @param table the table fitted on the same batch
    /// @return `rank + count / divisor`, or the sentinel for unseen values
    public double encode(String value, CategoricalFrequencyTable table) {
        CategoricalFrequencyTable.Entry entry = table.entry(value == null ? "" : value);
        if (entry == null) {
            return table.sentinelScore();
        }
        return entry.rank() + (double) entry.count() / table.frequencyDivisor();
    }

    /// Encode one value with its auxiliary outputs.
    ///
    /// @param value the category value, null reads as ""
    /// @param table the table fitted on the batch
    /// @param validity eligible-record statistics of the same batch
    /// @return the encoded feature
    public EncodedFeature encodeFeature(String value, CategoricalFrequencyTable table, CategoryValidityStats validity) {
        String key = value == null ? "" : value;
        boolean known = table.contains(key);
        if (!known) {
            logger.debug("unknown category '{}', using sentinel score {}", key, table.sentinelScore());
        }
        return new EncodedFeature(encode(key, table), known, validity.probAmongValid(key));
    }
}
