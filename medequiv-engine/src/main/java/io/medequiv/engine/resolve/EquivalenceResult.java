package io.medequiv.engine.resolve;

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/// Ranked substitutes for one query.
///
/// ## Laziness
///
/// The ranking is computed on first iteration and then cached. Iterating
/// again restarts from the best candidate. [#withTopK] returns a view with a
/// different cut-off that shares the cached ranking, so asking for more
/// results never recomputes cluster membership or distances.
///
/// ## Thread Safety
///
/// Safe to share; the ranking is computed at most once.
public final class EquivalenceResult implements Iterable<EquivalenceCandidate> {

    private final String queryCum;
    private final int label;
    private final Set<CandidateFilter> filters;
    private final double minSimilarity;
    private final int topK;
    private final Ranking ranking;

    EquivalenceResult(String queryCum, int label, Set<CandidateFilter> filters, double minSimilarity, int topK,
                      Supplier<List<EquivalenceCandidate>> ranker) {
        this(queryCum, label, filters, minSimilarity, topK, new Ranking(ranker));
    }

    private EquivalenceResult(String queryCum, int label, Set<CandidateFilter> filters, double minSimilarity,
                              int topK, Ranking ranking) {
        if (topK < 1) {
            throw new IllegalArgumentException("topK must be positive, got " + topK);
        }
        this.queryCum = queryCum;
        this.label = label;
        this.filters = filters;
        this.minSimilarity = minSimilarity;
        this.topK = topK;
        this.ranking = ranking;
    }

    /// @param topK the new cut-off
    /// @return a result over the same ranking with a different cut-off
    public EquivalenceResult withTopK(int topK) {
        return new EquivalenceResult(queryCum, label, filters, minSimilarity, topK, ranking);
    }

    @Override
    public Iterator<EquivalenceCandidate> iterator() {
        return toList().iterator();
    }

    /// @return at most [#topK()] candidates, nearest first
    public List<EquivalenceCandidate> toList() {
        List<EquivalenceCandidate> all = ranking.get();
        return Collections.unmodifiableList(all.subList(0, Math.min(topK, all.size())));
    }

    /// @return whether no candidate survived
    public boolean isEmpty() {
        return ranking.get().isEmpty();
    }

    /// @return number of candidates available before the cut-off
    public int available() {
        return ranking.get().size();
    }

    /// @return the query CUM, null for vector queries
    public String queryCum() {
        return queryCum;
    }

    /// @return the cluster label of the query
    public int label() {
        return label;
    }

    public Set<CandidateFilter> filters() {
        return filters;
    }

    /// @return the similarity cut-off, 0 when none was requested
    public double minSimilarity() {
        return minSimilarity;
    }

    public int topK() {
        return topK;
    }

    boolean ranked() {
        return ranking.ranked != null;
    }

    private static final class Ranking {
        private final Supplier<List<EquivalenceCandidate>> ranker;
        private volatile List<EquivalenceCandidate> ranked;

        private Ranking(Supplier<List<EquivalenceCandidate>> ranker) {
            this.ranker = ranker;
        }

        private List<EquivalenceCandidate> get() {
            List<EquivalenceCandidate> result = ranked;
            if (result == null) {
                synchronized (this) {
                    result = ranked;
                    if (result == null) {
                        result = Collections.unmodifiableList(new ArrayList<>(ranker.get()));
                        ranked = result;
                    }
                }
            }
            return result;
        }
    }
}
