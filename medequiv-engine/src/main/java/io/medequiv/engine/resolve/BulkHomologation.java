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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Homologates a list of CUMs against one resolver.
///
/// Each distinct, non-blank CUM yields exactly one outcome, in input order.
/// A failure for one CUM is recorded as UNRESOLVABLE and never stops the run.
public final class BulkHomologation {

    private static final Logger logger = LogManager.getLogger(BulkHomologation.class);

    private final EquivalenceResolver resolver;

    /// @param resolver the resolver to query; read once for the whole run
    public BulkHomologation(EquivalenceResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver cannot be null");
    }

    /// @param cums CUMs to homologate; blanks and repeats are skipped
    /// @param filters hard filters applied to every query
    /// @return one outcome per distinct CUM
    public List<HomologationOutcome> resolveAll(Collection<String> cums, Set<CandidateFilter> filters) {
        return resolveAll(cums, filters, EquivalenceResolver.NO_MIN_SIMILARITY);
    }

    /// @param cums CUMs to homologate; blanks and repeats are skipped
    /// @param filters hard filters applied to every query
    /// @param minSimilarity candidates scoring below this are not accepted as substitutes
    /// @return one outcome per distinct CUM
    public List<HomologationOutcome> resolveAll(Collection<String> cums, Set<CandidateFilter> filters,
                                                double minSimilarity) {
        EquivalenceResolver.checkMinSimilarity(minSimilarity);
        Set<String> distinct = new LinkedHashSet<>();
        for (String cum : cums) {
            if (cum != null && !cum.isBlank()) {
                distinct.add(cum.trim());
            }
        }
        List<HomologationOutcome> outcomes = new ArrayList<>(distinct.size());
        for (String cum : distinct) {
            outcomes.add(resolveOne(cum, filters, minSimilarity));
        }
        Map<HomologationOutcome.Status, Integer> counts = summarize(outcomes);
        logger.info("homologated {} CUMs: {}", outcomes.size(), counts);
        return outcomes;
    }

    private HomologationOutcome resolveOne(String cum, Set<CandidateFilter> filters, double minSimilarity) {
        try {
            EquivalenceResult result = resolver.query(cum, 1, filters, minSimilarity);
            List<EquivalenceCandidate> best = result.toList();
            if (best.isEmpty()) {
                return HomologationOutcome.noEquivalent(cum);
            }
            return HomologationOutcome.found(cum, best.get(0));
        } catch (UnresolvableQueryException e) {
            logger.debug("unresolvable {}: {}", cum, e.getMessage());
            return HomologationOutcome.unresolvable(cum, e.getMessage());
        }
    }

    /// @param outcomes outcomes of a run
    /// @return count of each status, every status present
    public static Map<HomologationOutcome.Status, Integer> summarize(List<HomologationOutcome> outcomes) {
        Map<HomologationOutcome.Status, Integer> counts = new EnumMap<>(HomologationOutcome.Status.class);
        for (HomologationOutcome.Status status : HomologationOutcome.Status.values()) {
            counts.put(status, 0);
        }
        for (HomologationOutcome outcome : outcomes) {
            counts.merge(outcome.status(), 1, Integer::sum);
        }
        return counts;
    }
}
