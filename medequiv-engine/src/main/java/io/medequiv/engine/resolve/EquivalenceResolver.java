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

import io.medequiv.engine.cluster.ClusterAssignment;
import io.medequiv.engine.encode.CategoricalEncoder;
import io.medequiv.engine.encode.CategoricalFrequencyTable;
import io.medequiv.engine.encode.CategoryValidityStats;
import io.medequiv.engine.encode.FeatureVector;
import io.medequiv.engine.encode.InvalidQuantityException;
import io.medequiv.engine.encode.NumericTransforms;
import io.medequiv.engine.encode.RecordEncoder;
import io.medequiv.engine.encode.VectorAssembler;
import io.medequiv.engine.model.CategoricalAttribute;
import io.medequiv.engine.model.MedicationRecord;
import io.medequiv.engine.train.ExcludedRecord;
import io.medequiv.engine.train.HomologationModel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Answers "which eligible records can substitute this one" against one model.
///
/// ## Query steps
///
/// 1. Find the cluster label of the subject: its recorded assignment for a
///    known CUM, or [io.medequiv.engine.cluster.ClusterModelSnapshot#predict]
///    for an ad-hoc vector or record.
/// 2. Take the eligible members of that cluster, minus the subject itself.
/// 3. Keep the candidates passing every requested [CandidateFilter].
/// 4. Score each survivor with [SimilarityScorer] when the subject is a
///    record, and drop those below the requested minimum similarity.
/// 5. Order by ascending Euclidean distance to the subject, ties by CUM.
/// 6. Return the first `topK`.
///
/// Steps 2 to 6 run lazily, on first iteration of the [EquivalenceResult].
///
/// ## Thread Safety
///
/// Immutable after construction; any number of threads may query.
public final class EquivalenceResolver {

    private static final Logger logger = LogManager.getLogger(EquivalenceResolver.class);

    /// Minimum similarity that keeps every candidate.
    public static final double NO_MIN_SIMILARITY = 0.0d;

    private static final Comparator<EquivalenceCandidate> CANDIDATE_ORDER =
        Comparator.comparingDouble(EquivalenceCandidate::distance).thenComparing(EquivalenceCandidate::cum);

    private final HomologationModel model;
    private final EquivalenceIndex index;
    private final RecordEncoder recordEncoder;
    private final SimilarityScorer scorer = new SimilarityScorer();

    /// @param model the trained model
    public EquivalenceResolver(HomologationModel model) {
        this.model = Objects.requireNonNull(model, "model cannot be null");
        this.index = new EquivalenceIndex(model);
        Map<CategoricalAttribute, CategoricalFrequencyTable> tables = new EnumMap<>(CategoricalAttribute.class);
        Map<CategoricalAttribute, CategoryValidityStats> validity = new EnumMap<>(CategoricalAttribute.class);
        for (CategoricalAttribute attribute : CategoricalAttribute.values()) {
            tables.put(attribute, model.frequencyTable(attribute));
            validity.put(attribute, model.validityStats(attribute));
        }
        this.recordEncoder = new RecordEncoder(new CategoricalEncoder(model.config().frequencyDivisor()), tables,
            validity, new VectorAssembler(new NumericTransforms(model.config().binBreakpoints())));
    }

    /// @return the model this resolver answers from
    public HomologationModel model() {
        return model;
    }

    /// Query with the configured default `topK` and no filters.
    /// @param cum a CUM of the training batch
    /// @return the ranked substitutes
    public EquivalenceResult query(String cum) {
        return query(cum, model.config().defaultTopK(), Set.of());
    }

    /// @param cum a CUM of the training batch
    /// @param topK maximum number of substitutes
    /// @param filters hard filters, may be empty
    /// @return the ranked substitutes
    /// @throws UnresolvableQueryException if the CUM is unknown or was excluded from training
    public EquivalenceResult query(String cum, int topK, Set<CandidateFilter> filters) {
        return query(cum, topK, filters, NO_MIN_SIMILARITY);
    }

    /// @param cum a CUM of the training batch
    /// @param topK maximum number of substitutes
    /// @param filters hard filters, may be empty
    /// @param minSimilarity candidates scoring below this are dropped after the filters
    /// @return the ranked substitutes
    /// @throws UnresolvableQueryException if the CUM is unknown or was excluded from training
    public EquivalenceResult query(String cum, int topK, Set<CandidateFilter> filters, double minSimilarity) {
        Set<CandidateFilter> active = copy(filters);
        checkMinSimilarity(minSimilarity);
        MedicationRecord subject = index.record(cum);
        if (subject == null) {
            throw new UnresolvableQueryException(cum, "unknown CUM");
        }
        ExcludedRecord excluded = index.excluded(cum);
        if (excluded != null) {
            throw new UnresolvableQueryException(cum, "excluded from training: " + excluded.reason());
        }
        ClusterAssignment assignment = index.assignment(cum);
        if (assignment == null) {
            throw new UnresolvableQueryException(cum, "no cluster assignment");
        }
        double[] vector = assignment.vector();
        return result(cum, subject, vector, assignment.label(), topK, active, minSimilarity);
    }

    /// Query with an ad-hoc weighted vector.
    ///
    /// @param vector a vector in the model's weighted space
    /// @param topK maximum number of substitutes
    /// @param filters hard filters; [CandidateFilter#ATC_EXACT_MATCH] is not allowed
    /// @return the ranked substitutes
    public EquivalenceResult query(double[] vector, int topK, Set<CandidateFilter> filters) {
        Set<CandidateFilter> active = copy(filters);
        for (CandidateFilter filter : active) {
            if (filter.needsQueryRecord()) {
                throw new IllegalArgumentException(filter + " cannot be applied to a vector query");
            }
        }
        double[] copy = vector.clone();
        return result(null, null, copy, model.snapshot().predict(copy), topK, active, NO_MIN_SIMILARITY);
    }

    /// Query with a record that need not be part of the training batch.
    ///
    /// The record is encoded with the model's tables; unseen categories take
    /// the sentinel score.
    ///
    /// @param record the subject record
    /// @param topK maximum number of substitutes
    /// @param filters hard filters, may be empty
    /// @return the ranked substitutes
    /// @throws UnresolvableQueryException if the record's quantities cannot be transformed
    public EquivalenceResult query(MedicationRecord record, int topK, Set<CandidateFilter> filters) {
        return query(record, topK, filters, NO_MIN_SIMILARITY);
    }

    /// @param record the subject record
    /// @param topK maximum number of substitutes
    /// @param filters hard filters, may be empty
    /// @param minSimilarity candidates scoring below this are dropped after the filters
    /// @return the ranked substitutes
    /// @throws UnresolvableQueryException if the record's quantities cannot be transformed
    public EquivalenceResult query(MedicationRecord record, int topK, Set<CandidateFilter> filters,
                                   double minSimilarity) {
        Set<CandidateFilter> active = copy(filters);
        checkMinSimilarity(minSimilarity);
        FeatureVector vector;
        try {
            vector = recordEncoder.vector(record, model.layout());
        } catch (InvalidQuantityException e) {
            throw new UnresolvableQueryException(record.cum(), e.getMessage(), e);
        }
        int unknown = RecordEncoder.unknownCount(recordEncoder.encodeAttributes(record));
        if (unknown > 0) {
            logger.debug("query record {} has {} unknown categories", record.cum(), unknown);
        }
        double[] values = vector.values();
        return result(record.cum(), record, values, model.snapshot().predict(values), topK, active, minSimilarity);
    }

    private EquivalenceResult result(String cum, MedicationRecord subject, double[] vector, int label, int topK,
                                     Set<CandidateFilter> filters, double minSimilarity) {
        if (topK < 1) {
            throw new IllegalArgumentException("topK must be positive, got " + topK);
        }
        return new EquivalenceResult(cum, label, filters, minSimilarity, topK,
            () -> rank(cum, subject, vector, label, filters, minSimilarity));
    }

    private List<EquivalenceCandidate> rank(String cum, MedicationRecord subject, double[] vector, int label,
                                            Set<CandidateFilter> filters, double minSimilarity) {
        List<EquivalenceCandidate> candidates = new ArrayList<>();
        for (ClusterAssignment member : index.members(label)) {
            if (member.cum().equals(cum)) {
                continue;
            }
            MedicationRecord candidate = index.record(member.cum());
            if (!passes(candidate, subject, filters)) {
                continue;
            }
            SimilarityScore similarity = subject == null ? null : scorer.score(subject, candidate);
            if (similarity != null && similarity.total() < minSimilarity) {
                continue;
            }
            candidates.add(new EquivalenceCandidate(member.cum(), candidate.productName(),
                member.distanceTo(vector), label, similarity));
        }
        candidates.sort(CANDIDATE_ORDER);
        logger.debug("query {} in cluster {}: {} candidates after filters {} and min similarity {}", cum, label,
            candidates.size(), filters, minSimilarity);
        return candidates;
    }

    static void checkMinSimilarity(double minSimilarity) {
        if (!(minSimilarity >= 0.0d) || minSimilarity > SimilarityScorer.MAX_SCORE) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, "minSimilarity must be in [0, %.2f], got %s",
                SimilarityScorer.MAX_SCORE, minSimilarity));
        }
    }

    private static boolean passes(MedicationRecord candidate, MedicationRecord subject, Set<CandidateFilter> filters) {
        for (CandidateFilter filter : filters) {
            if (!filter.test(candidate, subject)) {
                return false;
            }
        }
        return true;
    }

    private static Set<CandidateFilter> copy(Set<CandidateFilter> filters) {
        if (filters == null || filters.isEmpty()) {
            return Collections.unmodifiableSet(EnumSet.noneOf(CandidateFilter.class));
        }
        return Collections.unmodifiableSet(EnumSet.copyOf(filters));
    }
}
