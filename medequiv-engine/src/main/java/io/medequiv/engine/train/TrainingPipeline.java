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

import io.medequiv.engine.cluster.ClusterAssignment;
import io.medequiv.engine.cluster.ClusterModel;
import io.medequiv.engine.cluster.ClusterModelSnapshot;
import io.medequiv.engine.cluster.ClusterQuality;
import io.medequiv.engine.cluster.ClusterQualityMetrics;
import io.medequiv.engine.cluster.ClusteringParameters;
import io.medequiv.engine.cluster.ElbowKSelector;
import io.medequiv.engine.cluster.KMeansClusterModel;
import io.medequiv.engine.config.EngineConfig;
import io.medequiv.engine.encode.CategoricalEncoder;
import io.medequiv.engine.encode.CategoricalFrequencyTable;
import io.medequiv.engine.encode.CategoryValidityStats;
import io.medequiv.engine.encode.EncodedFeature;
import io.medequiv.engine.encode.FeatureLayout;
import io.medequiv.engine.encode.FeatureVector;
import io.medequiv.engine.encode.InvalidQuantityException;
import io.medequiv.engine.encode.NumericTransforms;
import io.medequiv.engine.encode.RecordEncoder;
import io.medequiv.engine.encode.ValidityClassifier;
import io.medequiv.engine.encode.VectorAssembler;
import io.medequiv.engine.model.CategoricalAttribute;
import io.medequiv.engine.model.MedicationRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/// Offline batch training: records in, [HomologationModel] out.
///
/// ## Stages
///
/// ```text
/// records ──► eligibility ──► frequency + validity tables ──► raw components
///                                                                  │
///              excluded ◄── InvalidQuantityException ◄─────────────┤
///                                                                  ▼
///   model ◄── quality ◄── predict ineligible ◄── fit eligible ◄── layout + weigh
/// ```
///
/// A record whose quantity cannot be transformed is excluded and listed in
/// the model; the batch continues. Eligible records with valid vectors are
/// clustered. Ineligible records with valid vectors are labeled by
/// prediction so they can still be the subject of a query.
///
/// ## Thread Safety
///
/// [#train] and [#trainAutoK] are serialized per pipeline instance.
/// Independent pipelines share no state and may train in parallel.
public final class TrainingPipeline {

    private static final Logger logger = LogManager.getLogger(TrainingPipeline.class);

    private final EngineConfig config;
    private final ClusterModel clusterModel;

    /// Create a pipeline using K-Means
    /// @param config the configuration
    public TrainingPipeline(EngineConfig config) {
        this(config, new KMeansClusterModel());
    }

    /// @param config the configuration
    /// @param clusterModel the clustering algorithm
    public TrainingPipeline(EngineConfig config, ClusterModel clusterModel) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.clusterModel = Objects.requireNonNull(clusterModel, "clusterModel cannot be null");
    }

    public EngineConfig config() {
        return config;
    }

    /// Train with the configured `k`.
    ///
    /// @param records the batch; CUMs must be unique
    /// @return the trained model
    /// @throws IllegalArgumentException if the batch holds duplicate CUMs
    /// @throws io.medequiv.engine.cluster.InsufficientDataException if fewer vectors than `k` can be fitted
    /// @throws io.medequiv.engine.cluster.DegenerateClusterException if every restart fails
    public synchronized HomologationModel train(List<MedicationRecord> records) {
        return run(records, 0, 0);
    }

    /// Train with `k` chosen by the elbow heuristic.
    ///
    /// @param records the batch; CUMs must be unique
    /// @param kMin smallest candidate `k`
    /// @param kMax largest candidate `k`, inclusive
    /// @return the trained model
    public synchronized HomologationModel trainAutoK(List<MedicationRecord> records, int kMin, int kMax) {
        if (kMin < 1 || kMax < kMin) {
            throw new IllegalArgumentException("invalid k range " + kMin + ".." + kMax);
        }
        return run(records, kMin, kMax);
    }

    private HomologationModel run(List<MedicationRecord> records, int kMin, int kMax) {
        long started = System.nanoTime();
        requireUniqueCums(records);

        ValidityClassifier classifier = new ValidityClassifier(config.eligibilityRules());
        boolean[] eligible = new boolean[records.size()];
        int eligibleCount = 0;
        for (int i = 0; i < eligible.length; i++) {
            eligible[i] = classifier.classify(records.get(i));
            if (eligible[i]) {
                eligibleCount++;
            }
        }

        CategoricalEncoder encoder = new CategoricalEncoder(config.frequencyDivisor());
        Map<CategoricalAttribute, CategoricalFrequencyTable> tables = new EnumMap<>(CategoricalAttribute.class);
        Map<CategoricalAttribute, CategoryValidityStats> validity = new EnumMap<>(CategoricalAttribute.class);
        for (CategoricalAttribute attribute : CategoricalAttribute.values()) {
            List<String> column = records.stream().map(attribute::valueOf).toList();
            tables.put(attribute, encoder.fit(column));
            validity.put(attribute, classifier.validityStats(column, eligible));
        }

        RecordEncoder recordEncoder = new RecordEncoder(encoder, tables, validity,
            new VectorAssembler(new NumericTransforms(config.binBreakpoints())));
        List<double[]> rawRows = new ArrayList<>();
        List<Integer> validIndices = new ArrayList<>();
        List<ExcludedRecord> excluded = new ArrayList<>();
        int unknown = 0;
        for (int i = 0; i < records.size(); i++) {
            MedicationRecord record = records.get(i);
            Map<CategoricalAttribute, EncodedFeature> encoded = recordEncoder.encodeAttributes(record);
            unknown += RecordEncoder.unknownCount(encoded);
            try {
                rawRows.add(recordEncoder.rawComponents(record));
                validIndices.add(i);
            } catch (InvalidQuantityException e) {
                logger.debug("excluding {}: {}", record.cum(), e.getMessage());
                excluded.add(new ExcludedRecord(record.cum(), e.field(), e.value(), e.getMessage()));
            }
        }
        if (!excluded.isEmpty()) {
            logger.warn("excluded {} of {} records with invalid quantities", excluded.size(), records.size());
        }

        FeatureLayout layout = FeatureLayout.fit(VectorAssembler.COMPONENTS, rawRows,
            config.criticalWeight(), config.importantWeight());
        List<FeatureVector> fitVectors = new ArrayList<>();
        List<FeatureVector> predictVectors = new ArrayList<>();
        for (int j = 0; j < validIndices.size(); j++) {
            MedicationRecord record = records.get(validIndices.get(j));
            FeatureVector vector = new FeatureVector(record.cum(), layout.weigh(rawRows.get(j)),
                VectorAssembler.informative(record));
            if (eligible[validIndices.get(j)]) {
                fitVectors.add(vector);
            } else {
                predictVectors.add(vector);
            }
        }

        ClusteringParameters parameters = config.clusteringParameters();
        List<Integer> candidates = List.of();
        List<Double> inertias = List.of();
        if (kMax > 0) {
            ElbowKSelector.Selection selection =
                new ElbowKSelector(clusterModel).select(fitVectors, kMin, kMax, parameters);
            parameters = parameters.withK(selection.k());
            candidates = selection.candidates();
            inertias = selection.inertias();
        }

        logger.info("fitting {} with k={} over {} eligible vectors", clusterModel.name(), parameters.k(),
            fitVectors.size());
        ClusterModelSnapshot snapshot = clusterModel.fit(fitVectors, parameters);

        List<ClusterAssignment> predicted = new ArrayList<>(predictVectors.size());
        for (FeatureVector vector : predictVectors) {
            double[] values = vector.values();
            predicted.add(new ClusterAssignment(vector.cum(), snapshot.predict(values), values, false));
        }
        snapshot = snapshot.withPredicted(predicted);

        ClusterQuality quality = new ClusterQualityMetrics(config.silhouetteSampleLimit(), config.seed())
            .evaluate(snapshot);
        snapshot = snapshot.toBuilder().quality(quality).build();

        long duration = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        TrainingReport report = new TrainingReport(records.size(), eligibleCount, fitVectors.size(),
            predicted.size(), excluded.size(), unknown, parameters.k(), candidates, inertias, snapshot.inertia(),
            snapshot.iterations(), snapshot.converged(), snapshot.failedRestarts(), quality, duration);
        logger.info("training finished in {} ms: {} fitted, {} predicted, {} excluded, silhouette {}",
            duration, fitVectors.size(), predicted.size(), excluded.size(), quality.silhouette());

        EngineConfig effective = config.toBuilder().k(parameters.k()).build();
        return new HomologationModel(Instant.now().toString(), effective, tables, validity, layout, snapshot,
            records, excluded, report);
    }

    private static void requireUniqueCums(List<MedicationRecord> records) {
        Set<String> seen = new HashSet<>();
        for (MedicationRecord record : records) {
            if (!seen.add(record.cum())) {
                throw new IllegalArgumentException("duplicate CUM in batch: " + record.cum());
            }
        }
    }
}
