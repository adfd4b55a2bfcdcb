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
import io.medequiv.engine.cluster.ClusterModelSnapshot;
import io.medequiv.engine.config.EngineConfig;
import io.medequiv.engine.encode.CategoricalFrequencyTable;
import io.medequiv.engine.encode.CategoryValidityStats;
import io.medequiv.engine.encode.FeatureLayout;
import io.medequiv.engine.model.CategoricalAttribute;
import io.medequiv.engine.model.MedicationRecord;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// The complete artifact of one training run.
///
/// Everything needed to answer queries travels together: the configuration
/// used, the frequency and validity tables of every attribute, the fitted
/// feature layout, the cluster snapshot, the records of the batch and the
/// records excluded from it. A model is immutable once built.
public final class HomologationModel {

    @SerializedName("trained_at")
    private final String trainedAt;

    @SerializedName("config")
    private final EngineConfig config;

    @SerializedName("frequency_tables")
    private final Map<CategoricalAttribute, CategoricalFrequencyTable> frequencyTables;

    @SerializedName("validity_stats")
    private final Map<CategoricalAttribute, CategoryValidityStats> validityStats;

    @SerializedName("layout")
    private final FeatureLayout layout;

    @SerializedName("snapshot")
    private final ClusterModelSnapshot snapshot;

    @SerializedName("records")
    private final List<MedicationRecord> records;

    @SerializedName("excluded")
    private final List<ExcludedRecord> excluded;

    @SerializedName("report")
    private final TrainingReport report;

    /// @param trainedAt ISO-8601 instant the run finished
    /// @param config effective configuration, with the chosen `k`
    /// @param frequencyTables one table per attribute
    /// @param validityStats one validity table per attribute
    /// @param layout fitted feature layout
    /// @param snapshot cluster snapshot
    /// @param records every record of the batch
    /// @param excluded records with failed transforms
    /// @param report run summary
    public HomologationModel(String trainedAt, EngineConfig config,
                             Map<CategoricalAttribute, CategoricalFrequencyTable> frequencyTables,
                             Map<CategoricalAttribute, CategoryValidityStats> validityStats,
                             FeatureLayout layout, ClusterModelSnapshot snapshot, List<MedicationRecord> records,
                             List<ExcludedRecord> excluded, TrainingReport report) {
        this.trainedAt = trainedAt;
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.frequencyTables = Collections.unmodifiableMap(new LinkedHashMap<>(new EnumMap<>(frequencyTables)));
        this.validityStats = Collections.unmodifiableMap(new LinkedHashMap<>(new EnumMap<>(validityStats)));
        this.layout = Objects.requireNonNull(layout, "layout cannot be null");
        this.snapshot = Objects.requireNonNull(snapshot, "snapshot cannot be null");
        this.records = List.copyOf(records);
        this.excluded = List.copyOf(excluded);
        this.report = report;
        for (CategoricalAttribute attribute : CategoricalAttribute.values()) {
            if (!this.frequencyTables.containsKey(attribute) || !this.validityStats.containsKey(attribute)) {
                throw new IllegalArgumentException("missing tables for attribute " + attribute);
            }
        }
    }

    public String trainedAt() {
        return trainedAt;
    }

    public EngineConfig config() {
        return config;
    }

    /// @param attribute an attribute
    /// @return its frequency table
    public CategoricalFrequencyTable frequencyTable(CategoricalAttribute attribute) {
        return frequencyTables.get(attribute);
    }

    /// @param attribute an attribute
    /// @return its validity statistics
    public CategoryValidityStats validityStats(CategoricalAttribute attribute) {
        return validityStats.get(attribute);
    }

    public FeatureLayout layout() {
        return layout;
    }

    public ClusterModelSnapshot snapshot() {
        return snapshot;
    }

    public List<MedicationRecord> records() {
        return Collections.unmodifiableList(records);
    }

    public List<ExcludedRecord> excluded() {
        return Collections.unmodifiableList(excluded);
    }

    public TrainingReport report() {
        return report;
    }

    @Override
    public String toString() {
        return "HomologationModel{trainedAt=" + trainedAt + ", records=" + records.size()
            + ", excluded=" + excluded.size() + ", snapshot=" + snapshot + "}";
    }
}
