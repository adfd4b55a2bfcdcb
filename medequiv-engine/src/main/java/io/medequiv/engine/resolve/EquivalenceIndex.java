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
import io.medequiv.engine.model.MedicationRecord;
import io.medequiv.engine.train.ExcludedRecord;
import io.medequiv.engine.train.HomologationModel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/// Read-only lookup structures over one model, built once per publication.
///
/// Cluster membership lists hold only fitted assignments, which are exactly
/// the eligible records with valid vectors.
final class EquivalenceIndex {

    private final Map<String, MedicationRecord> records;
    private final Map<String, ClusterAssignment> assignments;
    private final Map<String, ExcludedRecord> excluded;
    private final List<List<ClusterAssignment>> members;

    EquivalenceIndex(HomologationModel model) {
        Map<String, MedicationRecord> recordMap = new HashMap<>();
        for (MedicationRecord record : model.records()) {
            recordMap.put(record.cum(), record);
        }
        Map<String, ExcludedRecord> excludedMap = new HashMap<>();
        for (ExcludedRecord record : model.excluded()) {
            excludedMap.put(record.cum(), record);
        }
        int k = model.snapshot().k();
        List<List<ClusterAssignment>> byLabel = new ArrayList<>(k);
        for (int c = 0; c < k; c++) {
            byLabel.add(new ArrayList<>());
        }
        Map<String, ClusterAssignment> assignmentMap = new HashMap<>();
        for (ClusterAssignment assignment : model.snapshot().assignments()) {
            assignmentMap.put(assignment.cum(), assignment);
            if (assignment.fitted()) {
                byLabel.get(assignment.label()).add(assignment);
            }
        }
        List<List<ClusterAssignment>> frozen = new ArrayList<>(k);
        for (List<ClusterAssignment> list : byLabel) {
            list.sort(Comparator.comparing(ClusterAssignment::cum));
            frozen.add(Collections.unmodifiableList(list));
        }
        this.records = recordMap;
        this.assignments = assignmentMap;
        this.excluded = excludedMap;
        this.members = Collections.unmodifiableList(frozen);
    }

    MedicationRecord record(String cum) {
        return records.get(cum);
    }

    ClusterAssignment assignment(String cum) {
        return assignments.get(cum);
    }

    ExcludedRecord excluded(String cum) {
        return excluded.get(cum);
    }

    /// @return eligible members of the cluster, sorted by CUM
    List<ClusterAssignment> members(int label) {
        return members.get(label);
    }
}
