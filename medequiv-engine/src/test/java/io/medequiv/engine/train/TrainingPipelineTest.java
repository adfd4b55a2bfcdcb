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

import io.medequiv.engine.RegistryFixtures;
import io.medequiv.engine.cluster.ClusterAssignment;
import io.medequiv.engine.cluster.InsufficientDataException;
import io.medequiv.engine.config.InvalidConfigurationException;
import io.medequiv.engine.encode.FrequencyDivisorException;
import io.medequiv.engine.model.CategoricalAttribute;
import io.medequiv.engine.model.MedicationRecord;
import io.medequiv.engine.resolve.EquivalenceCandidate;
import io.medequiv.engine.resolve.EquivalenceResolver;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class TrainingPipelineTest {

    private static HomologationModel model;

    @BeforeAll
    static void train() {
        model = new TrainingPipeline(RegistryFixtures.config()).train(RegistryFixtures.registry());
    }

    private static int label(String cum) {
        return model.snapshot().assignmentsByCum().get(cum).label();
    }

    @Test
    void testReportCounts() {
        TrainingReport report = model.report();
        assertEquals(27, report.totalRecords());
        assertEquals(25, report.eligibleRecords());
        assertEquals(24, report.fittedRecords());
        assertEquals(2, report.predictedRecords());
        assertEquals(1, report.excludedRecords());
        assertEquals(0, report.unknownCategories());
        assertEquals(5, report.k());
        assertTrue(report.kCandidates().isEmpty());
        assertTrue(report.converged());
        assertTrue(report.quality().silhouette() > 0.5);
    }

    @Test
    void testInvalidQuantityIsExcluded() {
        assertEquals(1, model.excluded().size());
        ExcludedRecord excluded = model.excluded().get(0);
        assertEquals("G3-BAD", excluded.cum());
        assertEquals("quantity", excluded.field());
        assertEquals(0.0, excluded.value());
        assertFalse(model.snapshot().assignmentsByCum().containsKey("G3-BAD"));
        // still counted in the frequency tables
        assertEquals(6, model.frequencyTable(CategoricalAttribute.ATC).count("R03AC02"));
    }

    @Test
    void testGroupsBecomeClusters() {
        Map<String, ClusterAssignment> byCum = model.snapshot().assignmentsByCum();
        Map<String, Set<Integer>> labelsByGroup = byCum.values().stream().collect(Collectors.groupingBy(
            a -> a.cum().substring(0, 2), Collectors.mapping(ClusterAssignment::label, Collectors.toSet())));

        assertEquals(RegistryFixtures.GROUPS, labelsByGroup.size());
        Set<Integer> distinct = new HashSet<>();
        for (Set<Integer> labels : labelsByGroup.values()) {
            assertEquals(1, labels.size());
            distinct.addAll(labels);
        }
        assertEquals(RegistryFixtures.GROUPS, distinct.size());
    }

    @Test
    void testIneligibleRecordsArePredictedNotFitted() {
        ClusterAssignment expired = model.snapshot().assignmentsByCum().get("G1-EXP");
        ClusterAssignment sample = model.snapshot().assignmentsByCum().get("G2-MS");
        assertFalse(expired.fitted());
        assertFalse(sample.fitted());
        assertEquals(label("G1-01"), expired.label());
        assertEquals(label("G2-01"), sample.label());
        assertTrue(model.snapshot().assignmentsByCum().get("G1-06").fitted());

        int fittedTotal = 0;
        for (int size : model.snapshot().clusterSizes()) {
            assertTrue(size > 0);
            fittedTotal += size;
        }
        assertEquals(24, fittedTotal);
    }

    @Test
    void testEffectiveConfigAndTables() {
        assertEquals(5, model.config().k());
        assertEquals(17, model.layout().dimensions());
        assertEquals(27, model.records().size());
        assertEquals(6, model.validityStats(CategoricalAttribute.ROUTE).eligibleCount("INHALADA"));
        assertEquals(27, model.frequencyTable(CategoricalAttribute.ROUTE).totalCount());
        assertNotNull(model.trainedAt());
        assertNotNull(model.snapshot().quality());
    }

    @Test
    void testRetrainingIsIdempotent() {
        HomologationModel again = new TrainingPipeline(RegistryFixtures.config()).train(RegistryFixtures.registry());
        assertEquals(model.snapshot().assignments(), again.snapshot().assignments());
        assertEquals(model.snapshot().inertia(), again.snapshot().inertia());
        assertNotEquals(model.snapshot().generation(), again.snapshot().generation());
    }

    @Test
    void testDuplicateCumIsRejected() {
        List<MedicationRecord> records = new ArrayList<>(RegistryFixtures.registry());
        records.add(RegistryFixtures.amoxicillin("G1-01").build());
        assertThrows(IllegalArgumentException.class, () -> new TrainingPipeline(RegistryFixtures.config()).train(records));
    }

    @Test
    void testCommonRouteOverflowingTheDivisorIsAConfigurationError() {
        TrainingPipeline pipeline = new TrainingPipeline(RegistryFixtures.config().toBuilder().frequencyDivisor(10).build());
        FrequencyDivisorException e = assertThrows(FrequencyDivisorException.class,
            () -> pipeline.train(RegistryFixtures.registry()));
        assertInstanceOf(InvalidConfigurationException.class, e);
        assertEquals(10, e.divisor());
        assertTrue(e.count() >= 10);
    }

    @Test
    void testTooFewEligibleRecords() {
        List<MedicationRecord> records = RegistryFixtures.registry().subList(0, 3);
        assertThrows(InsufficientDataException.class,
            () -> new TrainingPipeline(RegistryFixtures.config()).train(records));
    }

    @Test
    void testAutoK() {
        HomologationModel auto = new TrainingPipeline(RegistryFixtures.config())
            .trainAutoK(RegistryFixtures.registry(), 2, 6);
        TrainingReport report = auto.report();

        assertThat(report.kCandidates()).containsExactly(2, 3, 4, 5, 6);
        assertEquals(5, report.kInertias().size());
        assertTrue(report.kCandidates().contains(report.k()));
        assertEquals(report.k(), auto.config().k());
        assertEquals(report.k(), auto.snapshot().k());

        assertThrows(IllegalArgumentException.class,
            () -> new TrainingPipeline(RegistryFixtures.config()).trainAutoK(RegistryFixtures.registry(), 4, 3));
    }

    @Test
    void testInformativeFieldsDoNotMoveAnything() {
        List<MedicationRecord> renamed = new ArrayList<>();
        for (MedicationRecord record : RegistryFixtures.registry()) {
            renamed.add(record.toBuilder()
                .productName("RENAMED " + record.cum())
                .atcDescription("OTHER DESCRIPTION")
                .expirationDate(LocalDate.of(2031, 1, 1))
                .build());
        }
        HomologationModel other = new TrainingPipeline(RegistryFixtures.config()).train(renamed);

        Map<String, ClusterAssignment> before = model.snapshot().assignmentsByCum();
        Map<String, ClusterAssignment> after = other.snapshot().assignmentsByCum();
        assertEquals(before.keySet(), after.keySet());
        for (Map.Entry<String, ClusterAssignment> entry : before.entrySet()) {
            assertEquals(entry.getValue().label(), after.get(entry.getKey()).label(), entry.getKey());
        }

        EquivalenceResolver original = new EquivalenceResolver(model);
        EquivalenceResolver changed = new EquivalenceResolver(other);
        for (String cum : before.keySet()) {
            List<EquivalenceCandidate> expected = original.query(cum, 50, Set.of()).toList();
            List<EquivalenceCandidate> actual = changed.query(cum, 50, Set.of()).toList();
            assertEquals(expected.stream().map(EquivalenceCandidate::cum).toList(),
                actual.stream().map(EquivalenceCandidate::cum).toList(), cum);
            for (int i = 0; i < expected.size(); i++) {
                assertEquals(expected.get(i).distance(), actual.get(i).distance(), 1e-12, cum);
            }
        }
    }
}
