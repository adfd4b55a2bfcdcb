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

import io.medequiv.engine.RegistryFixtures;
import io.medequiv.engine.train.TrainingPipeline;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class BulkHomologationTest {

    private static BulkHomologation bulk;

    @BeforeAll
    static void train() {
        bulk = new BulkHomologation(new EquivalenceResolver(
            new TrainingPipeline(RegistryFixtures.config()).train(RegistryFixtures.registry())));
    }

    @Test
    void testOutcomePerDistinctCum() {
        List<HomologationOutcome> outcomes = bulk.resolveAll(
            Arrays.asList("G2-01", "G5-01", "NOPE", " G2-01 ", "", null, "G3-BAD"), Set.of());

        assertEquals(4, outcomes.size());
        HomologationOutcome found = outcomes.get(0);
        assertEquals("G2-01", found.cum());
        assertEquals(HomologationOutcome.Status.FOUND, found.status());
        assertEquals("G2-02", found.equivalentCum());
        assertEquals("AMOXICILINA 250 MG G2-02", found.equivalentProduct());
        assertEquals(0.0, found.distance(), 1e-12);
        assertEquals(SimilarityScorer.MAX_SCORE, found.similarity(), 1e-12);
        assertNull(found.reason());

        HomologationOutcome lonely = outcomes.get(1);
        assertEquals(HomologationOutcome.Status.NO_EQUIVALENT, lonely.status());
        assertNull(lonely.equivalentCum());
        assertNull(lonely.distance());
        assertNull(lonely.similarity());

        assertEquals(HomologationOutcome.Status.UNRESOLVABLE, outcomes.get(2).status());
        assertNotNull(outcomes.get(2).reason());
        assertEquals("G3-BAD", outcomes.get(3).cum());
        assertEquals(HomologationOutcome.Status.UNRESOLVABLE, outcomes.get(3).status());

        Map<HomologationOutcome.Status, Integer> summary = BulkHomologation.summarize(outcomes);
        assertEquals(1, summary.get(HomologationOutcome.Status.FOUND));
        assertEquals(1, summary.get(HomologationOutcome.Status.NO_EQUIVALENT));
        assertEquals(2, summary.get(HomologationOutcome.Status.UNRESOLVABLE));
    }

    @Test
    void testFiltersApplyToEveryQuery() {
        List<HomologationOutcome> outcomes = bulk.resolveAll(List.of("G2-01", "G1-01"),
            EnumSet.of(CandidateFilter.COVERAGE_IN_PBS));
        assertEquals("G2-02", outcomes.get(0).equivalentCum());
        assertEquals(HomologationOutcome.Status.NO_EQUIVALENT, outcomes.get(1).status());
    }

    @Test
    void testSummaryListsEveryStatus() {
        Map<HomologationOutcome.Status, Integer> summary = BulkHomologation.summarize(List.of());
        assertEquals(HomologationOutcome.Status.values().length, summary.size());
        assertTrue(summary.values().stream().allMatch(count -> count == 0));
    }

    @Test
    void testMinSimilarityTurnsWeakMatchesIntoNoEquivalent() {
        List<HomologationOutcome> outcomes = bulk.resolveAll(List.of("G1-01", "G1-07"), Set.of(), 1.10);
        assertEquals(HomologationOutcome.Status.FOUND, outcomes.get(0).status());
        assertEquals("G1-02", outcomes.get(0).equivalentCum());
        assertEquals(HomologationOutcome.Status.NO_EQUIVALENT, outcomes.get(1).status());

        assertThrows(IllegalArgumentException.class, () -> bulk.resolveAll(List.of("G1-01"), Set.of(), 2.0));
    }
}
