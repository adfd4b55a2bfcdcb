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
import io.medequiv.engine.model.MedicationRecord;
import io.medequiv.engine.train.HomologationModel;
import io.medequiv.engine.train.TrainingPipeline;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class EquivalenceResolverTest {

    private static HomologationModel model;
    private static EquivalenceResolver resolver;

    @BeforeAll
    static void train() {
        model = new TrainingPipeline(RegistryFixtures.config()).train(RegistryFixtures.registry());
        resolver = new EquivalenceResolver(model);
    }

    private static List<String> cums(EquivalenceResult result) {
        return result.toList().stream().map(EquivalenceCandidate::cum).toList();
    }

    @Test
    void testNearestFirstThenByCum() {
        EquivalenceResult result = resolver.query("G1-01");

        assertThat(cums(result)).containsExactly("G1-02", "G1-03", "G1-04", "G1-05", "G1-06", "G1-07");
        List<EquivalenceCandidate> candidates = result.toList();
        assertEquals(0.0, candidates.get(0).distance());
        assertTrue(candidates.get(5).distance() > 0.0);
        for (EquivalenceCandidate candidate : candidates) {
            assertEquals(result.label(), candidate.label());
        }
        assertEquals("ACETAMINOFEN 500 MG G1-02", candidates.get(0).productName());
        assertEquals("G1-01", result.queryCum());
        assertEquals(10, result.topK());
    }

    @Test
    void testOnlyEligibleFittedMembersAreCandidates() {
        assertFalse(cums(resolver.query("G1-01")).contains("G1-EXP"));
        assertFalse(cums(resolver.query("G2-01")).contains("G2-MS"));
    }

    @Test
    void testIneligibleQueryStillResolves() {
        EquivalenceResult result = resolver.query("G1-EXP");
        assertThat(cums(result)).containsExactly("G1-01", "G1-02", "G1-03", "G1-04", "G1-05", "G1-06", "G1-07");
        assertThat(cums(resolver.query("G2-MS"))).containsExactly("G2-01", "G2-02", "G2-03", "G2-04", "G2-05", "G2-06");
    }

    @Test
    void testTopKCutsTheRanking() {
        EquivalenceResult result = resolver.query("G1-01", 2, Set.of());
        assertThat(cums(result)).containsExactly("G1-02", "G1-03");
        assertEquals(6, result.available());

        EquivalenceResult wider = result.withTopK(4);
        assertThat(cums(wider)).containsExactly("G1-02", "G1-03", "G1-04", "G1-05");
        assertEquals(result.label(), wider.label());
        assertThrows(IllegalArgumentException.class, () -> resolver.query("G1-01", 0, Set.of()));
        assertThrows(IllegalArgumentException.class, () -> result.withTopK(0));
    }

    @Test
    void testRankingIsLazyAndShared() {
        EquivalenceResult result = resolver.query("G2-01", 3, Set.of());
        assertFalse(result.ranked());

        EquivalenceResult wider = result.withTopK(5);
        assertEquals(5, wider.toList().size());
        assertTrue(result.ranked());
        assertTrue(wider.ranked());
    }

    @Test
    void testRegistrationFilter() {
        EquivalenceResult result = resolver.query("G1-01", 10, EnumSet.of(CandidateFilter.REGISTRATION_ACTIVE));
        assertThat(cums(result)).containsExactly("G1-02", "G1-03", "G1-04", "G1-05", "G1-07");
        assertEquals(EnumSet.of(CandidateFilter.REGISTRATION_ACTIVE), result.filters());
    }

    @Test
    void testCoverageFilter() {
        EquivalenceResult result = resolver.query("G2-01", 10, EnumSet.of(CandidateFilter.COVERAGE_IN_PBS));
        assertThat(cums(result)).containsExactly("G2-02", "G2-04");

        EquivalenceResult none = resolver.query("G1-01", 10,
            EnumSet.of(CandidateFilter.COVERAGE_IN_PBS, CandidateFilter.REGISTRATION_ACTIVE));
        assertTrue(none.isEmpty());
        assertEquals(0, none.available());
    }

    @Test
    void testAtcFilterKeepsSameCode() {
        EquivalenceResult result = resolver.query("G1-01", 10, EnumSet.of(CandidateFilter.ATC_EXACT_MATCH));
        assertEquals(6, result.available());
    }

    @Test
    void testSingletonClusterHasNoEquivalent() {
        EquivalenceResult result = resolver.query("G5-01");
        assertTrue(result.isEmpty());
        assertTrue(result.toList().isEmpty());
        assertFalse(result.iterator().hasNext());
    }

    @Test
    void testUnresolvableQueries() {
        UnresolvableQueryException unknown = assertThrows(UnresolvableQueryException.class,
            () -> resolver.query("NOPE"));
        assertEquals("NOPE", unknown.cum());

        UnresolvableQueryException excluded = assertThrows(UnresolvableQueryException.class,
            () -> resolver.query("G3-BAD"));
        assertEquals("G3-BAD", excluded.cum());
        assertTrue(excluded.getMessage().contains("excluded"));
    }

    @Test
    void testVectorQuery() {
        double[] vector = model.snapshot().assignmentsByCum().get("G3-01").vector();
        EquivalenceResult result = resolver.query(vector, 10, EnumSet.of(CandidateFilter.NOT_MEDICAL_SAMPLE));

        assertNull(result.queryCum());
        // no identity to exclude
        assertThat(cums(result)).containsExactly("G3-01", "G3-02", "G3-03", "G3-04", "G3-05");
        assertThrows(IllegalArgumentException.class,
            () -> resolver.query(vector, 10, EnumSet.of(CandidateFilter.ATC_EXACT_MATCH)));
        assertThrows(IllegalArgumentException.class, () -> resolver.query(new double[]{1.0}, 10, Set.of()));
    }

    @Test
    void testRecordQuery() {
        MedicationRecord newcomer = RegistryFixtures.amoxicillin("NEW-1").build();
        EquivalenceResult result = resolver.query(newcomer, 3, Set.of());
        assertThat(cums(result)).containsExactly("G2-01", "G2-02", "G2-03");
        assertEquals(0.0, result.toList().get(0).distance(), 1e-12);

        MedicationRecord unseen = RegistryFixtures.amoxicillin("NEW-2").atcCode("J01CR02").route("INTRAVENOSA").build();
        EquivalenceResult unseenResult = resolver.query(unseen, 3, EnumSet.of(CandidateFilter.ATC_EXACT_MATCH));
        assertTrue(unseenResult.isEmpty());

        MedicationRecord broken = RegistryFixtures.amoxicillin("NEW-3").referenceQuantity(0.0).build();
        assertThrows(UnresolvableQueryException.class, () -> resolver.query(broken, 3, Set.of()));
    }

    @Test
    void testCandidatesCarryTheirSimilarity() {
        List<EquivalenceCandidate> candidates = resolver.query("G1-01").toList();

        EquivalenceCandidate same = candidates.get(0);
        assertEquals(SimilarityScorer.MAX_SCORE, same.similarityScore(), 1e-12);
        assertEquals(SimilarityScore.IngredientMatch.EXACT, same.similarity().ingredientMatch());

        EquivalenceCandidate stronger = candidates.get(5);
        assertEquals("G1-07", stronger.cum());
        assertEquals(0.4, stronger.similarity().quantity());
        assertEquals(1.09, stronger.similarityScore(), 1e-12);
    }

    @Test
    void testMinSimilarityDropsWeakCandidatesAfterFilters() {
        EquivalenceResult result = resolver.query("G1-01", 10, Set.of(), 1.10);
        assertThat(cums(result)).containsExactly("G1-02", "G1-03", "G1-04", "G1-05", "G1-06");
        assertEquals(1.10, result.minSimilarity());

        EquivalenceResult filtered = resolver.query("G1-01", 10,
            EnumSet.of(CandidateFilter.REGISTRATION_ACTIVE), 1.10);
        assertThat(cums(filtered)).containsExactly("G1-02", "G1-03", "G1-04", "G1-05");

        assertTrue(resolver.query("G1-07", 10, Set.of(), 1.10).isEmpty());
        assertEquals(6, resolver.query("G1-07", 10, Set.of(), 1.09 - 1e-9).available());
    }

    @Test
    void testMinSimilarityOnRecordQuery() {
        MedicationRecord newcomer = RegistryFixtures.acetaminophen("NEW-1").build();
        EquivalenceResult result = resolver.query(newcomer, 10, Set.of(), 1.10);
        assertThat(cums(result)).containsExactly("G1-01", "G1-02", "G1-03", "G1-04", "G1-05", "G1-06");
    }

    @Test
    void testMinSimilarityBounds() {
        assertEquals(0.0, resolver.query("G1-01").minSimilarity());
        assertThrows(IllegalArgumentException.class, () -> resolver.query("G1-01", 10, Set.of(), -0.1));
        assertThrows(IllegalArgumentException.class, () -> resolver.query("G1-01", 10, Set.of(), Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> resolver.query("G1-01", 10, Set.of(), 1.5));
    }

    @Test
    void testVectorQueryHasNoSimilarity() {
        double[] vector = model.snapshot().assignmentsByCum().get("G4-01").vector();
        for (EquivalenceCandidate candidate : resolver.query(vector, 10, Set.of())) {
            assertNull(candidate.similarity());
            assertTrue(Double.isNaN(candidate.similarityScore()));
        }
    }
}
