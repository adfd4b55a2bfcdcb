package io.medequiv.engine.cluster;

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

import io.medequiv.engine.config.InvalidConfigurationException;
import io.medequiv.engine.encode.FeatureVector;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class ElbowKSelectorTest {

    private final ElbowKSelector selector = new ElbowKSelector(new KMeansClusterModel());
    private final ClusteringParameters base = new ClusteringParameters(1, 42L, 300, 1e-4, 3, 10);

    @Test
    void testChoosesCandidateWithSmallestSecondDifference() {
        ElbowKSelector.Selection selection = selector.select(Blobs.blobs(6, 21L), 1, 6, base);

        assertEquals(List.of(1, 2, 3, 4, 5, 6), selection.candidates());
        assertEquals(6, selection.inertias().size());

        List<Double> inertias = selection.inertias();
        int expected = 2;
        double best = Double.POSITIVE_INFINITY;
        for (int i = 0; i + 2 < inertias.size(); i++) {
            double second = (inertias.get(i + 2) - inertias.get(i + 1)) - (inertias.get(i + 1) - inertias.get(i));
            if (second < best) {
                best = second;
                expected = i + 2;
            }
        }
        assertEquals(expected, selection.k());
        assertTrue(inertias.get(0) > inertias.get(2));
    }

    @Test
    void testSelectionIsDeterministic() {
        List<FeatureVector> vectors = Blobs.blobs(6, 21L);
        assertEquals(selector.select(vectors, 2, 5, base), selector.select(vectors, 2, 5, base));
    }

    @Test
    void testRangeIsCappedByVectorCount() {
        ElbowKSelector.Selection selection = selector.select(Blobs.blobs(1, 1L), 1, 10, base);
        assertEquals(List.of(1, 2, 3), selection.candidates());
    }

    @Test
    void testShortRangeTakesFirstCandidate() {
        ElbowKSelector.Selection selection = selector.select(Blobs.blobs(4, 1L), 3, 4, base);
        assertEquals(3, selection.k());
    }

    @Test
    void testDegenerateCandidatesAreSkipped() {
        List<FeatureVector> vectors = List.of(
            new FeatureVector("a", new double[]{0.0}, Map.of()),
            new FeatureVector("b", new double[]{0.0}, Map.of()),
            new FeatureVector("c", new double[]{5.0}, Map.of()),
            new FeatureVector("d", new double[]{5.0}, Map.of()));
        ElbowKSelector.Selection selection = selector.select(vectors, 1, 4, base);
        assertEquals(List.of(1, 2), selection.candidates());
        assertEquals(1, selection.k());

        assertThrows(DegenerateClusterException.class, () -> selector.select(vectors, 3, 4, base));
    }

    @Test
    void testInvalidRanges() {
        List<FeatureVector> vectors = Blobs.blobs(2, 1L);
        assertThrows(InvalidConfigurationException.class, () -> selector.select(vectors, 0, 3, base));
        assertThrows(InvalidConfigurationException.class, () -> selector.select(vectors, 4, 3, base));
        assertThrows(InsufficientDataException.class, () -> selector.select(vectors, 7, 9, base));
    }
}
