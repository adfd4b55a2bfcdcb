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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class ClusterQualityMetricsTest {

    private final ClusterQualityMetrics metrics = new ClusterQualityMetrics();

    @Test
    void testSeparatedBlobsScoreWell() {
        ClusterModelSnapshot snapshot = new KMeansClusterModel().fit(Blobs.blobs(10, 7L), ClusteringParameters.defaults(3));
        ClusterQuality quality = metrics.evaluate(snapshot);

        assertTrue(quality.silhouette() > 0.9, "silhouette " + quality.silhouette());
        assertTrue(quality.daviesBouldin() < 0.2, "davies-bouldin " + quality.daviesBouldin());
        assertTrue(quality.calinskiHarabasz() > 100.0, "calinski-harabasz " + quality.calinskiHarabasz());
        assertEquals(30, quality.sampleSize());
    }

    @Test
    void testHandComputedTwoClusterCase() {
        double[][] points = {{0.0}, {2.0}, {10.0}, {12.0}};
        int[] labels = {0, 0, 1, 1};
        double[][] centroids = {{1.0}, {11.0}};

        ClusterQuality quality = metrics.evaluate(points, labels, centroids);

        // a = 2, b = 10 for the outer points and 8 for the inner ones
        double expectedSilhouette = ((1.0 - 2.0 / 11.0) + (1.0 - 2.0 / 9.0)) / 2.0;
        assertEquals(expectedSilhouette, quality.silhouette(), 1e-12);
        // scatter 1 in each cluster, centroids 10 apart
        assertEquals(0.2, quality.daviesBouldin(), 1e-12);
        // between 2*25 + 2*25 = 100 over within 4, times (4-2)/(2-1)
        assertEquals(50.0, quality.calinskiHarabasz(), 1e-12);
    }

    @Test
    void testSingleClusterIsUndefined() {
        double[][] points = {{0.0}, {1.0}, {2.0}};
        ClusterQuality quality = metrics.evaluate(points, new int[]{0, 0, 0}, new double[][]{{1.0}});
        assertTrue(Double.isNaN(quality.silhouette()));
        assertTrue(Double.isNaN(quality.daviesBouldin()));
        assertTrue(Double.isNaN(quality.calinskiHarabasz()));
    }

    @Test
    void testSilhouetteSampleIsCappedAndDeterministic() {
        ClusterModelSnapshot snapshot = new KMeansClusterModel().fit(Blobs.blobs(20, 4L), ClusteringParameters.defaults(3));
        ClusterQualityMetrics sampled = new ClusterQualityMetrics(15, 42L);

        ClusterQuality first = sampled.evaluate(snapshot);
        ClusterQuality second = sampled.evaluate(snapshot);
        assertEquals(15, first.sampleSize());
        assertEquals(first, second);
        assertTrue(first.silhouette() > 0.9);
    }

    @Test
    void testInvalidSampleLimit() {
        assertThrows(IllegalArgumentException.class, () -> new ClusterQualityMetrics(0, 1L));
    }
}
