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

import io.medequiv.engine.encode.FeatureVector;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

final class Blobs {

    static final double[][] CENTERS = {{0.0, 0.0}, {10.0, 10.0}, {20.0, 0.0}};

    private Blobs() {
    }

    /// Points named `b<blob>-<index>`, jittered by at most 0.5 around each center.
    static List<FeatureVector> blobs(int perBlob, long seed) {
        Random random = new Random(seed);
        List<FeatureVector> vectors = new ArrayList<>();
        for (int b = 0; b < CENTERS.length; b++) {
            for (int i = 0; i < perBlob; i++) {
                double[] point = {
                    CENTERS[b][0] + random.nextDouble() - 0.5,
                    CENTERS[b][1] + random.nextDouble() - 0.5
                };
                vectors.add(new FeatureVector("b" + b + "-" + i, point, Map.of()));
            }
        }
        return vectors;
    }

    static int blobOf(String cum) {
        return cum.charAt(1) - '0';
    }
}
