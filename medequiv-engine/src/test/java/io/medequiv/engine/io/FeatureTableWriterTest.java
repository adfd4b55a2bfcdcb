package io.medequiv.engine.io;

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

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import io.medequiv.engine.RegistryFixtures;
import io.medequiv.engine.train.HomologationModel;
import io.medequiv.engine.train.TrainingPipeline;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class FeatureTableWriterTest {

    @Test
    void testOneRowPerAssignment(@TempDir Path tempDir) throws Exception {
        HomologationModel model = new TrainingPipeline(RegistryFixtures.config()).train(RegistryFixtures.registry());
        Path file = tempDir.resolve("features.ndjson");

        int rows = FeatureTableWriter.write(file, model);

        List<String> lines = Files.readAllLines(file);
        assertEquals(26, rows);
        assertEquals(rows, lines.size());

        JsonObject expired = lines.stream()
            .map(line -> JsonParser.parseString(line).getAsJsonObject())
            .filter(row -> row.get("cum").getAsString().equals("G1-EXP"))
            .findFirst()
            .orElseThrow();
        assertFalse(expired.get("fitted").getAsBoolean());
        assertEquals(model.snapshot().assignmentsByCum().get("G1-EXP").label(), expired.get("label").getAsInt());

        JsonObject features = expired.getAsJsonObject("features");
        assertEquals(17, features.size());
        assertTrue(features.has("atc.score"));
        assertTrue(features.has("quantity.bin"));
        assertEquals("EXPIRED", expired.getAsJsonObject("metadata").get("registration_status").getAsString());
        assertEquals("N02BE01", expired.getAsJsonObject("metadata").get("atc").getAsString());
    }
}
