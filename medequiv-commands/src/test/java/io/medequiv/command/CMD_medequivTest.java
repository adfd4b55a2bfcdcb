package io.medequiv.command;

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

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import io.medequiv.engine.io.EngineGsonConfig;
import io.medequiv.engine.model.MedicationRecord;
import io.medequiv.engine.model.RegistrationStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class CMD_medequivTest {

    @TempDir
    Path tempDir;

    private Path records;
    private Path model;

    private record Run(int exitCode, String out, String err) {
    }

    private static Run run(String... args) {
        StringWriter out = new StringWriter();
        StringWriter err = new StringWriter();
        CommandLine commandLine = CMD_medequiv.commandLine();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        int exitCode = commandLine.execute(args);
        return new Run(exitCode, out.toString(), err.toString());
    }

    private static MedicationRecord.Builder product(String cum, String ingredient, String atc, String form,
                                                    String route, String unit, double quantity) {
        return MedicationRecord.builder()
            .cum(cum)
            .productName(ingredient + " " + cum)
            .activeIngredient(ingredient)
            .atcCode(atc)
            .pharmaceuticalForm(form)
            .route(route)
            .measurementUnit(unit)
            .quantity(quantity)
            .referenceQuantity(1.0);
    }

    @BeforeEach
    void writeRegistry() throws IOException {
        List<MedicationRecord> list = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            list.add(product("A-0" + i, "ACETAMINOFEN", "N02BE01", "TABLETA", "ORAL", "MG", 500).build());
            list.add(product("B-0" + i, "AMOXICILINA", "J01CA04", "CAPSULA", "ORAL", "MG", 250)
                .pbsCoverage(i % 2 == 0).build());
            list.add(product("C-0" + i, "SALBUTAMOL", "R03AC02", "AEROSOL", "INHALADA", "MCG", 100).build());
            list.add(product("D-0" + i, "BETAMETASONA", "D07AC01", "CREMA", "TOPICA", "G", 15).build());
        }
        list.add(product("A-EXP", "ACETAMINOFEN", "N02BE01", "TABLETA", "ORAL", "MG", 500)
            .registrationStatus(RegistrationStatus.EXPIRED).build());
        list.add(product("C-BAD", "SALBUTAMOL", "R03AC02", "AEROSOL", "INHALADA", "MCG", 0).build());

        Gson gson = EngineGsonConfig.compactGson();
        StringBuilder ndjson = new StringBuilder();
        for (MedicationRecord record : list) {
            ndjson.append(gson.toJson(record)).append('\n');
        }
        records = tempDir.resolve("registry.ndjson");
        Files.writeString(records, ndjson.toString());
        model = tempDir.resolve("model.json");
    }

    private void train() {
        Run run = run("train", "--records", records.toString(), "--k", "4", "--output", model.toString());
        assertEquals(0, run.exitCode(), run.err());
    }

    @Test
    void testTrainWritesModel() {
        Path vectors = tempDir.resolve("vectors.ndjson");
        Run run = run("train", "-r", records.toString(), "-k", "4", "-o", model.toString(),
            "--vectors-out", vectors.toString());

        assertEquals(0, run.exitCode(), run.err());
        assertTrue(Files.exists(model));
        assertTrue(Files.exists(vectors));
        assertTrue(run.out().contains("Model written to " + model));
        assertTrue(run.out().contains("22 total, 21 eligible"));
        assertTrue(run.out().contains("20 fitted, 1 predicted, 1 excluded"));
        assertTrue(run.out().contains("k=4"));
    }

    @Test
    void testTrainRefusesToOverwriteWithoutForce() {
        train();
        Run refused = run("train", "--records", records.toString(), "--k", "4", "--output", model.toString());
        assertEquals(2, refused.exitCode());
        assertTrue(refused.err().contains("--force"));

        Run forced = run("train", "--records", records.toString(), "--k", "4", "--output", model.toString(), "--force");
        assertEquals(0, forced.exitCode(), forced.err());
    }

    @Test
    void testTrainInputErrors() throws IOException {
        assertEquals(2, run("train", "--records", tempDir.resolve("missing.ndjson").toString(),
            "--output", model.toString()).exitCode());
        assertEquals(2, run("train", "--records", records.toString(), "--k", "4", "--auto-k", "2..5",
            "--output", model.toString()).exitCode());
        assertEquals(2, run("train", "--records", records.toString(), "--k", "40",
            "--output", model.toString()).exitCode());

        Path config = tempDir.resolve("engine.yaml");
        Files.writeString(config, "clusters: 4\n");
        Run badConfig = run("train", "--records", records.toString(), "--config", config.toString(),
            "--output", model.toString());
        assertEquals(2, badConfig.exitCode());
        assertTrue(badConfig.err().contains("clusters"));
        assertFalse(Files.exists(model));

        // missing required option is a usage error
        assertEquals(2, run("train", "--output", model.toString()).exitCode());
    }

    @Test
    void testTrainWithConfigAndAutoK() throws IOException {
        Path config = tempDir.resolve("engine.yaml");
        Files.writeString(config, "n_restarts: 5\ndefault_top_k: 2\n");
        Run run = run("train", "--records", records.toString(), "--config", config.toString(),
            "--auto-k", "2..4", "--output", model.toString());

        assertEquals(0, run.exitCode(), run.err());
        assertTrue(run.out().contains("elbow candidates: [2, 3, 4]"));

        Run query = run("query", "--model", model.toString(), "--cum", "D-01");
        assertEquals(0, query.exitCode(), query.err());
        assertTrue(query.out().contains(" 1. D-02"));
        assertTrue(query.out().contains(" 2. D-03"));
        assertFalse(query.out().contains("D-04"));
    }

    @Test
    void testQuery() {
        train();
        Run run = run("query", "--model", model.toString(), "--cum", "A-01", "--top-k", "3");

        assertEquals(0, run.exitCode(), run.err());
        assertTrue(run.out().contains("Substitutes for A-01"));
        assertTrue(run.out().contains("4 available"));
        assertTrue(run.out().contains(" 1. A-02"));
        assertTrue(run.out().contains(" 3. A-04"));
        assertFalse(run.out().contains("A-05"));
        assertFalse(run.out().contains("A-EXP"));
    }

    @Test
    void testQueryWithFilterAndJson() {
        train();
        Run run = run("query", "-m", model.toString(), "--cum", "B-01", "--filter", "coverage-in-pbs", "--json");

        assertEquals(0, run.exitCode(), run.err());
        String[] lines = run.out().trim().split("\\R");
        assertEquals(2, lines.length);
        JsonObject first = JsonParser.parseString(lines[0]).getAsJsonObject();
        assertEquals("B-02", first.get("cum").getAsString());
        assertEquals("AMOXICILINA B-02", first.get("product_name").getAsString());
        assertEquals("B-04", JsonParser.parseString(lines[1]).getAsJsonObject().get("cum").getAsString());
    }

    @Test
    void testQueryMinScore() {
        train();
        Run run = run("query", "-m", model.toString(), "--cum", "A-01", "--min-score", "1.1", "--json");

        assertEquals(0, run.exitCode(), run.err());
        String[] lines = run.out().trim().split("\\R");
        assertEquals(4, lines.length);
        JsonObject similarity = JsonParser.parseString(lines[0]).getAsJsonObject().getAsJsonObject("similarity");
        assertTrue(similarity.get("total").getAsDouble() > 1.1);
        assertEquals("EXACT", similarity.get("ingredient_match").getAsString());

        assertEquals(2, run("query", "-m", model.toString(), "--cum", "A-01", "--min-score", "2").exitCode());
        assertEquals(2, run("query", "-m", model.toString(), "--cum", "A-01", "--min-score", "high").exitCode());
    }

    @Test
    void testQueryFailures() {
        train();
        Run unknown = run("query", "--model", model.toString(), "--cum", "ZZZ");
        assertEquals(1, unknown.exitCode());
        assertTrue(unknown.err().contains("ZZZ"));

        assertEquals(1, run("query", "--model", model.toString(), "--cum", "C-BAD").exitCode());
        assertEquals(2, run("query", "--model", tempDir.resolve("none.json").toString(), "--cum", "A-01").exitCode());
        assertEquals(2, run("query", "--model", model.toString(), "--cum", "A-01", "--filter", "cheapest").exitCode());
        assertEquals(2, run("query", "--model", model.toString(), "--cum", "A-01", "--top-k", "0").exitCode());
    }

    @Test
    void testQueryIneligibleProduct() {
        train();
        Run run = run("query", "--model", model.toString(), "--cum", "A-EXP",
            "--filter", "registration_active", "--filter", "not_medical_sample");
        assertEquals(0, run.exitCode(), run.err());
        assertTrue(run.out().contains("5 available"));
        assertTrue(run.out().contains(" 1. A-01"));
    }

    @Test
    void testHomologate() throws IOException {
        train();
        Path input = tempDir.resolve("cums.txt");
        Files.writeString(input, "# pending homologation\nA-01\n\nB-03\nZZZ\nA-01\nC-BAD\n");
        Path outcomes = tempDir.resolve("outcomes.ndjson");

        Run run = run("homologate", "--model", model.toString(), "--input", input.toString(),
            "--output", outcomes.toString());

        assertEquals(0, run.exitCode(), run.err());
        assertTrue(run.out().contains("Homologated 4 CUMs"));
        assertTrue(run.out().contains("2 found, 0 without equivalent, 2 unresolvable"));

        List<String> lines = Files.readAllLines(outcomes);
        assertEquals(4, lines.size());
        JsonObject first = JsonParser.parseString(lines.get(0)).getAsJsonObject();
        assertEquals("A-01", first.get("cum").getAsString());
        assertEquals("FOUND", first.get("status").getAsString());
        assertEquals("A-02", first.get("equivalent_cum").getAsString());
        JsonObject third = JsonParser.parseString(lines.get(2)).getAsJsonObject();
        assertEquals("UNRESOLVABLE", third.get("status").getAsString());
        assertTrue(third.has("reason"));

        Run again = run("homologate", "--model", model.toString(), "--input", input.toString(),
            "--output", outcomes.toString());
        assertEquals(2, again.exitCode());
    }

    @Test
    void testHomologateRejectsOutOfRangeMinScore() throws IOException {
        train();
        Path input = tempDir.resolve("cums.txt");
        Files.writeString(input, "A-01\n");
        Run run = run("homologate", "--model", model.toString(), "--input", input.toString(),
            "--output", tempDir.resolve("out.ndjson").toString(), "--min-score=-1");
        assertEquals(2, run.exitCode());
        assertTrue(run.err().contains("minSimilarity"));
    }

    @Test
    void testHomologateMissingInput() {
        train();
        Run run = run("homologate", "--model", model.toString(), "--input", tempDir.resolve("none.txt").toString(),
            "--output", tempDir.resolve("out.ndjson").toString());
        assertEquals(2, run.exitCode());
    }

    @Test
    void testInspect() {
        train();
        Run run = run("inspect", "--model", model.toString(), "--top", "2", "--excluded");

        assertEquals(0, run.exitCode(), run.err());
        assertTrue(run.out().contains("k=4"));
        assertTrue(run.out().contains("records:     22 (1 excluded)"));
        assertTrue(run.out().contains("atc.score"));
        assertTrue(run.out().contains("quantity.bin"));
        assertTrue(run.out().contains("ATC: 4 distinct values"));
        assertTrue(run.out().contains("C-BAD quantity=0.0"));
    }

    @Test
    void testTamperedModelIsRejected() throws IOException {
        train();
        String json = Files.readString(model);
        Files.writeString(model, json.replace("ACETAMINOFEN A-02", "ACETAMINOFEN A-99"));
        Run run = run("inspect", "--model", model.toString());
        assertEquals(2, run.exitCode());
        assertTrue(run.err().contains("checksum"));
    }
}
