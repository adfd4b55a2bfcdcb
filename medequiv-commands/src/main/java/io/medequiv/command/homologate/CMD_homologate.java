package io.medequiv.command.homologate;

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
import io.medequiv.command.common.FilterOption;
import io.medequiv.command.common.ModelFileOption;
import io.medequiv.command.common.OutputFileOption;
import io.medequiv.engine.io.EngineGsonConfig;
import io.medequiv.engine.io.ModelStore;
import io.medequiv.engine.resolve.BulkHomologation;
import io.medequiv.engine.resolve.EquivalenceResolver;
import io.medequiv.engine.resolve.HomologationOutcome;
import io.medequiv.engine.train.HomologationModel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/// Homologate a list of CUMs in one run.
///
/// The input holds one CUM per line; blank lines and lines starting with `#`
/// are ignored. The output holds one JSON outcome per distinct CUM.
@CommandLine.Command(name = "homologate",
    header = "Find the best substitute for every CUM in a file",
    description = "Writes one NDJSON outcome per CUM: FOUND, NO_EQUIVALENT or UNRESOLVABLE.",
    exitCodeList = {
        "0: every CUM has an outcome",
        "2: unreadable model, input or output"
    })
public class CMD_homologate implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_homologate.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_ERROR = 2;

    @CommandLine.Mixin
    private ModelFileOption modelOption = new ModelFileOption();

    @CommandLine.Option(names = {"-i", "--input"}, description = "Text file with one CUM per line", required = true)
    private Path inputPath;

    @CommandLine.Mixin
    private OutputFileOption output = new OutputFileOption();

    @CommandLine.Mixin
    private FilterOption filterOption = new FilterOption();

    @CommandLine.Option(names = {"--min-score"}, defaultValue = "0",
        description = "Drop candidates whose attribute similarity is below this (0 to 1.15, default: ${DEFAULT-VALUE})")
    private double minScore;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (output.existsWithoutForce()) {
            err.println("Error: output file exists: " + output.getPath() + " (use --force to overwrite)");
            return EXIT_ERROR;
        }
        try {
            HomologationModel model = modelOption.load();
            List<String> cums = readCums(inputPath);
            List<HomologationOutcome> outcomes = new BulkHomologation(new EquivalenceResolver(model))
                .resolveAll(cums, filterOption.getFilters(), minScore);

            Gson gson = EngineGsonConfig.compactGson();
            try (BufferedWriter writer = Files.newBufferedWriter(output.getPath(), StandardCharsets.UTF_8)) {
                for (HomologationOutcome outcome : outcomes) {
                    writer.write(gson.toJson(outcome));
                    writer.newLine();
                }
            }

            Map<HomologationOutcome.Status, Integer> counts = BulkHomologation.summarize(outcomes);
            out.printf("Homologated %d CUMs into %s: %d found, %d without equivalent, %d unresolvable%n",
                outcomes.size(), output.getPath(), counts.get(HomologationOutcome.Status.FOUND),
                counts.get(HomologationOutcome.Status.NO_EQUIVALENT),
                counts.get(HomologationOutcome.Status.UNRESOLVABLE));
            out.flush();
            return EXIT_SUCCESS;
        } catch (IOException | ModelStore.ModelStoreException e) {
            logger.error("homologation failed: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    private static List<String> readCums(Path path) throws IOException {
        List<String> cums = new ArrayList<>();
        for (String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
                cums.add(trimmed);
            }
        }
        return cums;
    }
}
