package io.medequiv.command.train;

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

import io.medequiv.command.common.KRangeOption;
import io.medequiv.command.common.OutputFileOption;
import io.medequiv.engine.EquivalenceEngineException;
import io.medequiv.engine.cluster.ClusterQuality;
import io.medequiv.engine.config.EngineConfig;
import io.medequiv.engine.config.EngineConfigLoader;
import io.medequiv.engine.io.FeatureTableWriter;
import io.medequiv.engine.io.ModelStore;
import io.medequiv.engine.io.RecordReader;
import io.medequiv.engine.model.MedicationRecord;
import io.medequiv.engine.train.HomologationModel;
import io.medequiv.engine.train.TrainingPipeline;
import io.medequiv.engine.train.TrainingReport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/// Train a homologation model from an NDJSON record file.
///
/// ```
/// medequiv train --records registry.ndjson --output model.json
/// medequiv train --records registry.ndjson --config engine.yaml --auto-k 5..30 --output model.json
/// ```
@CommandLine.Command(name = "train",
    header = "Train a homologation model from registry records",
    description = "Encodes every record, clusters the eligible ones and writes the model file.",
    exitCodeList = {
        "0: model written",
        "2: unreadable input, invalid configuration or impossible fit"
    })
public class CMD_train implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_train.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_ERROR = 2;

    @CommandLine.Option(names = {"-r", "--records"}, description = "NDJSON file with one record per line",
        required = true)
    private Path recordsPath;

    @CommandLine.Option(names = {"-c", "--config"}, description = "YAML engine configuration")
    private Path configPath;

    @CommandLine.Option(names = {"-k", "--k"}, description = "Number of clusters, overrides the configuration")
    private Integer k;

    @CommandLine.Mixin
    private KRangeOption autoK = new KRangeOption();

    @CommandLine.Mixin
    private OutputFileOption output = new OutputFileOption();

    @CommandLine.Option(names = {"--vectors-out"}, description = "Also write the weighted feature table as NDJSON")
    private Path vectorsOut;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (k != null && autoK.isSpecified()) {
            err.println("Error: --k and --auto-k are mutually exclusive");
            return EXIT_ERROR;
        }
        if (output.existsWithoutForce()) {
            err.println("Error: output file exists: " + output.getPath() + " (use --force to overwrite)");
            return EXIT_ERROR;
        }
        if (!Files.isRegularFile(recordsPath)) {
            err.println("Error: records file not found: " + recordsPath);
            return EXIT_ERROR;
        }

        try {
            EngineConfig config = configPath == null ? EngineConfig.DEFAULTS : EngineConfigLoader.load(configPath);
            if (k != null) {
                config = config.toBuilder().k(k).build();
            }
            List<MedicationRecord> records = RecordReader.read(recordsPath);

            TrainingPipeline pipeline = new TrainingPipeline(config);
            HomologationModel model = autoK.isSpecified()
                ? pipeline.trainAutoK(records, autoK.getRange().min(), autoK.getRange().max())
                : pipeline.train(records);

            ModelStore.save(output.getPath(), model);
            if (vectorsOut != null) {
                FeatureTableWriter.write(vectorsOut, model);
            }
            printReport(out, model);
            return EXIT_SUCCESS;
        } catch (IOException e) {
            logger.error("training failed", e);
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        } catch (EquivalenceEngineException | IllegalArgumentException e) {
            logger.error("training failed: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    private void printReport(PrintWriter out, HomologationModel model) {
        TrainingReport report = model.report();
        out.printf("Model written to %s (generation %d)%n", output.getPath(), model.snapshot().generation());
        out.printf("  records:   %d total, %d eligible%n", report.totalRecords(), report.eligibleRecords());
        out.printf("  clustered: %d fitted, %d predicted, %d excluded%n",
            report.fittedRecords(), report.predictedRecords(), report.excludedRecords());
        out.printf("  k=%d inertia=%.4f iterations=%d converged=%s%n",
            report.k(), report.inertia(), report.iterations(), report.converged());
        ClusterQuality quality = report.quality();
        if (quality != null) {
            out.printf("  silhouette=%.4f davies_bouldin=%.4f calinski_harabasz=%.4f%n",
                quality.silhouette(), quality.daviesBouldin(), quality.calinskiHarabasz());
        }
        if (!report.kCandidates().isEmpty()) {
            out.printf("  elbow candidates: %s%n", report.kCandidates());
        }
        out.flush();
    }
}
