package io.medequiv.command.inspect;

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

import io.medequiv.command.common.ModelFileOption;
import io.medequiv.engine.cluster.ClusterModelSnapshot;
import io.medequiv.engine.cluster.ClusterQuality;
import io.medequiv.engine.encode.CategoricalFrequencyTable;
import io.medequiv.engine.encode.FeatureLayout;
import io.medequiv.engine.io.ModelStore;
import io.medequiv.engine.model.CategoricalAttribute;
import io.medequiv.engine.train.ExcludedRecord;
import io.medequiv.engine.train.HomologationModel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

/// Print a summary of a trained model.
@CommandLine.Command(name = "inspect",
    header = "Summarize a trained model",
    description = "Shows configuration, cluster statistics, quality scores and the most frequent categories.",
    exitCodeList = {
        "0: summary printed",
        "2: unreadable model"
    })
public class CMD_inspect implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_inspect.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_ERROR = 2;

    @CommandLine.Mixin
    private ModelFileOption modelOption = new ModelFileOption();

    @CommandLine.Option(names = {"--top"}, description = "Categories to list per attribute (default: ${DEFAULT-VALUE})",
        defaultValue = "5")
    private int top;

    @CommandLine.Option(names = {"--excluded"}, description = "List every excluded record")
    private boolean listExcluded;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        HomologationModel model;
        try {
            model = modelOption.load();
        } catch (IOException | ModelStore.ModelStoreException e) {
            logger.error("cannot load model {}: {}", modelOption, e.getMessage());
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }

        ClusterModelSnapshot snapshot = model.snapshot();
        out.printf("Model %s%n", modelOption);
        out.printf("  trained at:  %s%n", model.trainedAt());
        out.printf("  generation:  %d%n", snapshot.generation());
        out.printf("  config:      %s%n", model.config());
        out.printf("  records:     %d (%d excluded)%n", model.records().size(), model.excluded().size());
        out.printf("  clusters:    k=%d inertia=%.4f iterations=%d converged=%s restart=%d failed_restarts=%d"
                + " reseeds=%d%n",
            snapshot.k(), snapshot.inertia(), snapshot.iterations(), snapshot.converged(), snapshot.restart(),
            snapshot.failedRestarts(), snapshot.reseeds());
        ClusterQuality quality = snapshot.quality();
        if (quality != null) {
            out.printf("  quality:     silhouette=%.4f (n=%d) davies_bouldin=%.4f calinski_harabasz=%.4f%n",
                quality.silhouette(), quality.sampleSize(), quality.daviesBouldin(), quality.calinskiHarabasz());
        }

        int[] sizes = snapshot.clusterSizes();
        out.println("  cluster sizes (fitted):");
        for (int c = 0; c < sizes.length; c++) {
            out.printf("    %3d: %d%n", c, sizes[c]);
        }

        FeatureLayout layout = model.layout();
        double[] weights = layout.componentWeights();
        out.println("  components:");
        for (int i = 0; i < layout.dimensions(); i++) {
            FeatureLayout.Component component = layout.components().get(i);
            out.printf("    %-32s %-9s weight=%.4f%n", component.name(), component.tier(), weights[i]);
        }

        for (CategoricalAttribute attribute : CategoricalAttribute.values()) {
            CategoricalFrequencyTable table = model.frequencyTable(attribute);
            out.printf("  %s: %d distinct values, max rank %d%n", attribute, table.size(), table.maxRank());
            List<CategoricalFrequencyTable.Entry> entries = table.entries();
            for (int i = 0; i < Math.min(top, entries.size()); i++) {
                CategoricalFrequencyTable.Entry entry = entries.get(i);
                out.printf("    rank %-4d count %-6d %s%n", entry.rank(), entry.count(), entry.value());
            }
        }

        if (listExcluded) {
            out.println("  excluded records:");
            for (ExcludedRecord excluded : model.excluded()) {
                out.printf("    %s %s=%s: %s%n", excluded.cum(), excluded.field(), excluded.value(), excluded.reason());
            }
        }
        out.flush();
        return EXIT_SUCCESS;
    }
}
