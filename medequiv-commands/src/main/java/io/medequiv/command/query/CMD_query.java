package io.medequiv.command.query;

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
import io.medequiv.engine.io.EngineGsonConfig;
import io.medequiv.engine.io.ModelStore;
import io.medequiv.engine.resolve.EquivalenceCandidate;
import io.medequiv.engine.resolve.EquivalenceResolver;
import io.medequiv.engine.resolve.EquivalenceResult;
import io.medequiv.engine.resolve.UnresolvableQueryException;
import io.medequiv.engine.train.HomologationModel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

/// Find equivalent products for one CUM.
///
/// ```
/// medequiv query --model model.json --cum 19901234-1 --top-k 5 --filter atc_exact_match --min-score 0.85
/// ```
@CommandLine.Command(name = "query",
    header = "Find substitutes for one CUM",
    description = "Ranks the eligible members of the CUM's cluster by distance.",
    exitCodeList = {
        "0: query answered (possibly with no candidates)",
        "1: the CUM is unknown or was excluded from training",
        "2: unreadable model or invalid arguments"
    })
public class CMD_query implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_query.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_UNRESOLVABLE = 1;
    private static final int EXIT_ERROR = 2;

    @CommandLine.Mixin
    private ModelFileOption modelOption = new ModelFileOption();

    @CommandLine.Option(names = {"--cum"}, description = "CUM of the product to replace", required = true)
    private String cum;

    @CommandLine.Option(names = {"-k", "--top-k"}, description = "Maximum number of substitutes (default: from model)")
    private Integer topK;

    @CommandLine.Mixin
    private FilterOption filterOption = new FilterOption();

    @CommandLine.Option(names = {"--min-score"}, defaultValue = "0",
        description = "Drop candidates whose attribute similarity is below this (0 to 1.15, default: ${DEFAULT-VALUE})")
    private double minScore;

    @CommandLine.Option(names = {"--json"}, description = "Print one JSON object per candidate")
    private boolean json;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        HomologationModel model;
        try {
            model = modelOption.load();
        } catch (IOException | ModelStore.ModelStoreException e) {
            logger.error("cannot load model {}: {}", modelOption, e.getMessage());
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }

        EquivalenceResolver resolver = new EquivalenceResolver(model);
        int limit = topK == null ? model.config().defaultTopK() : topK;
        try {
            EquivalenceResult result = resolver.query(cum, limit, filterOption.getFilters(), minScore);
            print(out, result);
            return EXIT_SUCCESS;
        } catch (UnresolvableQueryException e) {
            err.println("Unresolvable: " + e.getMessage());
            return EXIT_UNRESOLVABLE;
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    private void print(PrintWriter out, EquivalenceResult result) {
        if (json) {
            Gson gson = EngineGsonConfig.compactGson();
            for (EquivalenceCandidate candidate : result) {
                out.println(gson.toJson(candidate));
            }
        } else {
            out.printf("Substitutes for %s (cluster %d, %d available):%n", result.queryCum(), result.label(),
                result.available());
            int rank = 1;
            for (EquivalenceCandidate candidate : result) {
                out.printf("%3d. %-16s %10.6f  %5.3f  %s%n", rank++, candidate.cum(), candidate.distance(),
                    candidate.similarityScore(), candidate.productName());
            }
            if (result.isEmpty()) {
                out.println("  (no eligible equivalent)");
            }
        }
        out.flush();
    }
}
