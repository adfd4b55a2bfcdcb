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

import com.google.gson.Gson;
import com.google.gson.annotations.SerializedName;
import io.medequiv.engine.cluster.ClusterAssignment;
import io.medequiv.engine.encode.FeatureLayout;
import io.medequiv.engine.encode.VectorAssembler;
import io.medequiv.engine.model.MedicationRecord;
import io.medequiv.engine.train.HomologationModel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Exports the weighted feature table of a model as NDJSON.
///
/// One line per labeled record:
///
/// ```json
/// {"cum":"1-1","label":3,"fitted":true,"features":{"atc.score":0.41,...},"metadata":{"product_name":"..."}}
/// ```
///
/// Excluded records have no vector and are not written.
public final class FeatureTableWriter {

    private static final Logger logger = LogManager.getLogger(FeatureTableWriter.class);

    private FeatureTableWriter() {
    }

    /// @param path destination file
    /// @param model the model to export
    /// @return number of rows written
    /// @throws IOException if writing fails
    public static int write(Path path, HomologationModel model) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            int rows = write(writer, model);
            logger.info("wrote {} feature rows to {}", rows, path);
            return rows;
        }
    }

    /// @param writer destination
    /// @param model the model to export
    /// @return number of rows written
    /// @throws IOException if writing fails
    public static int write(Writer writer, HomologationModel model) throws IOException {
        Gson gson = EngineGsonConfig.compactGson();
        Map<String, MedicationRecord> records = new HashMap<>();
        for (MedicationRecord record : model.records()) {
            records.put(record.cum(), record);
        }
        List<FeatureLayout.Component> components = model.layout().components();
        int rows = 0;
        for (ClusterAssignment assignment : model.snapshot().assignments()) {
            double[] vector = assignment.vector();
            Map<String, Double> features = new LinkedHashMap<>();
            for (int i = 0; i < components.size(); i++) {
                features.put(components.get(i).name(), vector[i]);
            }
            MedicationRecord record = records.get(assignment.cum());
            Map<String, String> metadata = record == null ? Map.of() : VectorAssembler.informative(record);
            writer.write(gson.toJson(new Row(assignment.cum(), assignment.label(), assignment.fitted(), features,
                metadata)));
            writer.write('\n');
            rows++;
        }
        writer.flush();
        return rows;
    }

    private static final class Row {
        @SerializedName("cum")
        private final String cum;
        @SerializedName("label")
        private final int label;
        @SerializedName("fitted")
        private final boolean fitted;
        @SerializedName("features")
        private final Map<String, Double> features;
        @SerializedName("metadata")
        private final Map<String, String> metadata;

        private Row(String cum, int label, boolean fitted, Map<String, Double> features,
                    Map<String, String> metadata) {
            this.cum = cum;
            this.label = label;
            this.fitted = fitted;
            this.features = features;
            this.metadata = metadata;
        }
    }
}
