package io.medequiv.command.common;

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

import io.medequiv.engine.io.ModelStore;
import io.medequiv.engine.train.HomologationModel;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;

/// Shared `--model` option naming a trained model file.
public class ModelFileOption {

    @CommandLine.Option(
        names = {"-m", "--model"},
        description = "Trained model file written by 'train'",
        required = true
    )
    private Path modelPath;

    /// @return the model path
    public Path getModelPath() {
        return modelPath;
    }

    /// Load and verify the model.
    /// @return the model
    /// @throws IOException if the file cannot be read
    /// @throws ModelStore.ModelStoreException if the file is not a valid model
    public HomologationModel load() throws IOException, ModelStore.ModelStoreException {
        return ModelStore.load(modelPath);
    }

    @Override
    public String toString() {
        return String.valueOf(modelPath);
    }
}
