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

import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;

/// Shared output file option with force overwrite flag.
public class OutputFileOption {

    @CommandLine.Option(
        names = {"-o", "--output"},
        description = "Output file path",
        required = true
    )
    private Path outputPath;

    @CommandLine.Option(
        names = {"-f", "--force"},
        description = "Overwrite the output file if it exists"
    )
    private boolean force;

    /// @return the output path
    public Path getPath() {
        return outputPath;
    }

    /// @return whether overwriting is allowed
    public boolean isForce() {
        return force;
    }

    /// @return true if the output file exists and `--force` was not given
    public boolean existsWithoutForce() {
        return Files.exists(outputPath) && !force;
    }

    @Override
    public String toString() {
        return outputPath + (force ? " (force)" : "");
    }
}
