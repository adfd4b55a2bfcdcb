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
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import io.medequiv.engine.cluster.ClusterModelSnapshot;
import io.medequiv.engine.train.HomologationModel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Objects;

/// Saves and loads [HomologationModel] files.
///
/// ## Atomic Writes
///
/// ```text
///   1. Serialize the envelope without checksum
///   2. Compute SHA-256 of that JSON
///   3. Write the envelope with checksum to model.json.tmp
///   4. Rename over model.json (atomic on POSIX)
/// ```
///
/// An interrupted save leaves any previous model file intact.
///
/// ## File layout
///
/// ```json
/// {
///   "format_version": 1,
///   "checksum": "sha256:9f2c...",
///   "saved_at": "2026-03-01T10:15:30Z",
///   "model": { ... }
/// }
/// ```
///
/// Loading checks the format version and the checksum.
public final class ModelStore {

    private static final Logger logger = LogManager.getLogger(ModelStore.class);

    /// Version written by this release
    public static final int CURRENT_VERSION = 1;

    private static final String TEMP_SUFFIX = ".tmp";
    private static final String CHECKSUM_PREFIX = "sha256:";

    private ModelStore() {
    }

    /// Save a model atomically.
    ///
    /// @param path destination file
    /// @param model the model
    /// @throws IOException if writing fails
    public static void save(Path path, HomologationModel model) throws IOException {
        Objects.requireNonNull(path, "path cannot be null");
        Objects.requireNonNull(model, "model cannot be null");

        Gson gson = EngineGsonConfig.gson();
        String savedAt = Instant.now().toString();
        String checksum = computeChecksum(gson.toJson(new ModelFile(CURRENT_VERSION, null, savedAt, model)));
        String json = gson.toJson(new ModelFile(CURRENT_VERSION, checksum, savedAt, model));

        Path absolute = path.toAbsolutePath();
        Path parent = absolute.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tempPath = absolute.resolveSibling(absolute.getFileName() + TEMP_SUFFIX);
        try (Writer writer = Files.newBufferedWriter(tempPath, StandardCharsets.UTF_8)) {
            writer.write(json);
        }
        Files.move(tempPath, absolute, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        logger.info("saved model generation {} to {} ({})", model.snapshot().generation(), path, checksum);
    }

    /// @param path a model file
    /// @return the verified model
    /// @throws IOException if reading fails
    /// @throws ModelStoreException if the file is missing, malformed, of another version or corrupted
    public static HomologationModel load(Path path) throws IOException, ModelStoreException {
        return load(path, true);
    }

    /// @param path a model file
    /// @param verifyChecksum whether to verify the checksum
    /// @return the model
    /// @throws IOException if reading fails
    /// @throws ModelStoreException if the file is missing, malformed, of another version or corrupted
    public static HomologationModel load(Path path, boolean verifyChecksum) throws IOException, ModelStoreException {
        Objects.requireNonNull(path, "path cannot be null");
        if (!Files.exists(path)) {
            throw new ModelStoreException("Model file not found: " + path);
        }
        String json = Files.readString(path, StandardCharsets.UTF_8);

        Gson gson = EngineGsonConfig.gson();
        ModelFile file;
        try {
            file = gson.fromJson(json, ModelFile.class);
        } catch (JsonParseException e) {
            throw new ModelStoreException("Invalid model JSON: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new ModelStoreException("Invalid model content: " + e.getMessage(), e);
        }
        if (file == null || file.model == null) {
            throw new ModelStoreException("Model file is empty: " + path);
        }
        if (file.formatVersion != CURRENT_VERSION) {
            throw new ModelStoreException("Unsupported model format version: " + file.formatVersion
                + " (expected: " + CURRENT_VERSION + ")");
        }
        if (verifyChecksum) {
            if (file.checksum == null) {
                throw new ModelStoreException("Model file has no checksum: " + path);
            }
            String expected = computeChecksum(gson.toJson(new ModelFile(file.formatVersion, null, file.savedAt,
                file.model)));
            if (!expected.equals(file.checksum)) {
                throw new ModelStoreException("Model checksum mismatch: expected " + expected
                    + " but found " + file.checksum);
            }
        }
        try {
            file.model.config().validate();
        } catch (RuntimeException e) {
            throw new ModelStoreException("Model carries an invalid configuration: " + e.getMessage(), e);
        }
        ClusterModelSnapshot.observeGeneration(file.model.snapshot().generation());
        logger.debug("loaded model generation {} from {}", file.model.snapshot().generation(), path);
        return file.model;
    }

    private static String computeChecksum(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(content.getBytes(StandardCharsets.UTF_8));
            return CHECKSUM_PREFIX + HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static final class ModelFile {
        @SerializedName("format_version")
        private final int formatVersion;

        @SerializedName("checksum")
        private final String checksum;

        @SerializedName("saved_at")
        private final String savedAt;

        @SerializedName("model")
        private final HomologationModel model;

        private ModelFile(int formatVersion, String checksum, String savedAt, HomologationModel model) {
            this.formatVersion = formatVersion;
            this.checksum = checksum;
            this.savedAt = savedAt;
            this.model = model;
        }
    }

    /// Exception thrown when a model file cannot be loaded or verified.
    public static class ModelStoreException extends Exception {
        public ModelStoreException(String message) {
            super(message);
        }

        public ModelStoreException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
