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
import io.medequiv.engine.model.MedicationRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/// Reads [MedicationRecord]s from NDJSON, one JSON object per line.
///
/// Blank lines are skipped. Malformed lines, records without a CUM and
/// duplicate CUMs are rejected with an [IllegalArgumentException] naming the
/// line.
public final class RecordReader {

    private static final Logger logger = LogManager.getLogger(RecordReader.class);

    private RecordReader() {
    }

    /// @param path an NDJSON file
    /// @return the records in file order
    /// @throws IOException if the file cannot be read
    public static List<MedicationRecord> read(Path path) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            List<MedicationRecord> records = read(reader);
            logger.info("read {} records from {}", records.size(), path);
            return records;
        }
    }

    /// @param source NDJSON text
    /// @return the records in input order
    /// @throws IOException if reading fails
    public static List<MedicationRecord> read(Reader source) throws IOException {
        Gson gson = EngineGsonConfig.compactGson();
        BufferedReader reader = source instanceof BufferedReader ? (BufferedReader) source : new BufferedReader(source);
        List<MedicationRecord> records = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            MedicationRecord record;
            try {
                record = gson.fromJson(line, MedicationRecord.class);
            } catch (JsonParseException e) {
                throw new IllegalArgumentException("line " + lineNumber + ": invalid record: " + e.getMessage(), e);
            } catch (RuntimeException e) {
                // record constructor failures arrive wrapped by Gson
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                throw new IllegalArgumentException("line " + lineNumber + ": invalid record: " + cause.getMessage(), e);
            }
            if (record == null) {
                throw new IllegalArgumentException("line " + lineNumber + ": empty record");
            }
            if (!seen.add(record.cum())) {
                throw new IllegalArgumentException("line " + lineNumber + ": duplicate CUM " + record.cum());
            }
            records.add(record);
        }
        return records;
    }
}
