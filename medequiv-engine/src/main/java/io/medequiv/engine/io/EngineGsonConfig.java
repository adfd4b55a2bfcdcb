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
import com.google.gson.GsonBuilder;

/// Centralized Gson configuration for records, models and exports.
///
/// ## Configuration
///
/// | Feature | Setting | Purpose |
/// |---------|---------|---------|
/// | Pretty printing | Enabled in [#gson()] only | Human-readable model files |
/// | HTML escaping | Disabled | Product names keep their characters |
/// | Special floats | Serialized | Undefined quality scores are `NaN` |
/// | Registry adapters | Registered | See [RegistryTypeAdapters] |
///
/// ## Thread Safety
///
/// [Gson] instances are thread-safe; the shared instances may be used from
/// any thread.
public final class EngineGsonConfig {

    private static final Gson PRETTY = builder().setPrettyPrinting().create();
    private static final Gson COMPACT = builder().create();

    private EngineGsonConfig() {
    }

    /// @return the shared pretty-printing instance, used for model files
    public static Gson gson() {
        return PRETTY;
    }

    /// @return the shared single-line instance, used for NDJSON
    public static Gson compactGson() {
        return COMPACT;
    }

    /// @return a new builder with the engine defaults and adapters
    public static GsonBuilder builder() {
        return RegistryTypeAdapters.register(new GsonBuilder()
            .disableHtmlEscaping()
            .serializeSpecialFloatingPointValues());
    }
}
