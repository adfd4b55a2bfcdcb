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

import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import io.medequiv.engine.model.CumStatus;
import io.medequiv.engine.model.RegistrationStatus;

import java.io.IOException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/// Gson adapters for registry labels.
///
/// | Type | Reads | Writes |
/// |------|-------|--------|
/// | [RegistrationStatus] | enum name or label (`Vigente`, `Vencido`, ...) | enum name |
/// | [CumStatus] | enum name or label (`Activo`, `Inactivo`) | enum name |
/// | [LocalDate] | `yyyy-MM-dd` or `dd/MM/yyyy` | `yyyy-MM-dd` |
/// | `boolean` | `true`/`false`, `Si`/`No`, `S`/`N`, `1`/`0` | `true`/`false` |
public final class RegistryTypeAdapters {

    private static final DateTimeFormatter REGISTRY_DATE = DateTimeFormatter.ofPattern("dd/MM/yyyy");

    private RegistryTypeAdapters() {
    }

    /// Register every adapter on a builder.
    /// @param builder the builder to extend
    /// @return the same builder
    public static GsonBuilder register(GsonBuilder builder) {
        return builder
            .registerTypeAdapter(RegistrationStatus.class, new RegistrationStatusAdapter().nullSafe())
            .registerTypeAdapter(CumStatus.class, new CumStatusAdapter().nullSafe())
            .registerTypeAdapter(LocalDate.class, new LocalDateAdapter().nullSafe())
            .registerTypeAdapter(boolean.class, new LenientBooleanAdapter())
            .registerTypeAdapter(Boolean.class, new LenientBooleanAdapter().nullSafe());
    }

    static final class RegistrationStatusAdapter extends TypeAdapter<RegistrationStatus> {
        @Override
        public void write(JsonWriter out, RegistrationStatus value) throws IOException {
            out.value(value.name());
        }

        @Override
        public RegistrationStatus read(JsonReader in) throws IOException {
            return RegistrationStatus.parse(in.nextString());
        }
    }

    static final class CumStatusAdapter extends TypeAdapter<CumStatus> {
        @Override
        public void write(JsonWriter out, CumStatus value) throws IOException {
            out.value(value.name());
        }

        @Override
        public CumStatus read(JsonReader in) throws IOException {
            return CumStatus.parse(in.nextString());
        }
    }

    static final class LocalDateAdapter extends TypeAdapter<LocalDate> {
        @Override
        public void write(JsonWriter out, LocalDate value) throws IOException {
            out.value(value.toString());
        }

        @Override
        public LocalDate read(JsonReader in) throws IOException {
            String text = in.nextString().trim();
            if (text.isEmpty()) {
                return null;
            }
            try {
                return text.indexOf('/') >= 0 ? LocalDate.parse(text, REGISTRY_DATE) : LocalDate.parse(text);
            } catch (DateTimeParseException e) {
                throw new JsonParseException("invalid date '" + text + "' at " + in.getPath(), e);
            }
        }
    }

    // null reads as false
    static final class LenientBooleanAdapter extends TypeAdapter<Boolean> {
        @Override
        public void write(JsonWriter out, Boolean value) throws IOException {
            if (value == null) {
                out.nullValue();
            } else {
                out.value(value);
            }
        }

        @Override
        public Boolean read(JsonReader in) throws IOException {
            JsonToken token = in.peek();
            switch (token) {
                case NULL:
                    in.nextNull();
                    return Boolean.FALSE;
                case BOOLEAN:
                    return in.nextBoolean();
                case NUMBER:
                    return in.nextInt() != 0;
                case STRING:
                    return parseLabel(in.nextString(), in.getPath());
                default:
                    throw new JsonParseException("expected a boolean at " + in.getPath() + " but found " + token);
            }
        }

        private static Boolean parseLabel(String label, String path) {
            String key = label.trim().toUpperCase(Locale.ROOT);
            switch (key) {
                case "TRUE":
                case "SI":
                case "SÍ":
                case "S":
                case "YES":
                case "1":
                    return Boolean.TRUE;
                case "FALSE":
                case "NO":
                case "N":
                case "0":
                case "":
                    return Boolean.FALSE;
                default:
                    throw new JsonParseException("invalid boolean '" + label + "' at " + path);
            }
        }
    }
}
