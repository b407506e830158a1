package io.flaresignals.engine.config;

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

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import io.flaresignals.engine.io.LocalTimestamps;

import java.io.IOException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;

/// Centralized Gson configuration for observations, configs and results.
///
/// ## Configuration
///
/// | Feature | Setting | Purpose |
/// |---------|---------|---------|
/// | Field naming | `lower_case_with_underscores` | `skinIntensity` is written `skin_intensity` |
/// | HTML escaping | Disabled | Cleaner text output |
/// | `LocalDate` | ISO `yyyy-MM-dd` | Calendar dates without zone |
/// | `LocalDateTime` | [LocalTimestamps] | Local wall-clock timestamps |
///
/// Enums are written by their `@SerializedName` ids (`active_flare`, `often_worse`).
///
/// The shared [Gson] instance is thread-safe.
public final class SignalsGsonConfig {

    private static final Gson INSTANCE = builder().setPrettyPrinting().create();

    private SignalsGsonConfig() {
        // Utility class
    }

    /// Returns the shared pretty-printing instance.
    public static Gson gson() {
        return INSTANCE;
    }

    /// Creates a new builder with the signal defaults, for further customization.
    public static GsonBuilder builder() {
        return new GsonBuilder()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .disableHtmlEscaping()
            .registerTypeAdapter(LocalDate.class, new LocalDateAdapter().nullSafe())
            .registerTypeAdapter(LocalDateTime.class, new LocalDateTimeAdapter().nullSafe());
    }

    private static final class LocalDateAdapter extends TypeAdapter<LocalDate> {
        @Override
        public void write(JsonWriter out, LocalDate value) throws IOException {
            out.value(value.toString());
        }

        @Override
        public LocalDate read(JsonReader in) throws IOException {
            if (in.peek() != JsonToken.STRING) {
                throw new JsonParseException("expected a date string at " + in.getPath());
            }
            String text = in.nextString();
            try {
                return LocalDate.parse(text.strip());
            } catch (DateTimeParseException e) {
                throw new JsonParseException("invalid date '" + text + "' at " + in.getPath(), e);
            }
        }
    }

    private static final class LocalDateTimeAdapter extends TypeAdapter<LocalDateTime> {
        @Override
        public void write(JsonWriter out, LocalDateTime value) throws IOException {
            out.value(value.toString());
        }

        @Override
        public LocalDateTime read(JsonReader in) throws IOException {
            if (in.peek() != JsonToken.STRING) {
                throw new JsonParseException("expected a timestamp string at " + in.getPath());
            }
            String text = in.nextString();
            try {
                return LocalTimestamps.parse(text);
            } catch (IllegalArgumentException e) {
                throw new JsonParseException(e.getMessage() + " at " + in.getPath(), e);
            }
        }
    }
}
