package io.flaresignals.engine.io;

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

import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import io.flaresignals.engine.config.SignalsGsonConfig;
import io.flaresignals.engine.model.Observation;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/// Reads observation histories from JSON.
///
/// The input is a JSON array of observation objects:
///
/// ```json
/// [
///   {
///     "id": "c-1",
///     "timestamp": "2025-02-04T08:30:00",
///     "symptoms": [{"name": "itching", "severity": 2}],
///     "skin_intensity": 3,
///     "tags": ["food:dairy", "heat"]
///   }
/// ]
/// ```
///
/// This is the boundary where malformed records are rejected. A bad
/// timestamp or an out-of-range value raises an exception naming the
/// offending record, and the analyzers never see it.
public final class ObservationReader {

    private static final Logger logger = LogManager.getLogger(ObservationReader.class);
    private static final Type LIST_TYPE = new TypeToken<List<Observation>>() {}.getType();

    private ObservationReader() {
    }

    /// Reads observations from a file.
    ///
    /// @param path a JSON file holding an array of observations
    /// @return the observations in file order
    /// @throws IOException if the file cannot be read
    /// @throws JsonParseException if the content is malformed
    public static List<Observation> read(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            List<Observation> observations = read(reader);
            logger.debug("Read {} observations from {}", observations.size(), path);
            return observations;
        }
    }

    /// Reads observations from a character stream.
    ///
    /// @param reader the JSON source
    /// @return the observations in source order
    /// @throws JsonParseException if the content is malformed or a record is invalid
    public static List<Observation> read(Reader reader) {
        List<Observation> parsed;
        try {
            parsed = SignalsGsonConfig.gson().fromJson(reader, LIST_TYPE);
        } catch (JsonParseException e) {
            throw e;
        } catch (RuntimeException e) {
            // record constructors reject out-of-range values; Gson wraps those
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new JsonParseException("invalid observation: " + cause.getMessage(), cause);
        }
        if (parsed == null) {
            return List.of();
        }
        List<Observation> observations = new ArrayList<>(parsed.size());
        for (int i = 0; i < parsed.size(); i++) {
            Observation observation = parsed.get(i);
            if (observation == null) {
                throw new JsonParseException("observation " + i + " is null");
            }
            observations.add(observation);
        }
        return observations;
    }

    public static List<Observation> fromJson(String json) {
        return read(new StringReader(json));
    }

    /// Writes observations as a JSON array.
    public static String toJson(List<Observation> observations) {
        return SignalsGsonConfig.gson().toJson(observations, LIST_TYPE);
    }
}
