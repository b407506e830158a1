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

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON-loadable configuration for both analyzers.
 *
 * <h2>JSON Schema</h2>
 *
 * <pre>{@code
 * {
 *   "flare": { "baseline_window_days": 14, "threshold_margin": 0.5 },
 *   "correlation": { "minimum_exposures": 3, "worse_delta": 0.5 }
 * }
 * }</pre>
 *
 * <p>Either section may be omitted, as may any key inside a section.
 *
 * @see FlareDetectionConfig
 * @see CorrelationConfig
 */
public class EngineConfig {

    private static final Logger logger = LogManager.getLogger(EngineConfig.class);

    @SerializedName("flare")
    private FlareDetectionConfig flare = new FlareDetectionConfig();

    @SerializedName("correlation")
    private CorrelationConfig correlation = new CorrelationConfig();

    public EngineConfig() {
    }

    public EngineConfig(FlareDetectionConfig flare, CorrelationConfig correlation) {
        this.flare = flare;
        this.correlation = correlation;
    }

    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    public FlareDetectionConfig getFlare() {
        return flare;
    }

    public CorrelationConfig getCorrelation() {
        return correlation;
    }

    /**
     * Validates both sections, replacing absent ones with defaults.
     *
     * @return this config
     */
    public EngineConfig validate() {
        if (flare == null) {
            flare = new FlareDetectionConfig();
        }
        if (correlation == null) {
            correlation = new CorrelationConfig();
        }
        flare.validate();
        correlation.validate();
        return this;
    }

    /**
     * Reads and validates a configuration.
     *
     * @param reader the JSON source
     * @return the validated configuration
     * @throws JsonParseException if the JSON is malformed
     * @throws IllegalArgumentException if a value is out of range
     */
    public static EngineConfig fromJson(Reader reader) {
        EngineConfig config = SignalsGsonConfig.gson().fromJson(reader, EngineConfig.class);
        if (config == null) {
            throw new JsonParseException("configuration is empty");
        }
        return config.validate();
    }

    public static EngineConfig fromJson(String json) {
        return fromJson(new StringReader(json));
    }

    /**
     * Loads a configuration file.
     *
     * @param path the JSON file
     * @return the validated configuration
     * @throws IOException if the file cannot be read
     */
    public static EngineConfig load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            EngineConfig config = fromJson(reader);
            logger.debug("Loaded {} and {} from {}", config.flare, config.correlation, path);
            return config;
        }
    }

    public void save(Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            toJson(writer);
        }
    }

    public void toJson(Writer writer) {
        Gson gson = SignalsGsonConfig.gson();
        gson.toJson(this, writer);
    }
}
