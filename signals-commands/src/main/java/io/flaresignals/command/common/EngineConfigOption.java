package io.flaresignals.command.common;

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

import io.flaresignals.engine.config.EngineConfig;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Shared option for an engine configuration file. Without it the defaults apply.
 */
public class EngineConfigOption {

    @CommandLine.Option(
        names = {"--config"},
        description = "JSON file with flare and correlation settings (default: built-in defaults)"
    )
    private Path configPath;

    public Path getConfigPath() {
        return configPath;
    }

    /**
     * Loads the configuration file, or the defaults when none was given.
     *
     * @throws IOException if the file cannot be read
     */
    public EngineConfig load() throws IOException {
        if (configPath == null) {
            return EngineConfig.defaults();
        }
        return EngineConfig.load(configPath);
    }
}
