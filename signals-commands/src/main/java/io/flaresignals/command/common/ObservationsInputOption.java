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

import io.flaresignals.engine.io.ObservationReader;
import io.flaresignals.engine.model.Observation;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

/**
 * Shared option for the observation history input file.
 */
public class ObservationsInputOption {

    @CommandLine.Option(
        names = {"-i", "--input"},
        description = "JSON file holding the observation history",
        required = true
    )
    private Path inputPath;

    /**
     * Reads and validates the observation history.
     *
     * @throws IOException if the file is missing or unreadable
     */
    public List<Observation> load() throws IOException {
        if (!Files.exists(inputPath)) {
            throw new NoSuchFileException(inputPath.toString(), null, "input file does not exist");
        }
        return ObservationReader.read(inputPath);
    }

    @Override
    public String toString() {
        return String.valueOf(inputPath);
    }
}
