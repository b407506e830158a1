package io.flaresignals.command.subcommands;

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

import io.flaresignals.command.CMD_signals;
import io.flaresignals.engine.SignalAnalyzer;
import io.flaresignals.engine.SignalAnalyzerIO;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/// List the analyzers discovered on the class path.
@CommandLine.Command(
    name = "analyzers",
    header = "List available analyzers",
    description = "Prints the name and description of every registered signal analyzer."
)
public class CMD_signals_analyzers implements Callable<Integer> {

    @Override
    public Integer call() {
        System.out.println("Available analyzers:");
        for (SignalAnalyzer<?> analyzer : SignalAnalyzerIO.getAll()) {
            System.out.printf("  %-22s %s%n", analyzer.getAnalyzerType(), analyzer.getDescription());
        }
        return CMD_signals.EXIT_OK;
    }
}
