package io.flaresignals.command;

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

import io.flaresignals.command.subcommands.CMD_signals_analyzers;
import io.flaresignals.command.subcommands.CMD_signals_export;
import io.flaresignals.command.subcommands.CMD_signals_flares;
import io.flaresignals.command.subcommands.CMD_signals_triggers;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/// The signals command reads an observation history and reports flare and trigger signals.
///
/// This is an umbrella command for the analysis subcommands.
@CommandLine.Command(name = "signals",
    header = "Analyze symptom observation histories",
    description = "Contains subcommands that detect flares and rank possible triggers in a check-in history",
    mixinStandardHelpOptions = true,
    version = "signals 0.1.0",
    subcommands = {
        CMD_signals_flares.class,
        CMD_signals_triggers.class,
        CMD_signals_export.class,
        CMD_signals_analyzers.class,
        CommandLine.HelpCommand.class
    })
public class CMD_signals implements Callable<Integer> {

    /// Exit code for a successful run
    public static final int EXIT_OK = 0;
    /// Exit code for unreadable input or configuration
    public static final int EXIT_INPUT_ERROR = 1;
    /// Exit code for a failure inside an analyzer
    public static final int EXIT_ANALYZER_ERROR = 2;

    /// Run CMD_signals
    ///
    /// @param args Command line arguments
    public static void main(String[] args) {
        System.exit(new CommandLine(new CMD_signals()).execute(args));
    }

    /// Print help when no subcommand is given
    ///
    /// @return 0
    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return EXIT_OK;
    }
}
