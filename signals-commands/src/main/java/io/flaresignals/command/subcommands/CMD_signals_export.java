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
import io.flaresignals.command.common.EngineConfigOption;
import io.flaresignals.command.common.ObservationsInputOption;
import io.flaresignals.command.common.OutputFileOption;
import io.flaresignals.engine.config.EngineConfig;
import io.flaresignals.engine.flare.FlareDetector;
import io.flaresignals.engine.model.DailyFlareState;
import io.flaresignals.engine.model.FlareAnalysis;
import io.flaresignals.engine.model.Observation;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/// Export the daily flare states as CSV.
///
/// ```text
/// date,score,baseline,threshold,state
/// 2024-03-01,0.6000,,,stable
/// 2024-03-15,1.8000,0.6000,1.1000,peak_flare
/// ```
///
/// Undefined baselines and thresholds are written as empty fields.
@CommandLine.Command(
    name = "export",
    header = "Export daily flare states as CSV",
    description = "Writes one CSV row per logged day with its score, baseline, threshold and flare state.",
    exitCodeList = {
        "0: Success",
        "1: Error reading input, configuration or writing output",
        "2: Flare detection failed"
    }
)
public class CMD_signals_export implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_signals_export.class);

    static final String HEADER = "date,score,baseline,threshold,state";

    @CommandLine.Mixin
    private ObservationsInputOption input = new ObservationsInputOption();

    @CommandLine.Mixin
    private EngineConfigOption configOption = new EngineConfigOption();

    @CommandLine.Mixin
    private OutputFileOption output = new OutputFileOption();

    @Override
    public Integer call() {
        List<Observation> observations;
        EngineConfig config;
        try {
            output.validate();
            observations = input.load();
            config = configOption.load();
        } catch (IOException | RuntimeException e) {
            logger.debug("Could not prepare export of {} to {}", input, output, e);
            System.err.println("Error: " + e.getMessage());
            return CMD_signals.EXIT_INPUT_ERROR;
        }

        FlareAnalysis analysis;
        try {
            analysis = new FlareDetector(config.getFlare()).analyze(observations);
        } catch (RuntimeException e) {
            logger.error("Flare detection failed for {}", input, e);
            System.err.println("Error: flare detection failed: " + e.getMessage());
            return CMD_signals.EXIT_ANALYZER_ERROR;
        }

        try (Writer writer = Files.newBufferedWriter(output.getOutputPath(), StandardCharsets.UTF_8)) {
            writeCsv(analysis.dailyStates(), writer);
        } catch (IOException e) {
            logger.debug("Could not write {}", output, e);
            System.err.println("Error: could not write " + output.getOutputPath() + ": " + e.getMessage());
            return CMD_signals.EXIT_INPUT_ERROR;
        }

        System.out.printf("Exported %d days to %s%n", analysis.dailyStates().size(), output.getOutputPath());
        return CMD_signals.EXIT_OK;
    }

    static void writeCsv(List<DailyFlareState> states, Writer writer) throws IOException {
        writer.write(HEADER);
        writer.write('\n');
        for (DailyFlareState state : states) {
            writer.write(String.join(",",
                escape(state.date().toString()),
                escape(format(state.score())),
                escape(format(state.baseline())),
                escape(format(state.threshold())),
                escape(state.state().id())));
            writer.write('\n');
        }
    }

    /// Quotes a field holding a comma, quote or line break, doubling embedded quotes.
    static String escape(String value) {
        if (value.indexOf(',') >= 0 || value.indexOf('"') >= 0 || value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0) {
            return '"' + value.replace("\"", "\"\"") + '"';
        }
        return value;
    }

    private static String format(Double value) {
        return value == null ? "" : String.format(Locale.ROOT, "%.4f", value);
    }
}
