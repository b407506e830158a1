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
import io.flaresignals.engine.config.EngineConfig;
import io.flaresignals.engine.config.SignalsGsonConfig;
import io.flaresignals.engine.flare.FlareDetector;
import io.flaresignals.engine.model.DailyFlareState;
import io.flaresignals.engine.model.FlareAnalysis;
import io.flaresignals.engine.model.FlareEpisode;
import io.flaresignals.engine.model.Observation;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/// Show the current flare state of an observation history.
///
/// ## Usage
///
/// ```bash
/// signals flares --input checkins.json
/// signals flares --input checkins.json --days 30 --config engine.json
/// signals flares --input checkins.json --json
/// ```
///
/// ## Output
///
/// The text report shows the current state, the baseline confidence, the
/// latest baseline and threshold, all detected episodes and the most recent
/// daily states. With `--json` the whole analysis is printed instead.
@CommandLine.Command(
    name = "flares",
    header = "Show flare state and episodes",
    description = "Detects flare episodes against a personal trailing baseline and classifies each day.",
    exitCodeList = {
        "0: Success",
        "1: Error reading input or configuration",
        "2: Flare detection failed"
    }
)
public class CMD_signals_flares implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_signals_flares.class);

    @CommandLine.Mixin
    private ObservationsInputOption input = new ObservationsInputOption();

    @CommandLine.Mixin
    private EngineConfigOption configOption = new EngineConfigOption();

    @CommandLine.Option(
        names = {"--days", "-d"},
        description = "Number of most recent daily states to list (default: ${DEFAULT-VALUE})",
        defaultValue = "14"
    )
    private int days;

    @CommandLine.Option(
        names = {"--json"},
        description = "Print the full analysis as JSON"
    )
    private boolean json = false;

    @Override
    public Integer call() {
        if (days < 0) {
            System.err.println("Error: --days must not be negative");
            return CMD_signals.EXIT_INPUT_ERROR;
        }

        List<Observation> observations;
        EngineConfig config;
        try {
            observations = input.load();
            config = configOption.load();
        } catch (IOException | RuntimeException e) {
            logger.debug("Could not load input from {}", input, e);
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

        if (json) {
            System.out.println(SignalsGsonConfig.gson().toJson(analysis));
        } else {
            printReport(analysis, observations.size());
        }
        return CMD_signals.EXIT_OK;
    }

    private void printReport(FlareAnalysis analysis, int observationCount) {
        System.out.printf(Locale.ROOT, "Observations:  %d over %d days%n", observationCount, analysis.dailyBurdens().size());
        System.out.printf(Locale.ROOT, "Current state: %s%n", analysis.currentState().label());
        System.out.printf(Locale.ROOT, "Confidence:    %s%n", analysis.confidence().id());
        System.out.printf(Locale.ROOT, "Baseline:      %s%n", formatScore(analysis.baseline()));
        System.out.printf(Locale.ROOT, "Threshold:     %s%n", formatScore(analysis.threshold()));
        if (analysis.isActiveFlare()) {
            System.out.printf(Locale.ROOT, "Active flare:  yes, %d days%n", analysis.currentFlareDurationDays());
        } else {
            System.out.println("Active flare:  no");
        }
        System.out.println();

        System.out.printf(Locale.ROOT, "Episodes (%d):%n", analysis.episodes().size());
        for (FlareEpisode episode : analysis.episodes()) {
            System.out.printf(Locale.ROOT, "  %s .. %s  %3d days  peak %s at %.2f%n",
                episode.startDate(),
                episode.isActive() ? "ongoing   " : episode.endDate().toString(),
                episode.durationDays(),
                episode.peakDate(),
                episode.peakScore());
        }
        System.out.println();

        List<DailyFlareState> states = analysis.dailyStates();
        List<DailyFlareState> recent = states.subList(Math.max(0, states.size() - days), states.size());
        System.out.printf(Locale.ROOT, "Last %d days:%n", recent.size());
        System.out.println("  Date          Score  Baseline  Threshold  State");
        for (DailyFlareState state : recent) {
            System.out.printf(Locale.ROOT, "  %-10s  %7.3f  %8s  %9s  %s%n",
                state.date(),
                state.score(),
                formatScore(state.baseline()),
                formatScore(state.threshold()),
                state.state().label());
        }
    }

    private static String formatScore(Double value) {
        return value == null ? "n/a" : String.format(Locale.ROOT, "%.3f", value);
    }
}
