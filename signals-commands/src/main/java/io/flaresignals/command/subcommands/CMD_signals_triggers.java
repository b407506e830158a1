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
import io.flaresignals.engine.correlate.CorrelationAnalyzer;
import io.flaresignals.engine.daily.ObservationWindow;
import io.flaresignals.engine.model.CorrelationResult;
import io.flaresignals.engine.model.Observation;
import io.flaresignals.engine.model.TagCategory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/// Rank the tags of one category by how often they precede a skin change.
///
/// ## Usage
///
/// ```bash
/// signals triggers --input checkins.json
/// signals triggers --input checkins.json --category product --period-days 90 --as-of 2024-06-30
/// ```
///
/// Without `--as-of` the lookback period ends on the date of the latest observation.
@CommandLine.Command(
    name = "triggers",
    header = "Rank possible triggers",
    description = "Correlates food, product or general trigger tags with the skin intensity of the following days.",
    exitCodeList = {
        "0: Success",
        "1: Error reading input or configuration",
        "2: Correlation failed"
    }
)
public class CMD_signals_triggers implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_signals_triggers.class);

    @CommandLine.Mixin
    private ObservationsInputOption input = new ObservationsInputOption();

    @CommandLine.Mixin
    private EngineConfigOption configOption = new EngineConfigOption();

    @CommandLine.Option(
        names = {"--category", "-c"},
        description = "Tag category: food, product or trigger (default: ${DEFAULT-VALUE})",
        defaultValue = "food"
    )
    private String category;

    @CommandLine.Option(
        names = {"--as-of"},
        description = "Last date of the lookback period, yyyy-MM-dd (default: latest observation date)"
    )
    private LocalDate asOf;

    @CommandLine.Option(
        names = {"--period-days"},
        description = "Lookback period in days, 9999 or more for all history (default: ${DEFAULT-VALUE})",
        defaultValue = "9999"
    )
    private int periodDays;

    @CommandLine.Option(
        names = {"--json"},
        description = "Print the ranked results as JSON"
    )
    private boolean json = false;

    @Override
    public Integer call() {
        TagCategory tagCategory;
        List<Observation> observations;
        EngineConfig config;
        try {
            tagCategory = TagCategory.fromId(category);
            if (periodDays < 0) {
                throw new IllegalArgumentException("--period-days must not be negative, got: " + periodDays);
            }
            observations = input.load();
            config = configOption.load();
        } catch (IOException | RuntimeException e) {
            logger.debug("Could not load input from {}", input, e);
            System.err.println("Error: " + e.getMessage());
            return CMD_signals.EXIT_INPUT_ERROR;
        }

        LocalDate end = asOf != null ? asOf : latestDate(observations);
        List<CorrelationResult> results;
        try {
            CorrelationAnalyzer analyzer = CorrelationAnalyzer.forCategory(tagCategory, config.getCorrelation());
            results = end == null ? List.of() : analyzer.analyze(observations, end, periodDays);
        } catch (RuntimeException e) {
            logger.error("Correlation of {} tags failed for {}", tagCategory.id(), input, e);
            System.err.println("Error: correlation failed: " + e.getMessage());
            return CMD_signals.EXIT_ANALYZER_ERROR;
        }

        if (json) {
            System.out.println(SignalsGsonConfig.gson().toJson(results));
        } else {
            printTable(tagCategory, end, results);
        }
        return CMD_signals.EXIT_OK;
    }

    private void printTable(TagCategory tagCategory, LocalDate end, List<CorrelationResult> results) {
        if (results.isEmpty()) {
            System.out.printf("No %s tags found%n", tagCategory.id());
            return;
        }
        String period = periodDays >= ObservationWindow.ALL_HISTORY_DAYS
            ? "all history"
            : periodDays + " days up to " + end;
        System.out.printf(Locale.ROOT, "%s candidates (%s):%n", CorrelationResult.displayName(tagCategory.id()), period);
        System.out.println("Rank  Name                  Days  Worse  Better  Neutral  Consistency  Pattern                            Confidence");
        int rank = 1;
        for (CorrelationResult result : results) {
            System.out.printf(Locale.ROOT, "%4d  %-20s  %4d  %5d  %6d  %7d  %11.2f  %-33s  %s%n",
                rank++,
                result.name(),
                result.totalExposureDays(),
                result.worseDays(),
                result.betterDays(),
                result.neutralDays(),
                result.consistency(),
                result.pattern().label(),
                result.confidence().label());
        }
    }

    private static LocalDate latestDate(List<Observation> observations) {
        LocalDate latest = null;
        for (Observation observation : observations) {
            if (latest == null || observation.date().isAfter(latest)) {
                latest = observation.date();
            }
        }
        return latest;
    }
}
