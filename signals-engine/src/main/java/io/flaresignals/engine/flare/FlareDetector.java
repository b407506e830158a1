package io.flaresignals.engine.flare;

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

import io.flaresignals.engine.AnalyzerName;
import io.flaresignals.engine.SignalAnalyzer;
import io.flaresignals.engine.config.FlareDetectionConfig;
import io.flaresignals.engine.daily.DailyAggregator;
import io.flaresignals.engine.model.BaselineConfidence;
import io.flaresignals.engine.model.DailyBurden;
import io.flaresignals.engine.model.DailyFlareState;
import io.flaresignals.engine.model.FlareAnalysis;
import io.flaresignals.engine.model.FlareEpisode;
import io.flaresignals.engine.model.FlareState;
import io.flaresignals.engine.model.Observation;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;

/// Detects flare episodes in an observation history.
///
/// ## Pipeline
///
/// ```text
/// observations ─▶ DailyAggregator ─▶ daily burdens
///                                        │
///                 BaselineEstimator ◀────┤   trailing 14 day mean per day
///                 ConfidenceGate    ◀────┤   early / provisional / mature per day
///                                        ▼
///                          threshold = baseline + margin (null when gated)
///                                        │
///                 FlareEpisodeDetector ◀─┘   runs of consecutive flare-level days
///                                        │
///                 DailyStateClassifier ◀─┘   stable / pre / active / peak / resolving
/// ```
///
/// The top level `baseline` and `threshold` are those of the most recent day
/// and stay null while the overall confidence is early. Each call recomputes
/// everything from the full history.
///
/// ## Usage
///
/// ```java
/// FlareAnalysis analysis = new FlareDetector().analyze(observations);
/// if (analysis.isActiveFlare()) {
///     int days = analysis.currentFlareDurationDays();
/// }
/// ```
@AnalyzerName(FlareDetector.ANALYZER_TYPE)
public final class FlareDetector implements SignalAnalyzer<FlareAnalysis> {

    private static final Logger logger = LogManager.getLogger(FlareDetector.class);

    public static final String ANALYZER_TYPE = "flare";

    private final FlareDetectionConfig config;
    private final ConfidenceGate gate;
    private final BaselineEstimator estimator;
    private final FlareEpisodeDetector episodeDetector;
    private final DailyStateClassifier classifier;

    /// Creates a detector with the default configuration.
    public FlareDetector() {
        this(FlareDetectionConfig.defaults());
    }

    /// Creates a detector with the given configuration.
    ///
    /// The detector keeps a validated copy, so later changes to `config` have no effect.
    ///
    /// @param config detection parameters, validated on construction
    public FlareDetector(FlareDetectionConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null").copy().validate();
        this.gate = new ConfidenceGate(this.config);
        this.estimator = new BaselineEstimator(this.config.getBaselineWindowDays());
        this.episodeDetector = new FlareEpisodeDetector(this.config.getMinEpisodeDays());
        this.classifier = new DailyStateClassifier(this.config.getMinEpisodeDays(), this.config.getResolvingWindowDays());
    }

    @Override
    public String getAnalyzerType() {
        return ANALYZER_TYPE;
    }

    @Override
    public String getDescription() {
        return "Flare episodes and daily flare states against a personal trailing baseline";
    }

    /// Returns a copy of the configuration in use.
    public FlareDetectionConfig getConfig() {
        return config.copy();
    }

    @Override
    public FlareAnalysis analyze(List<Observation> observations) {
        Objects.requireNonNull(observations, "observations cannot be null");
        if (observations.isEmpty()) {
            return FlareAnalysis.empty();
        }
        return analyzeBurdens(DailyAggregator.dailyBurdens(observations));
    }

    /// Runs detection over precomputed daily burdens.
    ///
    /// @param burdens one burden per date, strictly ascending
    /// @return the analysis
    /// @throws IllegalArgumentException if dates are not strictly ascending
    public FlareAnalysis analyzeBurdens(List<DailyBurden> burdens) {
        Objects.requireNonNull(burdens, "burdens cannot be null");
        if (burdens.isEmpty()) {
            return FlareAnalysis.empty();
        }
        for (int i = 1; i < burdens.size(); i++) {
            if (!burdens.get(i).date().isAfter(burdens.get(i - 1).date())) {
                throw new IllegalArgumentException("daily burdens must have strictly ascending dates, found "
                    + burdens.get(i).date() + " after " + burdens.get(i - 1).date());
            }
        }

        int n = burdens.size();
        Double[] baselines = estimator.trailingBaselines(burdens);
        Double[] thresholds = new Double[n];
        boolean[] gated = new boolean[n];
        for (int i = 0; i < n; i++) {
            gated[i] = gate.isGated(i + 1);
            thresholds[i] = gated[i] || baselines[i] == null ? null : baselines[i] + config.getThresholdMargin();
        }

        EpisodeScan scan = episodeDetector.scan(burdens, thresholds);
        List<DailyFlareState> states = classifier.classify(burdens, baselines, thresholds, gated, scan);

        BaselineConfidence confidence = gate.tierFor(n);
        Double baseline = confidence == BaselineConfidence.EARLY ? null : baselines[n - 1];
        Double threshold = confidence == BaselineConfidence.EARLY ? null : thresholds[n - 1];

        FlareEpisode active = scan.episodes().stream()
            .filter(FlareEpisode::isActive)
            .findFirst()
            .orElse(null);
        FlareState currentState = states.get(n - 1).state();

        logger.debug("Analyzed {} days: confidence={}, baseline={}, threshold={}, episodes={}, current={}",
            n, confidence.id(), baseline, threshold, scan.episodes().size(), currentState.id());

        return new FlareAnalysis(
            burdens,
            baseline,
            confidence,
            threshold,
            scan.episodes(),
            states,
            currentState,
            active != null,
            active != null ? active.durationDays() : null);
    }
}
