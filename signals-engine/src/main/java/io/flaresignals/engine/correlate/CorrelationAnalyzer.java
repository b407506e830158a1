package io.flaresignals.engine.correlate;

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

import io.flaresignals.engine.SignalAnalyzer;
import io.flaresignals.engine.config.CorrelationConfig;
import io.flaresignals.engine.daily.DailyAggregator;
import io.flaresignals.engine.daily.ObservationWindow;
import io.flaresignals.engine.model.CorrelationConfidence;
import io.flaresignals.engine.model.CorrelationPattern;
import io.flaresignals.engine.model.CorrelationResult;
import io.flaresignals.engine.model.ExposureOutcome;
import io.flaresignals.engine.model.Observation;
import io.flaresignals.engine.model.TagCategory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/// Base for the per-category correlation analyzers.
///
/// For every candidate key of the category the analyzer collects the
/// exposure dates, evaluates each independent exposure with an
/// [ExposureEvaluator], classifies the outcomes with a [PatternClassifier]
/// and finally orders all candidates by [CorrelationRanking#ORDER].
///
/// Candidates logged on fewer than `minimumExposures` distinct dates are
/// reported as insufficient data with zero outcome counts. Their exposure
/// count is still reported.
///
/// Subclasses only choose the [TagCategory]. The configuration is copied on
/// construction, so later changes to the caller's instance have no effect.
public abstract class CorrelationAnalyzer implements SignalAnalyzer<List<CorrelationResult>> {

    private static final Logger logger = LogManager.getLogger(CorrelationAnalyzer.class);

    private final TagCategory category;
    private final CorrelationConfig config;
    private final ExposureEvaluator evaluator;
    private final PatternClassifier classifier;

    protected CorrelationAnalyzer(TagCategory category, CorrelationConfig config) {
        this.category = Objects.requireNonNull(category, "category cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null").copy().validate();
        this.evaluator = new ExposureEvaluator(this.config);
        this.classifier = new PatternClassifier(this.config);
    }

    /// Creates the analyzer for a category.
    ///
    /// @param category the candidate tag category
    /// @param config correlation parameters
    /// @return the matching registered analyzer
    public static CorrelationAnalyzer forCategory(TagCategory category, CorrelationConfig config) {
        return switch (category) {
            case FOOD -> new FoodCorrelationAnalyzer(config);
            case PRODUCT -> new ProductCorrelationAnalyzer(config);
            case TRIGGER -> new TriggerCorrelationAnalyzer(config);
        };
    }

    public TagCategory getCategory() {
        return category;
    }

    /// Returns a copy of the configuration in use.
    public CorrelationConfig getConfig() {
        return config.copy();
    }

    @Override
    public String getDescription() {
        return "Ranks " + category.id() + " tags by how often they precede a change in skin intensity";
    }

    @Override
    public List<CorrelationResult> analyze(List<Observation> observations) {
        Objects.requireNonNull(observations, "observations cannot be null");
        NavigableMap<LocalDate, Double> intensity = DailyAggregator.dailyIntensity(observations);
        NavigableMap<LocalDate, Set<String>> tagsByDate = DailyAggregator.dailyTags(observations, category);

        Map<String, NavigableSet<LocalDate>> exposures = new TreeMap<>();
        for (Map.Entry<LocalDate, Set<String>> day : tagsByDate.entrySet()) {
            for (String key : day.getValue()) {
                exposures.computeIfAbsent(key, k -> new TreeSet<>()).add(day.getKey());
            }
        }

        List<CorrelationResult> results = new ArrayList<>(exposures.size());
        for (Map.Entry<String, NavigableSet<LocalDate>> candidate : exposures.entrySet()) {
            results.add(correlate(candidate.getKey(), candidate.getValue(), intensity, tagsByDate));
        }
        results.sort(CorrelationRanking.ORDER);

        logger.debug("Correlated {} {} candidates over {} observations and {} days",
            results.size(), category.id(), observations.size(), intensity.size());
        return results;
    }

    /// Correlates only the observations inside a lookback period.
    ///
    /// @param observations the full history
    /// @param asOf last date of the period
    /// @param periodDays days back from `asOf`; [ObservationWindow#ALL_HISTORY_DAYS] or more keeps everything
    /// @return ranked results for the period
    public List<CorrelationResult> analyze(List<Observation> observations, LocalDate asOf, int periodDays) {
        Objects.requireNonNull(observations, "observations cannot be null");
        return analyze(ObservationWindow.within(observations, asOf, periodDays));
    }

    private CorrelationResult correlate(String key, NavigableSet<LocalDate> exposureDates,
                                        NavigableMap<LocalDate, Double> intensity,
                                        NavigableMap<LocalDate, Set<String>> tagsByDate) {
        int total = exposureDates.size();
        String name = CorrelationResult.displayName(key);
        if (total < config.getMinimumExposures()) {
            return new CorrelationResult(key, name, category, total, 0, 0, 0, 0,
                CorrelationPattern.INSUFFICIENT_DATA, 0.0, CorrelationConfidence.LOW);
        }

        int worse = 0;
        int better = 0;
        int neutral = 0;
        for (ExposureOutcome outcome : evaluator.evaluate(key, exposureDates, intensity, tagsByDate)) {
            switch (outcome) {
                case WORSE -> worse++;
                case BETTER -> better++;
                case NEUTRAL -> neutral++;
            }
        }
        CorrelationPattern pattern = classifier.pattern(worse, better, neutral);
        double consistency = classifier.consistency(worse, better, neutral);
        CorrelationConfidence confidence = classifier.confidence(total, consistency);
        return new CorrelationResult(key, name, category, total, worse, better, neutral,
            worse + better + neutral, pattern, consistency, confidence);
    }
}
