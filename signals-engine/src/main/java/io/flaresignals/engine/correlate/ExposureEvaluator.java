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

import io.flaresignals.engine.config.CorrelationConfig;
import io.flaresignals.engine.model.ExposureOutcome;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Set;

/// Judges each independent exposure of one candidate against a local control baseline.
///
/// ```text
///            local baseline window (±7, minus D and other exposure days)
///     ├─────────────────────────┼─────────────────────────┤
///   D-7                         D   D+1  D+2  D+3        D+7
///                                   └ reaction ┘
///
///   delta = mean(reaction days) - mean(control days)
///   delta >= worseDelta  -> WORSE
///   delta <= betterDelta -> BETTER
///   otherwise            -> NEUTRAL
/// ```
///
/// Exposure dates are walked in ascending order. Evaluating an exposure on D
/// marks later exposures inside its reaction window as already covered, so a
/// streak of daily exposures counts as one trial. An exposure without any
/// logged reaction day, or without any control day, is not analyzable and
/// yields no outcome.
public final class ExposureEvaluator {

    private final int reactionWindowDays;
    private final int localBaselineWindowDays;
    private final double worseDelta;
    private final double betterDelta;

    public ExposureEvaluator(CorrelationConfig config) {
        this.reactionWindowDays = config.getReactionWindowDays();
        this.localBaselineWindowDays = config.getLocalBaselineWindowDays();
        this.worseDelta = config.getWorseDelta();
        this.betterDelta = config.getBetterDelta();
    }

    /// Evaluates every independent exposure of a candidate.
    ///
    /// @param key the candidate key
    /// @param exposureDates the dates on which the candidate was logged
    /// @param intensity mean skin intensity per date
    /// @param tagsByDate candidate keys present on each date
    /// @return one outcome per analyzable exposure, in date order
    public List<ExposureOutcome> evaluate(String key, NavigableSet<LocalDate> exposureDates,
                                          NavigableMap<LocalDate, Double> intensity,
                                          Map<LocalDate, Set<String>> tagsByDate) {
        List<ExposureOutcome> outcomes = new ArrayList<>();
        Set<LocalDate> covered = new HashSet<>();
        for (LocalDate exposure : exposureDates) {
            if (covered.contains(exposure)) {
                continue;
            }
            LocalDate reactionEnd = exposure.plusDays(reactionWindowDays);
            covered.addAll(exposureDates.subSet(exposure, false, reactionEnd, true));

            Double reaction = mean(intensity.subMap(exposure, false, reactionEnd, true).values());
            if (reaction == null) {
                continue;
            }
            Double control = localBaseline(key, exposure, intensity, tagsByDate);
            if (control == null) {
                continue;
            }
            outcomes.add(classify(reaction - control));
        }
        return outcomes;
    }

    /// Mean intensity of the days around an exposure that do not carry the candidate.
    ///
    /// @return the control mean, or null when no such day was logged
    public Double localBaseline(String key, LocalDate exposure, NavigableMap<LocalDate, Double> intensity,
                                Map<LocalDate, Set<String>> tagsByDate) {
        double total = 0.0;
        int count = 0;
        NavigableMap<LocalDate, Double> window = intensity.subMap(
            exposure.minusDays(localBaselineWindowDays), true,
            exposure.plusDays(localBaselineWindowDays), true);
        for (Map.Entry<LocalDate, Double> day : window.entrySet()) {
            if (day.getKey().equals(exposure)) {
                continue;
            }
            Set<String> tags = tagsByDate.get(day.getKey());
            if (tags != null && tags.contains(key)) {
                continue;
            }
            total += day.getValue();
            count++;
        }
        return count == 0 ? null : total / count;
    }

    public ExposureOutcome classify(double delta) {
        if (delta >= worseDelta) {
            return ExposureOutcome.WORSE;
        }
        if (delta <= betterDelta) {
            return ExposureOutcome.BETTER;
        }
        return ExposureOutcome.NEUTRAL;
    }

    private static Double mean(Iterable<Double> values) {
        double total = 0.0;
        int count = 0;
        for (Double value : values) {
            total += value;
            count++;
        }
        return count == 0 ? null : total / count;
    }
}
