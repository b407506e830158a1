package io.flaresignals.engine.daily;

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

import io.flaresignals.engine.model.DailyBurden;
import io.flaresignals.engine.model.Observation;
import io.flaresignals.engine.model.SymptomEntry;
import io.flaresignals.engine.model.TagCategory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/// Collapses same-day observations into date-indexed series.
///
/// ## Per-observation severity
///
/// Skin intensity (`0..5`) is first mapped onto the symptom scale (`0..3`):
///
/// ```text
///   normalizedIntensity = intensity * 3 / 5
///
///   with symptoms:     severity = 0.5 * meanSymptomSeverity + 0.5 * normalizedIntensity
///   without symptoms:  severity = normalizedIntensity
/// ```
///
/// A date's burden score is the mean severity of its observations. Multiple
/// same-day observations are averaged, never summed or overwritten.
///
/// All series are keyed by calendar date in ascending order. Same-day values
/// are summed in ascending numeric order, so every mean is bit-identical for
/// any ordering of the input, including records that share a timestamp and id.
public final class DailyAggregator {

    private static final double INTENSITY_TO_SEVERITY = SymptomEntry.MAX_SEVERITY / Observation.MAX_SKIN_INTENSITY;

    private DailyAggregator() {
    }

    /// Severity of a single observation on the `0..3` scale.
    public static double observationSeverity(Observation observation) {
        double normalizedIntensity = observation.effectiveIntensity() * INTENSITY_TO_SEVERITY;
        if (!observation.hasSymptoms()) {
            return normalizedIntensity;
        }
        return 0.5 * observation.meanSymptomSeverity() + 0.5 * normalizedIntensity;
    }

    /// Groups observations by calendar date, each day's list in chronological order.
    ///
    /// @param observations observations in any order
    /// @return an ascending map from date to that date's observations
    public static NavigableMap<LocalDate, List<Observation>> byDate(Collection<Observation> observations) {
        List<Observation> sorted = new ArrayList<>(observations);
        sorted.sort(Observation.CHRONOLOGICAL);
        NavigableMap<LocalDate, List<Observation>> byDate = new TreeMap<>();
        for (Observation observation : sorted) {
            byDate.computeIfAbsent(observation.date(), d -> new ArrayList<>()).add(observation);
        }
        return byDate;
    }

    /// Builds one [DailyBurden] per distinct calendar date.
    ///
    /// @param observations observations in any order
    /// @return burdens in ascending date order
    public static List<DailyBurden> dailyBurdens(Collection<Observation> observations) {
        List<DailyBurden> burdens = new ArrayList<>();
        for (Map.Entry<LocalDate, List<Observation>> day : byDate(observations).entrySet()) {
            List<Observation> sameDay = day.getValue();
            double[] severities = new double[sameDay.size()];
            double maxIntensity = 0.0;
            int maxSymptomTotal = 0;
            for (int i = 0; i < severities.length; i++) {
                Observation observation = sameDay.get(i);
                severities[i] = observationSeverity(observation);
                maxIntensity = Math.max(maxIntensity, observation.effectiveIntensity());
                maxSymptomTotal = Math.max(maxSymptomTotal, observation.totalSymptomSeverity());
            }
            burdens.add(new DailyBurden(day.getKey(), orderedMean(severities), maxIntensity, maxSymptomTotal,
                severities.length));
        }
        return burdens;
    }

    /// Mean skin intensity (`0..5`) per calendar date, independent of symptoms.
    ///
    /// @param observations observations in any order
    /// @return an ascending, unmodifiable map from date to mean intensity
    public static NavigableMap<LocalDate, Double> dailyIntensity(Collection<Observation> observations) {
        NavigableMap<LocalDate, Double> intensity = new TreeMap<>();
        for (Map.Entry<LocalDate, List<Observation>> day : byDate(observations).entrySet()) {
            double[] values = day.getValue().stream().mapToDouble(Observation::effectiveIntensity).toArray();
            intensity.put(day.getKey(), orderedMean(values));
        }
        return Collections.unmodifiableNavigableMap(intensity);
    }

    /// Candidate keys of one category present on each date.
    ///
    /// Dates without any tag of the category are absent from the map.
    ///
    /// @param observations observations in any order
    /// @param category the tag category to extract
    /// @return an ascending map from date to the sorted set of candidate keys
    public static NavigableMap<LocalDate, Set<String>> dailyTags(Collection<Observation> observations, TagCategory category) {
        NavigableMap<LocalDate, Set<String>> tags = new TreeMap<>();
        for (Observation observation : observations) {
            for (String tag : observation.tags()) {
                Optional<String> key = category.candidateKey(tag);
                key.ifPresent(k -> tags.computeIfAbsent(observation.date(), d -> new TreeSet<>()).add(k));
            }
        }
        return tags;
    }

    /// Mean of the values summed in ascending order. Sorts `values` in place.
    static double orderedMean(double[] values) {
        Arrays.sort(values);
        double total = 0.0;
        for (double value : values) {
            total += value;
        }
        return total / values.length;
    }
}
