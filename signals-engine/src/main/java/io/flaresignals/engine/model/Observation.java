package io.flaresignals.engine.model;

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

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/// A single self-reported check-in.
///
/// ## Skin condition
///
/// Every observation carries an overall skin condition, either directly as
/// `skinIntensity` on the `0..5` scale (0 = clear, 5 = worst) or as its
/// inverse `skinFeeling` on the `1..5` scale (5 = feeling great). When both
/// are present the intensity wins. [#effectiveIntensity()] resolves the two
/// into the `0..5` intensity scale used by every analyzer.
///
/// ## Calendar semantics
///
/// The timestamp is a local wall-clock value. [#date()] is its calendar date,
/// with no timezone conversion of any kind.
///
/// @param id caller identifier, used only as a tie breaker when ordering
/// @param timestamp local date and time of the check-in
/// @param symptoms reported symptoms, possibly empty
/// @param skinIntensity skin intensity on `[0, 5]`, or null
/// @param skinFeeling skin feeling on `[1, 5]`, or null
/// @param pain pain score on `[0, 10]`, or null
/// @param sleep sleep quality on `[1, 5]`, or null
/// @param mood mood on `[1, 5]`, or null
/// @param tags free text tags, some carrying a category prefix such as `food:`
public record Observation(
    String id,
    LocalDateTime timestamp,
    List<SymptomEntry> symptoms,
    Double skinIntensity,
    Integer skinFeeling,
    Integer pain,
    Integer sleep,
    Integer mood,
    List<String> tags
) {

    /// Upper bound of the skin intensity scale.
    public static final double MAX_SKIN_INTENSITY = 5.0;

    /// Chronological order, ties broken by id so that grouping is stable.
    public static final Comparator<Observation> CHRONOLOGICAL =
        Comparator.comparing(Observation::timestamp)
            .thenComparing(o -> o.id() == null ? "" : o.id());

    public Observation {
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
        symptoms = symptoms == null ? List.of() : List.copyOf(symptoms);
        tags = tags == null ? List.of() : List.copyOf(tags);
        if (skinIntensity == null && skinFeeling == null) {
            throw new IllegalArgumentException("observation " + id + " has neither skin intensity nor skin feeling");
        }
        if (skinIntensity != null && (skinIntensity < 0 || skinIntensity > MAX_SKIN_INTENSITY || skinIntensity.isNaN())) {
            throw new IllegalArgumentException("skin intensity must be in [0,5], got: " + skinIntensity);
        }
        checkRange("skin feeling", skinFeeling, 1, 5);
        checkRange("pain", pain, 0, 10);
        checkRange("sleep", sleep, 1, 5);
        checkRange("mood", mood, 1, 5);
    }

    private static void checkRange(String field, Integer value, int min, int max) {
        if (value != null && (value < min || value > max)) {
            throw new IllegalArgumentException(field + " must be in [" + min + "," + max + "], got: " + value);
        }
    }

    /// Returns the calendar date of this observation.
    public LocalDate date() {
        return timestamp.toLocalDate();
    }

    /// Returns the skin intensity on the `0..5` scale, falling back to
    /// `5 - skinFeeling` when no intensity was reported.
    public double effectiveIntensity() {
        if (skinIntensity != null) {
            return skinIntensity;
        }
        return MAX_SKIN_INTENSITY - skinFeeling;
    }

    public boolean hasSymptoms() {
        return !symptoms.isEmpty();
    }

    /// Mean severity of the reported symptoms, or 0 when there are none.
    public double meanSymptomSeverity() {
        if (symptoms.isEmpty()) {
            return 0.0;
        }
        return (double) totalSymptomSeverity() / symptoms.size();
    }

    /// Sum of the reported symptom severities.
    public int totalSymptomSeverity() {
        int total = 0;
        for (SymptomEntry symptom : symptoms) {
            total += symptom.severity();
        }
        return total;
    }

    /// Starts a builder for an observation at the given local time.
    ///
    /// @param id the observation id
    /// @param timestamp local date and time
    /// @return a new builder
    public static Builder builder(String id, LocalDateTime timestamp) {
        return new Builder(id, timestamp);
    }

    /// Fluent builder, mostly for callers assembling observations by hand.
    public static final class Builder {
        private final String id;
        private final LocalDateTime timestamp;
        private final List<SymptomEntry> symptoms = new ArrayList<>();
        private final List<String> tags = new ArrayList<>();
        private Double skinIntensity;
        private Integer skinFeeling;
        private Integer pain;
        private Integer sleep;
        private Integer mood;

        private Builder(String id, LocalDateTime timestamp) {
            this.id = id;
            this.timestamp = timestamp;
        }

        public Builder skinIntensity(double skinIntensity) {
            this.skinIntensity = skinIntensity;
            return this;
        }

        public Builder skinFeeling(int skinFeeling) {
            this.skinFeeling = skinFeeling;
            return this;
        }

        public Builder symptom(String name, int severity) {
            this.symptoms.add(new SymptomEntry(name, severity));
            return this;
        }

        public Builder pain(int pain) {
            this.pain = pain;
            return this;
        }

        public Builder sleep(int sleep) {
            this.sleep = sleep;
            return this;
        }

        public Builder mood(int mood) {
            this.mood = mood;
            return this;
        }

        public Builder tag(String tag) {
            this.tags.add(tag);
            return this;
        }

        public Builder tags(String... tags) {
            this.tags.addAll(List.of(tags));
            return this;
        }

        public Observation build() {
            return new Observation(id, timestamp, symptoms, skinIntensity, skinFeeling, pain, sleep, mood, tags);
        }
    }
}
