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
import java.util.Objects;

/// The aggregated severity of one calendar date.
///
/// `score` lives on the symptom scale `0..3`. `skinIntensity` and
/// `symptomTotal` are the maxima seen that date and exist for display.
///
/// @param date the calendar date
/// @param score mean per-observation severity for the date
/// @param skinIntensity the highest skin intensity reported that date
/// @param symptomTotal the highest per-observation symptom severity total that date
/// @param observationCount how many observations were collapsed into this entry
public record DailyBurden(
    LocalDate date,
    double score,
    double skinIntensity,
    int symptomTotal,
    int observationCount
) {

    public DailyBurden {
        Objects.requireNonNull(date, "date cannot be null");
        if (observationCount < 1) {
            throw new IllegalArgumentException("a daily burden needs at least one observation, got: " + observationCount);
        }
    }

    /// Creates a burden with only a score, used when scores come from elsewhere.
    public static DailyBurden ofScore(LocalDate date, double score) {
        return new DailyBurden(date, score, 0.0, 0, 1);
    }
}
