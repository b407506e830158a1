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

/// The per-day output of the flare detector.
///
/// @param date the calendar date
/// @param score the day's aggregated severity
/// @param baseline trailing baseline from prior days, or null when no prior day is in the window
/// @param threshold baseline plus margin, or null while the day is confidence gated
/// @param state the state assigned to the day
/// @param inEpisode true when the day belongs to a flare episode
public record DailyFlareState(
    LocalDate date,
    double score,
    Double baseline,
    Double threshold,
    FlareState state,
    boolean inEpisode
) {

    public DailyFlareState {
        Objects.requireNonNull(date, "date cannot be null");
        Objects.requireNonNull(state, "state cannot be null");
    }
}
