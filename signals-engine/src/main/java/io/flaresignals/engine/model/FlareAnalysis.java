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

import java.util.List;
import java.util.Objects;

/// Complete result of one flare detection pass.
///
/// `baseline` and `threshold` describe the most recent day and are null
/// while `confidence` is [BaselineConfidence#EARLY].
///
/// @param dailyBurdens one entry per calendar date, ascending
/// @param baseline the most recent day's trailing baseline, or null
/// @param confidence the tier backing the analysis
/// @param threshold the most recent day's flare threshold, or null
/// @param episodes detected flare episodes in chronological order
/// @param dailyStates one state per daily burden, ascending
/// @param currentState state of the most recent day
/// @param isActiveFlare true when an episode is still open
/// @param currentFlareDurationDays duration of the open episode, or null
public record FlareAnalysis(
    List<DailyBurden> dailyBurdens,
    Double baseline,
    BaselineConfidence confidence,
    Double threshold,
    List<FlareEpisode> episodes,
    List<DailyFlareState> dailyStates,
    FlareState currentState,
    boolean isActiveFlare,
    Integer currentFlareDurationDays
) {

    public FlareAnalysis {
        dailyBurdens = List.copyOf(dailyBurdens);
        episodes = List.copyOf(episodes);
        dailyStates = List.copyOf(dailyStates);
        Objects.requireNonNull(confidence, "confidence cannot be null");
        Objects.requireNonNull(currentState, "currentState cannot be null");
        if (dailyBurdens.size() != dailyStates.size()) {
            throw new IllegalArgumentException("expected one daily state per burden, got "
                + dailyStates.size() + " states for " + dailyBurdens.size() + " burdens");
        }
    }

    /// The result for an empty history.
    public static FlareAnalysis empty() {
        return new FlareAnalysis(List.of(), null, BaselineConfidence.EARLY, null,
            List.of(), List.of(), FlareState.STABLE, false, null);
    }
}
