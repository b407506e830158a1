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

import io.flaresignals.engine.model.DailyBurden;
import io.flaresignals.engine.model.DailyFlareState;
import io.flaresignals.engine.model.FlareEpisode;
import io.flaresignals.engine.model.FlareState;

import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/// Labels every day with a [FlareState].
///
/// Rules, first match wins:
///
/// | Condition | State |
/// |-----------|-------|
/// | day is confidence gated | `stable` |
/// | day is the peak of its episode | `peak_flare` |
/// | day is inside an episode | `active_flare` |
/// | score reaches threshold, run shorter than an episode, score above prior day | `pre_flare` |
/// | 1..`resolvingWindowDays` after a closed episode, score below prior day | `resolving_flare` |
/// | otherwise | `stable` |
///
/// "Prior day" is the previous logged entry.
public final class DailyStateClassifier {

    private final int minEpisodeDays;
    private final int resolvingWindowDays;

    public DailyStateClassifier(int minEpisodeDays, int resolvingWindowDays) {
        this.minEpisodeDays = minEpisodeDays;
        this.resolvingWindowDays = resolvingWindowDays;
    }

    /// Classifies each day of a scanned series.
    ///
    /// @param burdens daily burdens in ascending date order
    /// @param baselines trailing baselines, one per burden
    /// @param thresholds thresholds, one per burden, null where gated or undefined
    /// @param gated per-day confidence gate
    /// @param scan the episode scan of the same series
    /// @return one state per burden
    public List<DailyFlareState> classify(List<DailyBurden> burdens, Double[] baselines, Double[] thresholds,
                                          boolean[] gated, EpisodeScan scan) {
        List<DailyFlareState> states = new ArrayList<>(burdens.size());
        for (int i = 0; i < burdens.size(); i++) {
            DailyBurden day = burdens.get(i);
            FlareEpisode episode = scan.episodeAt(i);
            FlareState state;
            if (gated[i]) {
                state = FlareState.STABLE;
            } else if (episode != null) {
                state = episode.peakDate().equals(day.date()) ? FlareState.PEAK_FLARE : FlareState.ACTIVE_FLARE;
            } else if (isPreFlare(burdens, thresholds, scan, i)) {
                state = FlareState.PRE_FLARE;
            } else if (isResolving(burdens, scan.episodes(), i)) {
                state = FlareState.RESOLVING_FLARE;
            } else {
                state = FlareState.STABLE;
            }
            states.add(new DailyFlareState(day.date(), day.score(), baselines[i], thresholds[i], state, episode != null));
        }
        return states;
    }

    private boolean isPreFlare(List<DailyBurden> burdens, Double[] thresholds, EpisodeScan scan, int i) {
        if (i == 0 || thresholds[i] == null) {
            return false;
        }
        double score = burdens.get(i).score();
        return score >= thresholds[i]
            && scan.runLength(i) < minEpisodeDays
            && score > burdens.get(i - 1).score();
    }

    private boolean isResolving(List<DailyBurden> burdens, List<FlareEpisode> episodes, int i) {
        if (i == 0 || burdens.get(i).score() >= burdens.get(i - 1).score()) {
            return false;
        }
        for (FlareEpisode episode : episodes) {
            if (episode.endDate() == null) {
                continue;
            }
            long daysSinceEnd = ChronoUnit.DAYS.between(episode.endDate(), burdens.get(i).date());
            if (daysSinceEnd >= 1 && daysSinceEnd <= resolvingWindowDays) {
                return true;
            }
        }
        return false;
    }
}
