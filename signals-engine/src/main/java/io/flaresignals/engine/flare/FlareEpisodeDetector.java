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
import io.flaresignals.engine.model.FlareEpisode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/// Finds runs of consecutive flare-level days and promotes long runs to episodes.
///
/// ```text
///   score     ▲                 ●  ●
///             │              ●        ●
///   threshold ┼ ─ ─ ─ ─ ─ ─ ─ ─ ─ ─ ─ ─ ─ ─ ─    (recomputed per day)
///             │  ●  ●  ●                   ●
///             └──────────────────────────────▶ date
///                            └── run of 5 ──┘  -> episode, peak = first max
/// ```
///
/// A day is flare-level when it has a threshold and its score reaches it.
/// Each day is judged against its own threshold, derived from its own trailing
/// baseline. A run continues only across consecutive calendar dates: a missing
/// day ends it. A run becomes an episode once it reaches `minEpisodeDays`
/// days. The peak is the highest scoring day, the earliest one on ties. A run
/// still going on the last available day yields an open episode
/// (`endDate == null`, `isActive == true`).
public final class FlareEpisodeDetector {

    private final int minEpisodeDays;

    public FlareEpisodeDetector(int minEpisodeDays) {
        if (minEpisodeDays < 3) {
            throw new IllegalArgumentException("minEpisodeDays must be at least 3, got: " + minEpisodeDays);
        }
        this.minEpisodeDays = minEpisodeDays;
    }

    /// Scans a burden series.
    ///
    /// @param burdens daily burdens in ascending date order
    /// @param thresholds one threshold per burden, null where the day is gated or has no baseline
    /// @return the episodes plus per-day run information
    public EpisodeScan scan(List<DailyBurden> burdens, Double[] thresholds) {
        if (burdens.size() != thresholds.length) {
            throw new IllegalArgumentException("expected " + burdens.size() + " thresholds, got " + thresholds.length);
        }
        int n = burdens.size();
        int[] runLengths = new int[n];
        int[] episodeIndexes = new int[n];
        Arrays.fill(episodeIndexes, -1);
        List<FlareEpisode> episodes = new ArrayList<>();

        int runStart = -1;
        for (int i = 0; i < n; i++) {
            DailyBurden day = burdens.get(i);
            boolean flareLevel = thresholds[i] != null && day.score() >= thresholds[i];
            boolean continues = runStart >= 0
                && burdens.get(i - 1).date().plusDays(1).equals(day.date());

            if (runStart >= 0 && (!flareLevel || !continues)) {
                closeRun(burdens, runStart, i - 1, false, episodes, episodeIndexes);
                runStart = -1;
            }
            if (flareLevel) {
                if (runStart < 0) {
                    runStart = i;
                }
                runLengths[i] = i - runStart + 1;
            }
        }
        if (runStart >= 0) {
            closeRun(burdens, runStart, n - 1, true, episodes, episodeIndexes);
        }
        return new EpisodeScan(episodes, runLengths, episodeIndexes);
    }

    private void closeRun(List<DailyBurden> burdens, int start, int end, boolean open,
                          List<FlareEpisode> episodes, int[] episodeIndexes) {
        int length = end - start + 1;
        if (length < minEpisodeDays) {
            return;
        }
        int peak = start;
        for (int i = start + 1; i <= end; i++) {
            if (burdens.get(i).score() > burdens.get(peak).score()) {
                peak = i;
            }
        }
        episodes.add(new FlareEpisode(
            burdens.get(start).date(),
            open ? null : burdens.get(end).date(),
            burdens.get(peak).date(),
            length,
            burdens.get(peak).score(),
            open));
        Arrays.fill(episodeIndexes, start, end + 1, episodes.size() - 1);
    }
}
