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

import io.flaresignals.engine.model.FlareEpisode;

import java.util.List;

/// The outcome of scanning a burden series for flare-level runs.
///
/// Alongside the promoted episodes it keeps, per day, the length of the
/// above-threshold run ending on that day and the episode the day belongs to.
public final class EpisodeScan {

    private final List<FlareEpisode> episodes;
    private final int[] runLengths;
    private final int[] episodeIndexes;

    EpisodeScan(List<FlareEpisode> episodes, int[] runLengths, int[] episodeIndexes) {
        this.episodes = List.copyOf(episodes);
        this.runLengths = runLengths;
        this.episodeIndexes = episodeIndexes;
    }

    public List<FlareEpisode> episodes() {
        return episodes;
    }

    /// Length of the run of consecutive flare-level days ending at `index`, 0 if the day is below threshold.
    public int runLength(int index) {
        return runLengths[index];
    }

    /// The episode containing the day at `index`, or null.
    public FlareEpisode episodeAt(int index) {
        int episode = episodeIndexes[index];
        return episode < 0 ? null : episodes.get(episode);
    }
}
