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

import com.google.gson.annotations.SerializedName;

/// The state assigned to a single day by the flare detector.
public enum FlareState {
    @SerializedName("stable")
    STABLE("stable", "Stable"),
    @SerializedName("pre_flare")
    PRE_FLARE("pre_flare", "Pre-flare"),
    @SerializedName("active_flare")
    ACTIVE_FLARE("active_flare", "Active flare"),
    @SerializedName("peak_flare")
    PEAK_FLARE("peak_flare", "Peak flare"),
    @SerializedName("resolving_flare")
    RESOLVING_FLARE("resolving_flare", "Resolving");

    private final String id;
    private final String label;

    FlareState(String id, String label) {
        this.id = id;
        this.label = label;
    }

    /// Stable identifier, as written to JSON and CSV.
    public String id() {
        return id;
    }

    /// Human-readable label for presentation.
    public String label() {
        return label;
    }

    /// True for the two states that belong to a flare episode.
    public boolean isFlare() {
        return this == ACTIVE_FLARE || this == PEAK_FLARE;
    }
}
