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

/// The dominant outcome over all analyzable exposures of a candidate.
///
/// The weight orders candidates for ranking: worsening candidates first,
/// undetermined ones last.
public enum CorrelationPattern {
    @SerializedName("often_worse")
    OFTEN_WORSE("often_worse", "often followed by worse symptoms", 1.0),
    @SerializedName("mixed")
    MIXED("mixed", "mixed reactions observed", 0.5),
    @SerializedName("often_better")
    OFTEN_BETTER("often_better", "often followed by improvement", 0.3),
    @SerializedName("no_pattern")
    NO_PATTERN("no_pattern", "no clear pattern detected", 0.2),
    @SerializedName("insufficient_data")
    INSUFFICIENT_DATA("insufficient_data", "not enough data yet", 0.0);

    private final String id;
    private final String label;
    private final double weight;

    CorrelationPattern(String id, String label, double weight) {
        this.id = id;
        this.label = label;
        this.weight = weight;
    }

    public String id() {
        return id;
    }

    public String label() {
        return label;
    }

    public double weight() {
        return weight;
    }
}
