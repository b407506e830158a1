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

/// Trust level of a correlation result, driven by exposure count and consistency.
public enum CorrelationConfidence {
    @SerializedName("low")
    LOW("low", "Preliminary"),
    @SerializedName("medium")
    MEDIUM("medium", "Moderate confidence"),
    @SerializedName("high")
    HIGH("high", "High confidence");

    private final String id;
    private final String label;

    CorrelationConfidence(String id, String label) {
        this.id = id;
        this.label = label;
    }

    public String id() {
        return id;
    }

    public String label() {
        return label;
    }
}
