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

/// How much history backs the personal baseline.
///
/// Tiers are ordered; no flare or trend conclusion is drawn while the tier is
/// [#EARLY].
public enum BaselineConfidence {
    @SerializedName("early")
    EARLY("early"),
    @SerializedName("provisional")
    PROVISIONAL("provisional"),
    @SerializedName("mature")
    MATURE("mature");

    private final String id;

    BaselineConfidence(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /// Returns true when this tier is at least as trusted as `other`.
    public boolean isAtLeast(BaselineConfidence other) {
        return compareTo(other) >= 0;
    }
}
