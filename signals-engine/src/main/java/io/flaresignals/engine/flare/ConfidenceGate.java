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

import io.flaresignals.engine.config.FlareDetectionConfig;
import io.flaresignals.engine.model.BaselineConfidence;

/// Maps history volume to a [BaselineConfidence] tier.
///
/// ```text
///   days <  provisionalMinDays            -> EARLY
///   days <  matureMinDays                 -> PROVISIONAL
///   otherwise                             -> MATURE
/// ```
///
/// With the defaults (7 / 14) one or two check-ins never produce a flare claim.
public final class ConfidenceGate {

    private final int provisionalMinDays;
    private final int matureMinDays;

    public ConfidenceGate(FlareDetectionConfig config) {
        this.provisionalMinDays = config.getProvisionalMinDays();
        this.matureMinDays = config.getMatureMinDays();
    }

    /// Returns the tier for a number of accumulated daily entries.
    ///
    /// @param dayCount daily burden entries accumulated so far
    /// @return the confidence tier
    public BaselineConfidence tierFor(int dayCount) {
        if (dayCount < provisionalMinDays) {
            return BaselineConfidence.EARLY;
        }
        if (dayCount < matureMinDays) {
            return BaselineConfidence.PROVISIONAL;
        }
        return BaselineConfidence.MATURE;
    }

    /// Returns true when conclusions must be suppressed at this volume.
    public boolean isGated(int dayCount) {
        return tierFor(dayCount) == BaselineConfidence.EARLY;
    }
}
