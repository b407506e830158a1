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

/// A run of consecutive days whose score reached that day's own threshold.
///
/// `endDate` is null exactly when the run reaches the most recent available
/// date, in which case the episode is still active.
///
/// @param startDate first day of the run
/// @param endDate last day of the run, or null while the episode is open
/// @param peakDate the highest scoring day, earliest on ties
/// @param durationDays number of days in the run
/// @param peakScore score on the peak day
/// @param isActive true while the episode is open
public record FlareEpisode(
    LocalDate startDate,
    LocalDate endDate,
    LocalDate peakDate,
    int durationDays,
    double peakScore,
    boolean isActive
) {

    public FlareEpisode {
        Objects.requireNonNull(startDate, "startDate cannot be null");
        Objects.requireNonNull(peakDate, "peakDate cannot be null");
        if (isActive != (endDate == null)) {
            throw new IllegalArgumentException("endDate must be null exactly when the episode is active");
        }
        if (durationDays < 1) {
            throw new IllegalArgumentException("durationDays must be positive, got: " + durationDays);
        }
        if (peakDate.isBefore(startDate) || (endDate != null && peakDate.isAfter(endDate))) {
            throw new IllegalArgumentException("peakDate " + peakDate + " lies outside the episode");
        }
    }

    /// Returns true if `date` falls inside this episode. An open episode
    /// covers everything from its start onward.
    public boolean contains(LocalDate date) {
        return !date.isBefore(startDate) && (endDate == null || !date.isAfter(endDate));
    }
}
