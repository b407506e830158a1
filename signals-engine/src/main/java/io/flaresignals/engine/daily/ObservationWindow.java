package io.flaresignals.engine.daily;

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

import io.flaresignals.engine.model.Observation;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/// Restricts a history to a lookback period ending on an explicit date.
///
/// A period of [#ALL_HISTORY_DAYS] or more keeps everything, whatever its date. The reference
/// date is always passed in, never read from the clock, so results stay
/// reproducible.
public final class ObservationWindow {

    /// Periods this long or longer mean "all history".
    public static final int ALL_HISTORY_DAYS = 9999;

    private ObservationWindow() {
    }

    /// Keeps observations dated within `asOf - periodDays .. asOf`, both ends inclusive.
    ///
    /// @param observations the full history
    /// @param asOf the last date to keep
    /// @param periodDays how many days back from `asOf` to keep
    /// @return the retained observations, in input order
    public static List<Observation> within(Collection<Observation> observations, LocalDate asOf, int periodDays) {
        Objects.requireNonNull(asOf, "asOf cannot be null");
        if (periodDays < 0) {
            throw new IllegalArgumentException("periodDays must be non-negative, got: " + periodDays);
        }
        if (periodDays >= ALL_HISTORY_DAYS) {
            return new ArrayList<>(observations);
        }
        List<Observation> kept = new ArrayList<>();
        LocalDate start = asOf.minusDays(periodDays);
        for (Observation observation : observations) {
            LocalDate date = observation.date();
            if (!date.isBefore(start) && !date.isAfter(asOf)) {
                kept.add(observation);
            }
        }
        return kept;
    }
}
