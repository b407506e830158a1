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

import java.time.LocalDate;
import java.util.List;

/// Trailing-window baseline over daily burdens.
///
/// For the day at index `n` the baseline is the mean score of the entries
/// dated `date(n) - windowDays .. date(n) - 1`. The day itself and anything
/// after it are never included. Calendar days without an entry are simply
/// absent from the mean, never counted as zero. When no entry falls in the
/// window the baseline is undefined and reported as null.
public final class BaselineEstimator {

    private final int windowDays;

    public BaselineEstimator(int windowDays) {
        if (windowDays < 1) {
            throw new IllegalArgumentException("windowDays must be at least 1, got: " + windowDays);
        }
        this.windowDays = windowDays;
    }

    /// Computes the trailing baseline for one day.
    ///
    /// @param burdens daily burdens in ascending date order
    /// @param index the day under evaluation
    /// @return the baseline, or null when no prior entry lies within the window
    public Double trailingBaseline(List<DailyBurden> burdens, int index) {
        LocalDate windowStart = burdens.get(index).date().minusDays(windowDays);
        double total = 0.0;
        int count = 0;
        for (int i = index - 1; i >= 0; i--) {
            DailyBurden prior = burdens.get(i);
            if (prior.date().isBefore(windowStart)) {
                break;
            }
            total += prior.score();
            count++;
        }
        return count == 0 ? null : total / count;
    }

    /// Computes the trailing baseline for every day.
    ///
    /// @param burdens daily burdens in ascending date order
    /// @return one baseline (possibly null) per burden
    public Double[] trailingBaselines(List<DailyBurden> burdens) {
        Double[] baselines = new Double[burdens.size()];
        for (int i = 0; i < baselines.length; i++) {
            baselines[i] = trailingBaseline(burdens, i);
        }
        return baselines;
    }
}
