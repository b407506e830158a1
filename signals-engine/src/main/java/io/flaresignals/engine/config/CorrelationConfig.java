package io.flaresignals.engine.config;

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

/**
 * Tunable constants for trigger and product correlation.
 *
 * <h2>JSON Schema</h2>
 *
 * <pre>{@code
 * {
 *   "minimum_exposures": 3,
 *   "reaction_window_days": 3,
 *   "local_baseline_window_days": 7,
 *   "worse_delta": 0.5,
 *   "better_delta": -0.5,
 *   "dominant_ratio": 0.6,
 *   "mixed_ratio": 0.5
 * }
 * }</pre>
 *
 * @see EngineConfig
 */
public class CorrelationConfig {

    /** Fewer exposure days (or analyzable exposures) than this is insufficient data */
    @SerializedName("minimum_exposures")
    private int minimumExposures = 3;

    /** Days after an exposure examined for a delayed reaction: D+1..D+n */
    @SerializedName("reaction_window_days")
    private int reactionWindowDays = 3;

    /** Half width of the symmetric local baseline window */
    @SerializedName("local_baseline_window_days")
    private int localBaselineWindowDays = 7;

    /** Delta at or above which an exposure counts as worse */
    @SerializedName("worse_delta")
    private double worseDelta = 0.5;

    /** Delta at or below which an exposure counts as better */
    @SerializedName("better_delta")
    private double betterDelta = -0.5;

    /** Outcome ratio at which a pattern dominates */
    @SerializedName("dominant_ratio")
    private double dominantRatio = 0.6;

    /** Combined worse and better ratio at which outcomes count as mixed */
    @SerializedName("mixed_ratio")
    private double mixedRatio = 0.5;

    public CorrelationConfig() {
    }

    public static CorrelationConfig defaults() {
        return new CorrelationConfig();
    }

    public int getMinimumExposures() {
        return minimumExposures;
    }

    public CorrelationConfig setMinimumExposures(int minimumExposures) {
        this.minimumExposures = minimumExposures;
        return this;
    }

    public int getReactionWindowDays() {
        return reactionWindowDays;
    }

    public CorrelationConfig setReactionWindowDays(int reactionWindowDays) {
        this.reactionWindowDays = reactionWindowDays;
        return this;
    }

    public int getLocalBaselineWindowDays() {
        return localBaselineWindowDays;
    }

    public CorrelationConfig setLocalBaselineWindowDays(int localBaselineWindowDays) {
        this.localBaselineWindowDays = localBaselineWindowDays;
        return this;
    }

    public double getWorseDelta() {
        return worseDelta;
    }

    public CorrelationConfig setWorseDelta(double worseDelta) {
        this.worseDelta = worseDelta;
        return this;
    }

    public double getBetterDelta() {
        return betterDelta;
    }

    public CorrelationConfig setBetterDelta(double betterDelta) {
        this.betterDelta = betterDelta;
        return this;
    }

    public double getDominantRatio() {
        return dominantRatio;
    }

    public CorrelationConfig setDominantRatio(double dominantRatio) {
        this.dominantRatio = dominantRatio;
        return this;
    }

    public double getMixedRatio() {
        return mixedRatio;
    }

    public CorrelationConfig setMixedRatio(double mixedRatio) {
        this.mixedRatio = mixedRatio;
        return this;
    }

    /** Returns an independent copy holding the same values. */
    public CorrelationConfig copy() {
        return new CorrelationConfig()
            .setMinimumExposures(minimumExposures)
            .setReactionWindowDays(reactionWindowDays)
            .setLocalBaselineWindowDays(localBaselineWindowDays)
            .setWorseDelta(worseDelta)
            .setBetterDelta(betterDelta)
            .setDominantRatio(dominantRatio)
            .setMixedRatio(mixedRatio);
    }

    /**
     * Checks every value for consistency.
     *
     * @return this config
     * @throws IllegalArgumentException naming the first offending key
     */
    public CorrelationConfig validate() {
        if (minimumExposures < 1) {
            throw new IllegalArgumentException("minimum_exposures must be at least 1, got: " + minimumExposures);
        }
        if (reactionWindowDays < 1) {
            throw new IllegalArgumentException("reaction_window_days must be at least 1, got: " + reactionWindowDays);
        }
        if (localBaselineWindowDays < 1) {
            throw new IllegalArgumentException("local_baseline_window_days must be at least 1, got: " + localBaselineWindowDays);
        }
        if (!(worseDelta > 0.0)) {
            throw new IllegalArgumentException("worse_delta must be positive, got: " + worseDelta);
        }
        if (!(betterDelta < 0.0)) {
            throw new IllegalArgumentException("better_delta must be negative, got: " + betterDelta);
        }
        if (!(dominantRatio > 0.5 && dominantRatio <= 1.0)) {
            throw new IllegalArgumentException("dominant_ratio must be in (0.5,1], got: " + dominantRatio);
        }
        if (!(mixedRatio >= 0.0 && mixedRatio <= 1.0)) {
            throw new IllegalArgumentException("mixed_ratio must be in [0,1], got: " + mixedRatio);
        }
        return this;
    }

    @Override
    public String toString() {
        return String.format("CorrelationConfig[min=%d, reaction=%dd, local=±%dd, deltas=%+.2f/%+.2f, ratios=%.2f/%.2f]",
            minimumExposures, reactionWindowDays, localBaselineWindowDays, worseDelta, betterDelta, dominantRatio, mixedRatio);
    }
}
