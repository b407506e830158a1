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
 * Tunable constants for flare detection.
 *
 * <h2>JSON Schema</h2>
 *
 * <pre>{@code
 * {
 *   "baseline_window_days": 14,
 *   "threshold_margin": 0.5,
 *   "min_episode_days": 3,
 *   "provisional_min_days": 7,
 *   "mature_min_days": 14,
 *   "resolving_window_days": 3
 * }
 * }</pre>
 *
 * <p>Any key left out keeps its default.
 *
 * @see EngineConfig
 */
public class FlareDetectionConfig {

    /** Trailing window, in calendar days, for the per-day baseline */
    @SerializedName("baseline_window_days")
    private int baselineWindowDays = 14;

    /** Severity units above baseline that make a day flare-level */
    @SerializedName("threshold_margin")
    private double thresholdMargin = 0.5;

    /** Shortest run of flare-level days promoted to an episode */
    @SerializedName("min_episode_days")
    private int minEpisodeDays = 3;

    /** Daily entries needed to leave the early tier */
    @SerializedName("provisional_min_days")
    private int provisionalMinDays = 7;

    /** Daily entries needed for the mature tier */
    @SerializedName("mature_min_days")
    private int matureMinDays = 14;

    /** Days after an episode end during which a falling score counts as resolving */
    @SerializedName("resolving_window_days")
    private int resolvingWindowDays = 3;

    public FlareDetectionConfig() {
    }

    /** Returns a config holding the defaults. */
    public static FlareDetectionConfig defaults() {
        return new FlareDetectionConfig();
    }

    public int getBaselineWindowDays() {
        return baselineWindowDays;
    }

    public FlareDetectionConfig setBaselineWindowDays(int baselineWindowDays) {
        this.baselineWindowDays = baselineWindowDays;
        return this;
    }

    public double getThresholdMargin() {
        return thresholdMargin;
    }

    public FlareDetectionConfig setThresholdMargin(double thresholdMargin) {
        this.thresholdMargin = thresholdMargin;
        return this;
    }

    public int getMinEpisodeDays() {
        return minEpisodeDays;
    }

    public FlareDetectionConfig setMinEpisodeDays(int minEpisodeDays) {
        this.minEpisodeDays = minEpisodeDays;
        return this;
    }

    public int getProvisionalMinDays() {
        return provisionalMinDays;
    }

    public FlareDetectionConfig setProvisionalMinDays(int provisionalMinDays) {
        this.provisionalMinDays = provisionalMinDays;
        return this;
    }

    public int getMatureMinDays() {
        return matureMinDays;
    }

    public FlareDetectionConfig setMatureMinDays(int matureMinDays) {
        this.matureMinDays = matureMinDays;
        return this;
    }

    public int getResolvingWindowDays() {
        return resolvingWindowDays;
    }

    public FlareDetectionConfig setResolvingWindowDays(int resolvingWindowDays) {
        this.resolvingWindowDays = resolvingWindowDays;
        return this;
    }

    /** Returns an independent copy holding the same values. */
    public FlareDetectionConfig copy() {
        return new FlareDetectionConfig()
            .setBaselineWindowDays(baselineWindowDays)
            .setThresholdMargin(thresholdMargin)
            .setMinEpisodeDays(minEpisodeDays)
            .setProvisionalMinDays(provisionalMinDays)
            .setMatureMinDays(matureMinDays)
            .setResolvingWindowDays(resolvingWindowDays);
    }

    /**
     * Checks every value for consistency.
     *
     * @return this config
     * @throws IllegalArgumentException naming the first offending key
     */
    public FlareDetectionConfig validate() {
        if (baselineWindowDays < 1) {
            throw new IllegalArgumentException("baseline_window_days must be at least 1, got: " + baselineWindowDays);
        }
        if (!(thresholdMargin >= 0.0) || Double.isInfinite(thresholdMargin)) {
            throw new IllegalArgumentException("threshold_margin must be a finite non-negative number, got: " + thresholdMargin);
        }
        if (minEpisodeDays < 3) {
            throw new IllegalArgumentException("min_episode_days must be at least 3, got: " + minEpisodeDays);
        }
        if (provisionalMinDays < 1) {
            throw new IllegalArgumentException("provisional_min_days must be at least 1, got: " + provisionalMinDays);
        }
        if (matureMinDays < provisionalMinDays) {
            throw new IllegalArgumentException("mature_min_days (" + matureMinDays
                + ") must not be below provisional_min_days (" + provisionalMinDays + ")");
        }
        if (resolvingWindowDays < 0) {
            throw new IllegalArgumentException("resolving_window_days must be non-negative, got: " + resolvingWindowDays);
        }
        return this;
    }

    @Override
    public String toString() {
        return String.format("FlareDetectionConfig[window=%dd, margin=%.2f, minEpisode=%dd, tiers=%d/%d, resolving=%dd]",
            baselineWindowDays, thresholdMargin, minEpisodeDays, provisionalMinDays, matureMinDays, resolvingWindowDays);
    }
}
