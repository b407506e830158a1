package io.flaresignals.engine.correlate;

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

import io.flaresignals.engine.config.CorrelationConfig;
import io.flaresignals.engine.model.CorrelationConfidence;
import io.flaresignals.engine.model.CorrelationPattern;

/// Turns outcome counts into a pattern, a consistency and a confidence.
public final class PatternClassifier {

    private static final int LOW_CONFIDENCE_MAX_EXPOSURES = 4;
    private static final int MEDIUM_CONFIDENCE_MAX_EXPOSURES = 7;

    private final int minimumExposures;
    private final double dominantRatio;
    private final double mixedRatio;

    public PatternClassifier(CorrelationConfig config) {
        this.minimumExposures = config.getMinimumExposures();
        this.dominantRatio = config.getDominantRatio();
        this.mixedRatio = config.getMixedRatio();
    }

    /// Classifies the dominant outcome.
    ///
    /// Fewer analyzable exposures than the configured minimum always give
    /// [CorrelationPattern#INSUFFICIENT_DATA].
    public CorrelationPattern pattern(int worse, int better, int neutral) {
        int analyzable = worse + better + neutral;
        if (analyzable < minimumExposures) {
            return CorrelationPattern.INSUFFICIENT_DATA;
        }
        double worseRatio = (double) worse / analyzable;
        double betterRatio = (double) better / analyzable;
        if (worseRatio >= dominantRatio) {
            return CorrelationPattern.OFTEN_WORSE;
        }
        if (betterRatio >= dominantRatio) {
            return CorrelationPattern.OFTEN_BETTER;
        }
        if ((double) (worse + better) / analyzable >= mixedRatio) {
            return CorrelationPattern.MIXED;
        }
        return CorrelationPattern.NO_PATTERN;
    }

    /// Share of the most frequent outcome, 0 when nothing was analyzable.
    public double consistency(int worse, int better, int neutral) {
        int analyzable = worse + better + neutral;
        if (analyzable == 0) {
            return 0.0;
        }
        return (double) Math.max(worse, Math.max(better, neutral)) / analyzable;
    }

    /// Confidence from the total exposure count and the consistency.
    ///
    /// ```text
    ///   exposures <= 4        -> LOW
    ///   exposures 5..7        -> MEDIUM if consistency >= dominantRatio, else LOW
    ///   exposures > 7         -> HIGH   if consistency >= dominantRatio, else MEDIUM
    /// ```
    public CorrelationConfidence confidence(int totalExposureDays, double consistency) {
        boolean consistent = consistency >= dominantRatio;
        if (totalExposureDays <= LOW_CONFIDENCE_MAX_EXPOSURES) {
            return CorrelationConfidence.LOW;
        }
        if (totalExposureDays <= MEDIUM_CONFIDENCE_MAX_EXPOSURES) {
            return consistent ? CorrelationConfidence.MEDIUM : CorrelationConfidence.LOW;
        }
        return consistent ? CorrelationConfidence.HIGH : CorrelationConfidence.MEDIUM;
    }
}
