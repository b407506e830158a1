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

import java.util.Locale;
import java.util.Objects;

/// Correlation outcome for one candidate tag.
///
/// Invariant: `worseDays + betterDays + neutralDays == analyzableExposures <= totalExposureDays`.
///
/// @param key normalized candidate key (trimmed, lower case)
/// @param name display name, each word capitalized
/// @param category the category the candidate was drawn from
/// @param totalExposureDays distinct dates on which the candidate was logged
/// @param worseDays exposures followed by worse intensity
/// @param betterDays exposures followed by better intensity
/// @param neutralDays exposures with no clear change
/// @param analyzableExposures independent exposures with both a reaction value and a local baseline
/// @param pattern the dominant outcome
/// @param consistency share of the majority outcome, in `[0, 1]`
/// @param confidence trust level of the result
public record CorrelationResult(
    String key,
    String name,
    TagCategory category,
    int totalExposureDays,
    int worseDays,
    int betterDays,
    int neutralDays,
    int analyzableExposures,
    CorrelationPattern pattern,
    double consistency,
    CorrelationConfidence confidence
) {

    public CorrelationResult {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(pattern, "pattern cannot be null");
        Objects.requireNonNull(confidence, "confidence cannot be null");
        if (worseDays + betterDays + neutralDays != analyzableExposures) {
            throw new IllegalArgumentException("outcome counts " + worseDays + "+" + betterDays + "+" + neutralDays
                + " do not add up to " + analyzableExposures + " analyzable exposures for '" + key + "'");
        }
        if (analyzableExposures > totalExposureDays) {
            throw new IllegalArgumentException("analyzable exposures " + analyzableExposures
                + " exceed exposure days " + totalExposureDays + " for '" + key + "'");
        }
        if (consistency < 0.0 || consistency > 1.0) {
            throw new IllegalArgumentException("consistency must be in [0,1], got: " + consistency);
        }
    }

    /// Ranking score: pattern weight times consistency times `log(count + 1)`.
    public double rankingScore() {
        return pattern.weight() * consistency * Math.log(totalExposureDays + 1);
    }

    /// Capitalizes the first letter of each space separated word of a key.
    ///
    /// @param key a normalized candidate key
    /// @return the display form
    public static String displayName(String key) {
        StringBuilder sb = new StringBuilder(key.length());
        boolean startOfWord = true;
        for (int i = 0; i < key.length(); i++) {
            char c = key.charAt(i);
            if (startOfWord && c != ' ') {
                sb.append(String.valueOf(c).toUpperCase(Locale.ROOT));
                startOfWord = false;
            } else {
                sb.append(c);
                if (c == ' ') {
                    startOfWord = true;
                }
            }
        }
        return sb.toString();
    }
}
