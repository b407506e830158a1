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

import io.flaresignals.engine.model.CorrelationPattern;
import io.flaresignals.engine.model.CorrelationResult;

import java.util.Comparator;

/// Display order for correlation results.
public final class CorrelationRanking {

    /// Results with insufficient data last, then by ranking score descending,
    /// then by exposure days descending, then by key.
    public static final Comparator<CorrelationResult> ORDER =
        Comparator.comparing((CorrelationResult r) -> r.pattern() == CorrelationPattern.INSUFFICIENT_DATA)
            .thenComparing(Comparator.comparingDouble(CorrelationResult::rankingScore).reversed())
            .thenComparing(Comparator.comparingInt(CorrelationResult::totalExposureDays).reversed())
            .thenComparing(CorrelationResult::key);

    private CorrelationRanking() {
    }
}
