package io.flaresignals.engine;

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

import java.util.List;

/// An analyzer that turns an observation history into a structured signal.
///
/// ## Contract
///
/// - The input is the complete history in any order. Implementations sort
///   internally and never mutate the list.
/// - Every call recomputes its result from scratch. There is no incremental
///   or memoized state, so one instance may be called repeatedly and from
///   several threads at once.
/// - Identical input, in any permutation, yields an equal result.
///
/// ## Registering Analyzers
///
/// 1. Implement this interface with a public no-args constructor
/// 2. Add the [AnalyzerName] annotation
/// 3. List the class in `META-INF/services/io.flaresignals.engine.SignalAnalyzer`
///
/// @param <R> the type of result produced by this analyzer
/// @see SignalAnalyzerIO
/// @see AnalyzerHarness
public interface SignalAnalyzer<R> {

    /// Returns the unique identifier for this analyzer type.
    ///
    /// @return a unique, human-readable identifier (e.g., "flare", "food-correlation")
    String getAnalyzerType();

    /// Analyzes a full observation history.
    ///
    /// @param observations the history, in any order
    /// @return the analysis result, never null
    R analyze(List<Observation> observations);

    /// Returns a human-readable description of this analyzer.
    ///
    /// @return description of what this analyzer does
    default String getDescription() {
        return getAnalyzerType();
    }
}
