/// Symptom signal analysis engine.
///
/// Analyzers turn a complete observation history into structured signals.
/// They are discovered through [io.flaresignals.engine.SignalAnalyzerIO] and
/// may be run together with [io.flaresignals.engine.AnalyzerHarness].
///
/// ## Usage Example
///
/// ```java
/// AnalysisResults results = new AnalyzerHarness()
///     .registerAllAvailable()
///     .run(observations);
/// FlareAnalysis flare = results.getResult("flare", FlareAnalysis.class);
/// ```
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

