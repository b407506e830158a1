/// Flare detection against a personal trailing baseline.
///
/// ## Key Components
///
/// - {@link io.flaresignals.engine.flare.BaselineEstimator}: trailing 14 day baseline per day
/// - {@link io.flaresignals.engine.flare.ConfidenceGate}: suppresses conclusions on thin history
/// - {@link io.flaresignals.engine.flare.FlareEpisodeDetector}: runs of flare-level days
/// - {@link io.flaresignals.engine.flare.DailyStateClassifier}: one state per day
/// - {@link io.flaresignals.engine.flare.FlareDetector}: the registered `flare` analyzer
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

