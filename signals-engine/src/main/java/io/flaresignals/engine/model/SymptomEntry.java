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

/// One reported symptom and its severity on the `0..3` scale.
///
/// @param name the symptom name as the user logged it
/// @param severity severity in `[0, 3]`
public record SymptomEntry(String name, int severity) {

    /// The highest severity a symptom can carry.
    public static final int MAX_SEVERITY = 3;

    public SymptomEntry {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("symptom name cannot be blank");
        }
        if (severity < 0 || severity > MAX_SEVERITY) {
            throw new IllegalArgumentException("symptom severity must be in [0," + MAX_SEVERITY + "], got: " + severity);
        }
    }
}
