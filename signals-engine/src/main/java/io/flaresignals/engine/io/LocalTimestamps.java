package io.flaresignals.engine.io;

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

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/// Parses check-in timestamps as local wall-clock values.
///
/// Accepted forms:
///
/// | Input | Result |
/// |-------|--------|
/// | `2025-02-04T17:00:00` (optional fraction) | as written |
/// | `2025-02-04 17:00:00` | as written |
/// | `2025-02-04` | start of that day |
/// | `2025-02-04T17:00:00Z`, `...+01:00`, `...+0100` | wall-clock part as written |
///
/// An offset is never applied: a check-in logged at 23:30 stays on its own
/// calendar date wherever it is read. Calendar rollover such as `02-30` is
/// rejected rather than carried into the next month.
public final class LocalTimestamps {

    private static final Pattern DATE_ONLY = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern OFFSET = Pattern.compile("([zZ]|[+-]\\d{2}:?\\d{2})$");
    private static final Pattern COMPACT_OFFSET = Pattern.compile("([+-]\\d{2})(\\d{2})$");

    private LocalTimestamps() {
    }

    /// Parses a timestamp.
    ///
    /// @param text the timestamp text
    /// @return the local date and time
    /// @throws IllegalArgumentException if the text is blank or malformed
    public static LocalDateTime parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("timestamp is blank");
        }
        String normalized = text.strip().replaceFirst(" ", "T");
        try {
            if (DATE_ONLY.matcher(normalized).matches()) {
                return LocalDate.parse(normalized).atStartOfDay();
            }
            if (OFFSET.matcher(normalized).find()) {
                String withColon = COMPACT_OFFSET.matcher(normalized).replaceFirst("$1:$2");
                return OffsetDateTime.parse(withColon).toLocalDateTime();
            }
            return LocalDateTime.parse(normalized);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("unparseable timestamp '" + text + "'", e);
        }
    }
}
