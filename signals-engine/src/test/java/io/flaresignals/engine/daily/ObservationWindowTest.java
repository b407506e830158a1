package io.flaresignals.engine.daily;

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
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.flaresignals.engine.Histories.day;
import static io.flaresignals.engine.Histories.intensity;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ObservationWindowTest {

    private final List<Observation> history = List.of(
        intensity(0, 1.0), intensity(10, 2.0), intensity(20, 3.0), intensity(30, 4.0));

    @Test
    void keepsBothEndsOfThePeriod() {
        List<Observation> kept = ObservationWindow.within(history, day(20), 10);
        assertThat(kept).extracting(Observation::date).containsExactly(day(10), day(20));
    }

    @Test
    void allHistoryIgnoresTheReferenceDate() {
        assertThat(ObservationWindow.within(history, day(5), ObservationWindow.ALL_HISTORY_DAYS)).hasSize(4);
    }

    @Test
    void rejectsNegativePeriods() {
        assertThatThrownBy(() -> ObservationWindow.within(history, day(5), -1))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
