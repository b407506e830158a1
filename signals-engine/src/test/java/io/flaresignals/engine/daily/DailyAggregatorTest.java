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

import io.flaresignals.engine.model.DailyBurden;
import io.flaresignals.engine.model.Observation;
import io.flaresignals.engine.model.TagCategory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static io.flaresignals.engine.Histories.day;
import static io.flaresignals.engine.Histories.intensity;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class DailyAggregatorTest {

    @Test
    void intensityOnlySeverityIsRescaled() {
        Observation observation = intensity(0, 5.0);
        assertThat(DailyAggregator.observationSeverity(observation)).isCloseTo(3.0, within(1e-12));
    }

    @Test
    void symptomsAndIntensityWeighEqually() {
        Observation observation = Observation.builder("a", day(0).atTime(7, 0))
            .skinIntensity(5.0)
            .symptom("itch", 1)
            .symptom("redness", 1)
            .build();
        // 0.5 * 1.0 + 0.5 * 3.0
        assertThat(DailyAggregator.observationSeverity(observation)).isCloseTo(2.0, within(1e-12));
    }

    @Test
    void oneBurdenPerDistinctDate() {
        List<Observation> observations = new ArrayList<>();
        observations.add(intensity(0, 1.0));
        observations.add(Observation.builder("late", day(0).atTime(22, 0)).skinIntensity(3.0).build());
        observations.add(intensity(2, 2.0));
        observations.add(Observation.builder("noon", day(2).atTime(12, 0)).skinIntensity(2.0).build());
        observations.add(intensity(5, 4.0));

        List<DailyBurden> burdens = DailyAggregator.dailyBurdens(observations);

        assertThat(burdens).extracting(DailyBurden::date).containsExactly(day(0), day(2), day(5));
        assertThat(burdens.get(0).observationCount()).isEqualTo(2);
        assertThat(burdens.get(0).score()).isCloseTo((0.6 + 1.8) / 2, within(1e-12));
        assertThat(burdens.get(0).skinIntensity()).isEqualTo(3.0);
    }

    @Test
    void burdensDoNotDependOnInputOrder() {
        List<Observation> observations = new ArrayList<>();
        Random random = new Random(42);
        for (int d = 0; d < 30; d++) {
            for (int k = 0; k < 3; k++) {
                observations.add(Observation.builder("o" + d + "-" + k, day(d).atTime(8 + k, 0))
                    .skinIntensity(random.nextInt(11) / 2.0)
                    .symptom("itch", random.nextInt(4))
                    .build());
            }
        }
        List<DailyBurden> expected = DailyAggregator.dailyBurdens(observations);
        Collections.shuffle(observations, new Random(7));
        assertThat(DailyAggregator.dailyBurdens(observations)).isEqualTo(expected);
    }

    @Test
    void dailyIntensityAveragesSameDayEntries() {
        List<Observation> observations = List.of(
            intensity(0, 1.0),
            Observation.builder("evening", day(0).atTime(20, 0)).skinFeeling(2).build(),
            intensity(1, 4.0));

        Map<LocalDate, Double> intensity = DailyAggregator.dailyIntensity(observations);

        assertThat(intensity).containsOnlyKeys(day(0), day(1));
        assertThat(intensity.get(day(0))).isCloseTo(2.0, within(1e-12));
        assertThat(intensity.get(day(1))).isEqualTo(4.0);
    }

    @Test
    void dailyTagsKeepOnlyTheCategory() {
        List<Observation> observations = List.of(
            intensity(0, 1.0, "food:Dairy", "heat"),
            Observation.builder("second", day(0).atTime(18, 0)).skinIntensity(1.0).tags("FOOD:dairy ", "food:Gluten").build(),
            intensity(1, 1.0, "sweat"));

        Map<LocalDate, Set<String>> food = DailyAggregator.dailyTags(observations, TagCategory.FOOD);
        assertThat(food).containsOnlyKeys(day(0));
        assertThat(food.get(day(0))).containsExactly("dairy", "gluten");

        Map<LocalDate, Set<String>> triggers = DailyAggregator.dailyTags(observations, TagCategory.TRIGGER);
        assertThat(triggers.get(day(0))).containsExactly("heat");
        assertThat(triggers.get(day(1))).containsExactly("sweat");
    }

    @Test
    void sameTimestampAndIdStillAverageIdentically() {
        List<Observation> observations = new ArrayList<>();
        for (double value : new double[]{0.1, 0.2, 0.3, 0.7}) {
            observations.add(Observation.builder("dup", day(0).atTime(8, 0)).skinIntensity(value).build());
        }
        double expectedScore = DailyAggregator.dailyBurdens(observations).get(0).score();
        double expectedIntensity = DailyAggregator.dailyIntensity(observations).get(day(0));

        Random random = new Random(7);
        for (int trial = 0; trial < 24; trial++) {
            Collections.shuffle(observations, random);
            assertThat(DailyAggregator.dailyBurdens(observations).get(0).score()).isEqualTo(expectedScore);
            assertThat(DailyAggregator.dailyIntensity(observations).get(day(0))).isEqualTo(expectedIntensity);
        }
        assertThat(expectedIntensity).isCloseTo(0.325, within(1e-12));
    }
}
