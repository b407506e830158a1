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
import io.flaresignals.engine.daily.ObservationWindow;
import io.flaresignals.engine.model.CorrelationConfidence;
import io.flaresignals.engine.model.CorrelationPattern;
import io.flaresignals.engine.model.CorrelationResult;
import io.flaresignals.engine.model.Observation;
import io.flaresignals.engine.model.TagCategory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static io.flaresignals.engine.Histories.day;
import static io.flaresignals.engine.Histories.intensity;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class CorrelationAnalyzerTest {

    private static final Set<Integer> DAIRY_DAYS = Set.of(3, 10, 17, 24, 31, 38);
    private static final Set<Integer> EGG_DAYS = Set.of(20, 21);
    private static final Set<Integer> RICE_DAYS = Set.of(42, 44, 46);

    /// 49 calm days. Dairy is followed by a three day spike on five of its six
    /// occasions, eggs appear twice and rice three times close together.
    private static List<Observation> dairyHistory() {
        Set<Integer> spikeDays = Set.of(4, 5, 6, 11, 12, 13, 18, 19, 20, 25, 26, 27, 32, 33, 34);
        List<Observation> observations = new ArrayList<>();
        for (int d = 0; d < 49; d++) {
            List<String> tags = new ArrayList<>();
            if (DAIRY_DAYS.contains(d)) {
                tags.add("food:Dairy");
            }
            if (EGG_DAYS.contains(d)) {
                tags.add("food:eggs");
            }
            if (RICE_DAYS.contains(d)) {
                tags.add("food:Rice");
            }
            observations.add(intensity(d, spikeDays.contains(d) ? 3.0 : 1.0, tags.toArray(new String[0])));
        }
        return observations;
    }

    @Test
    void mostlyWorseCandidateIsOftenWorse() {
        List<CorrelationResult> results = new FoodCorrelationAnalyzer().analyze(dairyHistory());

        CorrelationResult dairy = results.get(0);
        assertThat(dairy.key()).isEqualTo("dairy");
        assertThat(dairy.name()).isEqualTo("Dairy");
        assertThat(dairy.category()).isEqualTo(TagCategory.FOOD);
        assertThat(dairy.totalExposureDays()).isEqualTo(6);
        assertThat(dairy.worseDays()).isEqualTo(5);
        assertThat(dairy.neutralDays()).isEqualTo(1);
        assertThat(dairy.betterDays()).isZero();
        assertThat(dairy.analyzableExposures()).isEqualTo(6);
        assertThat(dairy.pattern()).isEqualTo(CorrelationPattern.OFTEN_WORSE);
        assertThat(dairy.consistency()).isCloseTo(5.0 / 6, within(1e-9));
        assertThat(dairy.confidence()).isEqualTo(CorrelationConfidence.MEDIUM);
    }

    @Test
    void rareCandidatesAreInsufficientAndRankedLast() {
        List<CorrelationResult> results = new FoodCorrelationAnalyzer().analyze(dairyHistory());

        assertThat(results).extracting(CorrelationResult::key).containsExactly("dairy", "rice", "eggs");

        CorrelationResult eggs = results.get(2);
        assertThat(eggs.totalExposureDays()).isEqualTo(2);
        assertThat(eggs.pattern()).isEqualTo(CorrelationPattern.INSUFFICIENT_DATA);
        assertThat(eggs.confidence()).isEqualTo(CorrelationConfidence.LOW);
        assertThat(eggs.analyzableExposures()).isZero();
        assertThat(eggs.consistency()).isZero();
    }

    @Test
    void exposuresInsideOneReactionWindowMerge() {
        CorrelationResult rice = new FoodCorrelationAnalyzer().analyze(dairyHistory()).get(1);

        assertThat(rice.totalExposureDays()).isEqualTo(3);
        // 42 covers 44, leaving 42 and 46 as independent trials
        assertThat(rice.analyzableExposures()).isEqualTo(2);
        assertThat(rice.neutralDays()).isEqualTo(2);
        assertThat(rice.pattern()).isEqualTo(CorrelationPattern.INSUFFICIENT_DATA);
    }

    @Test
    void dailyExposureStreakCountsOncePerReactionWindow() {
        List<Observation> observations = new ArrayList<>();
        for (int d = 0; d < 31; d++) {
            observations.add(d >= 10 && d < 20 ? intensity(d, 2.0, "heat") : intensity(d, 2.0));
        }
        CorrelationResult heat = new TriggerCorrelationAnalyzer().analyze(observations).get(0);

        assertThat(heat.totalExposureDays()).isEqualTo(10);
        assertThat(heat.analyzableExposures()).isEqualTo(3);
        assertThat(heat.neutralDays()).isEqualTo(3);
        assertThat(heat.pattern()).isEqualTo(CorrelationPattern.NO_PATTERN);
        assertThat(heat.consistency()).isEqualTo(1.0);
        assertThat(heat.confidence()).isEqualTo(CorrelationConfidence.HIGH);
    }

    @Test
    void exposureWithoutReactionDaysIsNotAnalyzable() {
        List<Observation> observations = List.of(
            intensity(0, 1.0), intensity(1, 1.0, "heat"),
            intensity(10, 1.0), intensity(11, 1.0, "heat"),
            intensity(20, 1.0), intensity(21, 1.0, "heat"));
        CorrelationResult heat = new TriggerCorrelationAnalyzer().analyze(observations).get(0);

        assertThat(heat.totalExposureDays()).isEqualTo(3);
        assertThat(heat.analyzableExposures()).isZero();
        assertThat(heat.pattern()).isEqualTo(CorrelationPattern.INSUFFICIENT_DATA);
        assertThat(heat.consistency()).isZero();
    }

    @Test
    void productPrefixesShareACandidate() {
        Set<Integer> calmDays = Set.of(6, 7, 8, 13, 14, 15, 20, 21, 22);
        List<Observation> observations = new ArrayList<>();
        for (int d = 0; d < 30; d++) {
            String tag = d == 5 ? "new_product:Oat Lotion" : (d == 12 || d == 19) ? "product:oat lotion" : "food:dairy";
            observations.add(intensity(d, calmDays.contains(d) ? 0.0 : 2.0, tag));
        }
        List<CorrelationResult> results = new ProductCorrelationAnalyzer().analyze(observations);

        assertThat(results).singleElement().satisfies(lotion -> {
            assertThat(lotion.key()).isEqualTo("oat lotion");
            assertThat(lotion.name()).isEqualTo("Oat Lotion");
            assertThat(lotion.totalExposureDays()).isEqualTo(3);
            assertThat(lotion.betterDays()).isEqualTo(3);
            assertThat(lotion.pattern()).isEqualTo(CorrelationPattern.OFTEN_BETTER);
            assertThat(lotion.confidence()).isEqualTo(CorrelationConfidence.LOW);
        });
    }

    @Test
    void lookbackRestrictsExposures() {
        FoodCorrelationAnalyzer analyzer = new FoodCorrelationAnalyzer();
        List<Observation> history = dairyHistory();

        CorrelationResult recent = analyzer.analyze(history, day(20), 20).stream()
            .filter(r -> r.key().equals("dairy"))
            .findFirst()
            .orElseThrow();
        assertThat(recent.totalExposureDays()).isEqualTo(3);

        CorrelationResult all = analyzer.analyze(history, day(20), ObservationWindow.ALL_HISTORY_DAYS).get(0);
        assertThat(all.totalExposureDays()).isEqualTo(6);
    }

    @Test
    void outcomeCountsAlwaysAddUp() {
        Random random = new Random(5);
        String[] foods = {"food:dairy", "food:gluten", "food:nuts", "food:citrus"};
        List<Observation> observations = new ArrayList<>();
        for (int d = 0; d < 90; d++) {
            List<String> tags = new ArrayList<>();
            for (String food : foods) {
                if (random.nextInt(4) == 0) {
                    tags.add(food);
                }
            }
            if (random.nextInt(5) != 0) {
                observations.add(intensity(d, random.nextInt(6), tags.toArray(new String[0])));
            }
        }
        List<CorrelationResult> results = new FoodCorrelationAnalyzer().analyze(observations);

        assertThat(results).isNotEmpty().allSatisfy(r -> {
            assertThat(r.worseDays() + r.betterDays() + r.neutralDays()).isEqualTo(r.analyzableExposures());
            assertThat(r.analyzableExposures()).isLessThanOrEqualTo(r.totalExposureDays());
            assertThat(r.consistency()).isBetween(0.0, 1.0);
        });
        boolean seenInsufficient = false;
        for (CorrelationResult result : results) {
            if (result.pattern() == CorrelationPattern.INSUFFICIENT_DATA) {
                seenInsufficient = true;
            } else {
                assertThat(seenInsufficient).as("determinate result after an insufficient one").isFalse();
            }
        }

        List<Observation> shuffled = new ArrayList<>(observations);
        Collections.shuffle(shuffled, new Random(11));
        assertThat(new FoodCorrelationAnalyzer().analyze(shuffled)).isEqualTo(results);
    }

    @Test
    void noTagsNoResults() {
        assertThat(new FoodCorrelationAnalyzer().analyze(List.of(intensity(0, 1.0)))).isEmpty();
        assertThat(new FoodCorrelationAnalyzer().analyze(List.of())).isEmpty();
    }

    @Test
    void nullHistoryIsADefect() {
        assertThatThrownBy(() -> new FoodCorrelationAnalyzer().analyze(null))
            .isInstanceOf(NullPointerException.class);
    }

    @Test
    void factoryMatchesCategory() {
        assertThat(CorrelationAnalyzer.forCategory(TagCategory.PRODUCT, new FoodCorrelationAnalyzer().getConfig()))
            .isInstanceOf(ProductCorrelationAnalyzer.class);
        assertThat(new TriggerCorrelationAnalyzer().getAnalyzerType()).isEqualTo("trigger-correlation");
    }

    @Test
    void laterConfigChangesDoNotReachTheAnalyzer() {
        CorrelationConfig config = CorrelationConfig.defaults();
        FoodCorrelationAnalyzer analyzer = new FoodCorrelationAnalyzer(config);
        config.setMinimumExposures(1);

        CorrelationResult eggs = analyzer.analyze(dairyHistory()).stream()
            .filter(r -> r.key().equals("eggs"))
            .findFirst()
            .orElseThrow();

        assertThat(eggs.totalExposureDays()).isEqualTo(2);
        assertThat(eggs.analyzableExposures()).isZero();
        assertThat(eggs.pattern()).isEqualTo(CorrelationPattern.INSUFFICIENT_DATA);
        assertThat(analyzer.getConfig().getMinimumExposures()).isEqualTo(3);

        analyzer.getConfig().setMinimumExposures(1);
        assertThat(analyzer.getConfig().getMinimumExposures()).isEqualTo(3);
    }
}
