package io.flaresignals.engine.config;

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

import com.google.gson.JsonParseException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class EngineConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void missingKeysKeepDefaults() {
        EngineConfig config = EngineConfig.fromJson("{\"flare\": {\"threshold_margin\": 0.75}}");

        assertThat(config.getFlare().getThresholdMargin()).isEqualTo(0.75);
        assertThat(config.getFlare().getBaselineWindowDays()).isEqualTo(14);
        assertThat(config.getFlare().getMinEpisodeDays()).isEqualTo(3);
        assertThat(config.getCorrelation().getMinimumExposures()).isEqualTo(3);
        assertThat(config.getCorrelation().getBetterDelta()).isEqualTo(-0.5);
    }

    @Test
    void nullSectionFallsBackToDefaults() {
        EngineConfig config = EngineConfig.fromJson("{\"flare\": null, \"correlation\": {\"reaction_window_days\": 2}}");
        assertThat(config.getFlare().getMatureMinDays()).isEqualTo(14);
        assertThat(config.getCorrelation().getReactionWindowDays()).isEqualTo(2);
    }

    @Test
    void invalidValuesNameTheKey() {
        assertThatThrownBy(() -> EngineConfig.fromJson("{\"flare\": {\"min_episode_days\": 2}}"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("min_episode_days");
        assertThatThrownBy(() -> EngineConfig.fromJson("{\"correlation\": {\"dominant_ratio\": 0.4}}"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("dominant_ratio");
        assertThatThrownBy(() -> EngineConfig.fromJson(""))
            .isInstanceOf(JsonParseException.class);
    }

    @Test
    void savedConfigLoadsBack() throws IOException {
        EngineConfig config = new EngineConfig(
            FlareDetectionConfig.defaults().setBaselineWindowDays(21).setResolvingWindowDays(5),
            CorrelationConfig.defaults().setLocalBaselineWindowDays(10));
        Path file = tempDir.resolve("engine.json");
        config.save(file);

        EngineConfig loaded = EngineConfig.load(file);
        assertThat(loaded.getFlare().getBaselineWindowDays()).isEqualTo(21);
        assertThat(loaded.getFlare().getResolvingWindowDays()).isEqualTo(5);
        assertThat(loaded.getCorrelation().getLocalBaselineWindowDays()).isEqualTo(10);
    }
}
