package io.flaresignals.command.subcommands;

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

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import io.flaresignals.command.CommandFixtures;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

@Tag("unit")
public class CMD_signals_flaresTest {

    @TempDir
    Path tempDir;

    @Test
    public void testReportShowsActiveFlare() throws IOException {
        Path input = CommandFixtures.writeFlareHistory(tempDir);

        CommandFixtures.Run run = CommandFixtures.execute("flares", "-i", input.toString(), "--days", "3");

        assertEquals(0, run.exitCode(), run.err());
        assertThat(run.out())
            .contains("Current state: Active flare")
            .contains("Confidence:    mature")
            .contains("Active flare:  yes, 5 days")
            .contains("Episodes (1):")
            .contains("Last 3 days:")
            .contains("2024-05-25");
        assertThat(run.out()).doesNotContain("2024-05-22");
    }

    @Test
    public void testJsonOutput() throws IOException {
        Path input = CommandFixtures.writeFlareHistory(tempDir);

        CommandFixtures.Run run = CommandFixtures.execute("flares", "--input", input.toString(), "--json");

        assertEquals(0, run.exitCode(), run.err());
        JsonObject json = JsonParser.parseString(run.out()).getAsJsonObject();
        assertEquals("active_flare", json.get("current_state").getAsString());
        assertEquals("mature", json.get("confidence").getAsString());
        assertEquals(25, json.getAsJsonArray("daily_states").size());
        assertEquals(5, json.get("current_flare_duration_days").getAsInt());
    }

    @Test
    public void testConfigFileIsApplied() throws IOException {
        Path input = CommandFixtures.writeFlareHistory(tempDir);
        Path config = tempDir.resolve("engine.json");
        Files.writeString(config, "{\"flare\": {\"threshold_margin\": 3.0}}");

        CommandFixtures.Run run = CommandFixtures.execute("flares", "-i", input.toString(), "--config", config.toString());

        assertEquals(0, run.exitCode(), run.err());
        assertThat(run.out()).contains("Active flare:  no").contains("Episodes (0):");
    }

    @Test
    public void testMissingInputIsAnInputError() {
        CommandFixtures.Run run = CommandFixtures.execute("flares", "-i", tempDir.resolve("none.json").toString());
        assertEquals(1, run.exitCode());
        assertThat(run.err()).contains("Error:");
    }

    @Test
    public void testInvalidConfigIsAnInputError() throws IOException {
        Path input = CommandFixtures.writeFlareHistory(tempDir);
        Path config = tempDir.resolve("engine.json");
        Files.writeString(config, "{\"flare\": {\"min_episode_days\": 1}}");

        CommandFixtures.Run run = CommandFixtures.execute("flares", "-i", input.toString(), "--config", config.toString());

        assertEquals(1, run.exitCode());
        assertThat(run.err()).contains("min_episode_days");
    }

    @Test
    public void testMalformedObservationsAreAnInputError() throws IOException {
        Path input = tempDir.resolve("bad.json");
        Files.writeString(input, "[{\"id\": \"x\", \"timestamp\": \"not a date\", \"skin_intensity\": 2}]");

        CommandFixtures.Run run = CommandFixtures.execute("flares", "-i", input.toString());

        assertEquals(1, run.exitCode());
    }
}
