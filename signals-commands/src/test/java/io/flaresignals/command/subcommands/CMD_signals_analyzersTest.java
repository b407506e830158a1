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

import io.flaresignals.command.CommandFixtures;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

@Tag("unit")
public class CMD_signals_analyzersTest {

    @Test
    public void testListsEveryAnalyzer() {
        CommandFixtures.Run run = CommandFixtures.execute("analyzers");

        assertEquals(0, run.exitCode());
        assertThat(run.out())
            .contains("flare")
            .contains("food-correlation")
            .contains("product-correlation")
            .contains("trigger-correlation");
    }

    @Test
    public void testHelpWithoutSubcommand() {
        CommandFixtures.Run run = CommandFixtures.execute();

        assertEquals(0, run.exitCode());
        assertThat(run.out()).contains("flares").contains("triggers").contains("export");
    }
}
