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

import io.flaresignals.engine.config.FlareDetectionConfig;
import io.flaresignals.engine.model.BaselineConfidence;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
class ConfidenceGateTest {

    @Test
    void defaultTiers() {
        ConfidenceGate gate = new ConfidenceGate(FlareDetectionConfig.defaults());
        assertEquals(BaselineConfidence.EARLY, gate.tierFor(1));
        assertEquals(BaselineConfidence.EARLY, gate.tierFor(6));
        assertEquals(BaselineConfidence.PROVISIONAL, gate.tierFor(7));
        assertEquals(BaselineConfidence.PROVISIONAL, gate.tierFor(13));
        assertEquals(BaselineConfidence.MATURE, gate.tierFor(14));
        assertTrue(gate.isGated(6));
        assertFalse(gate.isGated(7));
    }

    @Test
    void configuredTiers() {
        ConfidenceGate gate = new ConfidenceGate(FlareDetectionConfig.defaults()
            .setProvisionalMinDays(3)
            .setMatureMinDays(5));
        assertEquals(BaselineConfidence.EARLY, gate.tierFor(2));
        assertEquals(BaselineConfidence.PROVISIONAL, gate.tierFor(4));
        assertEquals(BaselineConfidence.MATURE, gate.tierFor(5));
    }
}
