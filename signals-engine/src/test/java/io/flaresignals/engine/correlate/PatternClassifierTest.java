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
import io.flaresignals.engine.model.CorrelationConfidence;
import io.flaresignals.engine.model.CorrelationPattern;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

@Tag("unit")
class PatternClassifierTest {

    private final PatternClassifier classifier = new PatternClassifier(CorrelationConfig.defaults());

    @Test
    void patterns() {
        assertEquals(CorrelationPattern.OFTEN_WORSE, classifier.pattern(3, 1, 1));
        assertEquals(CorrelationPattern.OFTEN_BETTER, classifier.pattern(0, 3, 2));
        assertEquals(CorrelationPattern.MIXED, classifier.pattern(2, 1, 3));
        assertEquals(CorrelationPattern.NO_PATTERN, classifier.pattern(1, 1, 3));
        assertEquals(CorrelationPattern.INSUFFICIENT_DATA, classifier.pattern(2, 0, 0));
    }

    @Test
    void worseWinsOverBetterOnlyWhenDominant() {
        // 3 of 5 worse reaches 0.6 exactly
        assertEquals(CorrelationPattern.OFTEN_WORSE, classifier.pattern(3, 2, 0));
        assertEquals(CorrelationPattern.MIXED, classifier.pattern(2, 2, 1));
    }

    @Test
    void consistencyIsTheMajorityShare() {
        assertEquals(0.6, classifier.consistency(3, 1, 1), 1e-12);
        assertEquals(0.5, classifier.consistency(0, 2, 2), 1e-12);
        assertEquals(0.0, classifier.consistency(0, 0, 0));
    }

    @Test
    void confidenceBands() {
        assertEquals(CorrelationConfidence.LOW, classifier.confidence(4, 1.0));
        assertEquals(CorrelationConfidence.MEDIUM, classifier.confidence(5, 0.6));
        assertEquals(CorrelationConfidence.LOW, classifier.confidence(7, 0.59));
        assertEquals(CorrelationConfidence.HIGH, classifier.confidence(8, 0.6));
        assertEquals(CorrelationConfidence.MEDIUM, classifier.confidence(20, 0.4));
    }
}
