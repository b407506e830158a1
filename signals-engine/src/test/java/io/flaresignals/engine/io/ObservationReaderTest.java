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

import com.google.gson.JsonParseException;
import io.flaresignals.engine.model.Observation;
import io.flaresignals.engine.model.SymptomEntry;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ObservationReaderTest {

    @TempDir
    Path tempDir;

    @Test
    void readsAllFields() {
        String json = """
            [
              {
                "id": "c-1",
                "timestamp": "2025-02-04 08:30:00",
                "symptoms": [{"name": "itching", "severity": 2}],
                "skin_intensity": 3.5,
                "pain": 4,
                "sleep": 2,
                "mood": 3,
                "tags": ["food:dairy", "heat"]
              },
              {"id": "c-2", "timestamp": "2025-02-05", "skin_feeling": 4}
            ]
            """;
        List<Observation> observations = ObservationReader.fromJson(json);

        assertThat(observations).hasSize(2);
        Observation first = observations.get(0);
        assertThat(first.timestamp()).isEqualTo(LocalDateTime.of(2025, 2, 4, 8, 30));
        assertThat(first.symptoms()).containsExactly(new SymptomEntry("itching", 2));
        assertThat(first.skinIntensity()).isEqualTo(3.5);
        assertThat(first.pain()).isEqualTo(4);
        assertThat(first.tags()).containsExactly("food:dairy", "heat");

        Observation second = observations.get(1);
        assertThat(second.symptoms()).isEmpty();
        assertThat(second.tags()).isEmpty();
        assertThat(second.effectiveIntensity()).isEqualTo(1.0);
    }

    @Test
    void rejectsInvalidRecords() {
        assertThatThrownBy(() -> ObservationReader.fromJson("[{\"id\":\"x\",\"timestamp\":\"someday\",\"skin_intensity\":1}]"))
            .isInstanceOf(JsonParseException.class);
        assertThatThrownBy(() -> ObservationReader.fromJson("[{\"id\":\"x\",\"timestamp\":\"2025-01-01\",\"skin_intensity\":9}]"))
            .isInstanceOf(JsonParseException.class)
            .hasMessageContaining("skin intensity");
        assertThatThrownBy(() -> ObservationReader.fromJson("[{\"id\":\"x\",\"timestamp\":\"2025-01-01\"}]"))
            .isInstanceOf(JsonParseException.class);
        assertThatThrownBy(() -> ObservationReader.fromJson("[null]"))
            .isInstanceOf(JsonParseException.class);
    }

    @Test
    void emptyDocumentIsEmptyHistory() {
        assertThat(ObservationReader.fromJson("")).isEmpty();
        assertThat(ObservationReader.fromJson("[]")).isEmpty();
    }

    @Test
    void writtenHistoryReadsBack() throws IOException {
        List<Observation> observations = List.of(
            Observation.builder("a", LocalDateTime.of(2025, 3, 1, 7, 15)).skinIntensity(2).symptom("redness", 1).tag("heat").build(),
            Observation.builder("b", LocalDateTime.of(2025, 3, 2, 21, 0)).skinFeeling(3).mood(4).build());
        Path file = tempDir.resolve("history.json");
        Files.writeString(file, ObservationReader.toJson(observations));

        assertThat(Files.readString(file)).contains("\"skin_intensity\"");
        assertThat(ObservationReader.read(file)).isEqualTo(observations);
    }
}
