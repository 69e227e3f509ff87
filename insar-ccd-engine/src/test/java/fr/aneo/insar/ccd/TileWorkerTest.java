/*
 * Copyright © 2025 ANEO (armonik@aneo.fr)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package fr.aneo.insar.ccd;

import fr.aneo.insar.ccd.domain.ArrayStoreException;
import fr.aneo.insar.ccd.domain.ArrayUri;
import fr.aneo.insar.ccd.domain.ComplexStack;
import fr.aneo.insar.ccd.domain.StoreConfig;
import fr.aneo.insar.ccd.domain.TaskCancelledException;
import fr.aneo.insar.ccd.store.InMemoryArrayStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.HashMap;
import java.util.Map;
import java.util.Random;

import static fr.aneo.insar.ccd.TestDataFactory.gaussianBand;
import static fr.aneo.insar.ccd.TestDataFactory.readChangeMap;
import static fr.aneo.insar.ccd.TestDataFactory.task;
import static org.assertj.core.api.Assertions.assertThat;

class TileWorkerTest {
  private static final ArrayUri INPUT = ArrayUri.from("mem://stack");
  private static final ArrayUri OUTPUT = ArrayUri.from("mem://change");

  private InMemoryArrayStore store;

  @BeforeEach
  void setUp() {
    store = new InMemoryArrayStore();
    var band = gaussianBand(new Random(0), 20, 20);
    var input = store.ingest(INPUT, ComplexStack.of(band, band.copy()), 10, 10);
    new SchemaPlanner(store).create(input, OUTPUT, StoreConfig.empty());
  }

  @Test
  @DisplayName("should write the change map of the tile at its offset only")
  void should_write_tile_at_its_offset() {
    // Given
    var worker = new TileWorker(store, DespeckleFilter.NONE);

    // When
    var outcome = worker.process(task(INPUT, OUTPUT, 1, 0, 10, 3), CancellationToken.none());

    // Then
    assertThat(outcome).isEqualTo(TaskOutcome.success(task(INPUT, OUTPUT, 1, 0, 10, 3)));
    var changeMap = readChangeMap(store, OUTPUT);
    for (int r = 0; r < 20; r++) {
      for (int c = 0; c < 20; c++) {
        var expected = r < 10 && c >= 10 ? 1f : 0f;
        assertThat(changeMap.get(r, c)).as("cell (%d, %d)", r, c).isEqualTo(expected);
      }
    }
  }

  @Test
  @DisplayName("should expose the tile in the MDC while processing and clear it afterwards")
  void should_expose_tile_in_mdc() {
    // Given
    Map<String, String> seen = new HashMap<>();
    var worker = new TileWorker(store, tile -> {
      seen.put("tileX", MDC.get("tileX"));
      seen.put("tileY", MDC.get("tileY"));
      seen.put("output", MDC.get("output"));
      return tile;
    });

    // When
    worker.process(task(INPUT, OUTPUT, 0, 1, 10, 3), CancellationToken.none());

    // Then
    assertThat(seen).containsEntry("tileX", "0")
                    .containsEntry("tileY", "1")
                    .containsEntry("output", "mem://change");
    assertThat(MDC.get("tileX")).isNull();
    assertThat(MDC.get("output")).isNull();
  }

  @Test
  @DisplayName("should report a store error as a failure of the task")
  void should_report_store_error_as_failure() {
    // Given
    var worker = new TileWorker(store, DespeckleFilter.NONE);
    var task = task(INPUT, ArrayUri.from("mem://missing"), 0, 0, 10, 3);

    // When
    var outcome = worker.process(task, CancellationToken.none());

    // Then
    assertThat(outcome).isInstanceOf(TaskOutcome.Failure.class);
    var failure = (TaskOutcome.Failure) outcome;
    assertThat(failure.task()).isEqualTo(task);
    assertThat(failure.error()).hasCauseInstanceOf(ArrayStoreException.class);
  }

  @Test
  @DisplayName("should not write anything once the job is cancelled")
  void should_not_write_when_cancelled() {
    // Given
    var worker = new TileWorker(store, DespeckleFilter.NONE);
    var token = CancellationToken.create();
    token.cancel();

    // When
    var outcome = worker.process(task(INPUT, OUTPUT, 0, 0, 10, 3), token);

    // Then
    assertThat(((TaskOutcome.Failure) outcome).error()).isInstanceOf(TaskCancelledException.class);
    assertThat(readChangeMap(store, OUTPUT).toArray()).containsOnly(0f);
  }
}
