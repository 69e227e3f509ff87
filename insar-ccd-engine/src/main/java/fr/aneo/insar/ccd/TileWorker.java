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

import fr.aneo.insar.ccd.domain.ArrayHandle;
import fr.aneo.insar.ccd.domain.ArrayStoreClient;
import fr.aneo.insar.ccd.domain.ChangeMap;
import fr.aneo.insar.ccd.domain.ComplexMatrix;
import fr.aneo.insar.ccd.domain.Range;
import fr.aneo.insar.ccd.domain.TaskDescriptor;
import fr.aneo.insar.ccd.domain.TaskFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import static fr.aneo.insar.ccd.domain.AccessMode.READ;
import static fr.aneo.insar.ccd.domain.AccessMode.WRITE;
import static java.util.Objects.requireNonNull;

/**
 * {@link TileProcessor} reading both selected bands of a tile from the store, estimating their
 * change map window by window, despeckling it and writing it back at the same spatial offset.
 * <p>
 * While a task runs, the MDC holds {@code tileX}, {@code tileY} and {@code output}. Any
 * exception raised along the way is reported as a {@link TaskOutcome.Failure} carrying the task.
 */
final class TileWorker implements TileProcessor {
  private static final Logger logger = LoggerFactory.getLogger(TileWorker.class);

  private final ArrayStoreClient store;
  private final DespeckleFilter despeckleFilter;

  TileWorker(ArrayStoreClient store, DespeckleFilter despeckleFilter) {
    this.store = requireNonNull(store, "store must not be null");
    this.despeckleFilter = requireNonNull(despeckleFilter, "despeckleFilter must not be null");
  }

  @Override
  public TaskOutcome process(TaskDescriptor task, CancellationToken token) {
    MDC.put("tileX", String.valueOf(task.coordinate().tileX()));
    MDC.put("tileY", String.valueOf(task.coordinate().tileY()));
    MDC.put("output", task.output().asString());
    try {
      token.throwIfCancelled(task);
      logger.debug("Processing tile rows={} columns={}", task.rows(), task.columns());

      var changeMap = estimate(task, token);
      try (var output = store.open(task.output(), WRITE, task.storeConfig())) {
        output.write(task.rows(), task.columns(), changeMap);
      }

      logger.debug("Tile written");
      return TaskOutcome.success(task);
    } catch (TaskFailureException e) {
      logger.warn("Tile not written: {}", e.getMessage());
      return TaskOutcome.failure(e);
    } catch (Exception e) {
      logger.error("Error while processing tile", e);
      return TaskOutcome.failure(new TaskFailureException(task, e));
    } finally {
      MDC.remove("tileX");
      MDC.remove("tileY");
      MDC.remove("output");
    }
  }

  private ChangeMap estimate(TaskDescriptor task, CancellationToken token) {
    ComplexMatrix reference;
    ComplexMatrix compared;
    try (var input = store.open(task.input(), READ, task.storeConfig())) {
      reference = readBand(input, task, task.bands().first());
      compared = readBand(input, task, task.bands().second());
    }

    var estimator = new WindowedChangeEstimator(task.windowSize());
    var changeMap = estimator.estimate(reference, compared, () -> token.throwIfCancelled(task));
    return despeckleFilter.apply(changeMap);
  }

  private static ComplexMatrix readBand(ArrayHandle input, TaskDescriptor task, int band) {
    return input.readComplex(Range.single(band), task.rows(), task.columns()).band(0);
  }
}
