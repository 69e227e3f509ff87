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

import com.google.common.base.Stopwatch;
import fr.aneo.insar.ccd.domain.ArrayDescriptor;
import fr.aneo.insar.ccd.domain.ArrayStoreClient;
import fr.aneo.insar.ccd.domain.ArrayStoreException;
import fr.aneo.insar.ccd.domain.ArrayUri;
import fr.aneo.insar.ccd.domain.BandPair;
import fr.aneo.insar.ccd.domain.DataType;
import fr.aneo.insar.ccd.domain.InputUnavailableException;
import fr.aneo.insar.ccd.domain.InvalidBandSelectionException;
import fr.aneo.insar.ccd.domain.JobResult;
import fr.aneo.insar.ccd.domain.SchemaConflictException;
import fr.aneo.insar.ccd.domain.StoreConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * Computes the change map between two bands of a radar stack.
 * <p>
 * A run validates the request, creates the output schema, partitions the spatial plane into
 * tiles and dispatches one task per tile on the {@link WorkerPool}. The output schema is always
 * created before any task is submitted.
 *
 * <h2>Errors</h2>
 * <p>
 * Invalid requests are rejected by throwing, before anything is created in the store:
 * </p>
 * <ol>
 *   <li>{@link InvalidBandSelectionException} if the selection does not hold exactly two
 *       non-negative band indices; the store is not accessed at all</li>
 *   <li>{@link IllegalArgumentException} if the window or neighbourhood size is not strictly positive</li>
 *   <li>{@link InputUnavailableException} if the input is missing, unreadable, not a
 *       {@code (band, y, x)} stack of complex values, or lacks a selected band</li>
 *   <li>{@link SchemaConflictException} if the requested output already exists</li>
 * </ol>
 * <p>
 * Failures of tile tasks are not thrown: they are returned as {@link JobResult.Failed}. The
 * partially written output is then left in place for inspection and must not be used.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * var config = CcdConfig.builder().build();
 * try (var workerPool = WorkerPool.fixed(config.workerCount())) {
 *   var job = new ChangeDetectionJob(store, workerPool, config);
 *   var output = job.run(config.requestBuilder()
 *                              .input("s3://bucket/stack")
 *                              .bands(0, 1)
 *                              .build())
 *                   .outputOrThrow();
 * }
 * }</pre>
 */
public final class ChangeDetectionJob {
  private static final Logger logger = LoggerFactory.getLogger(ChangeDetectionJob.class);

  private final ArrayStoreClient store;
  private final WorkerPool workerPool;
  private final CcdConfig config;
  private final SchemaPlanner schemaPlanner;
  private final TaskPartitioner taskPartitioner;

  public ChangeDetectionJob(ArrayStoreClient store, WorkerPool workerPool, CcdConfig config) {
    this(store, workerPool, config, new SchemaPlanner(store));
  }

  ChangeDetectionJob(ArrayStoreClient store, WorkerPool workerPool, CcdConfig config, SchemaPlanner schemaPlanner) {
    this.store = requireNonNull(store, "store must not be null");
    this.workerPool = requireNonNull(workerPool, "workerPool must not be null");
    this.config = requireNonNull(config, "config must not be null");
    this.schemaPlanner = requireNonNull(schemaPlanner, "schemaPlanner must not be null");
    this.taskPartitioner = new TaskPartitioner(config.edgeTilePolicy());
  }

  public CcdConfig config() {
    return config;
  }

  /**
   * Runs a change detection with the given parameters.
   *
   * @param input             the radar stack
   * @param bands             the selected band indices
   * @param output            the output location, or {@code null} to derive one from the input
   * @param windowSize        edge length of the estimation windows
   * @param neighbourhoodSize edge length of the despeckle neighbourhood
   * @param storeConfig       settings forwarded to the store
   * @return the outcome of the job
   */
  public JobResult run(ArrayUri input,
                       List<Integer> bands,
                       ArrayUri output,
                       int windowSize,
                       int neighbourhoodSize,
                       StoreConfig storeConfig) {
    return run(new ChangeDetectionRequest(input, bands, output, windowSize, neighbourhoodSize, storeConfig));
  }

  public JobResult run(ChangeDetectionRequest request) {
    return run(request, CancellationToken.none());
  }

  /**
   * Runs a change detection that can be cancelled through {@code token}.
   * <p>
   * Cancelling stops the tasks that have not finished yet; the job still waits for every task
   * and then returns a {@link JobResult.Failed} carrying a
   * {@link fr.aneo.insar.ccd.domain.TaskCancelledException}.
   *
   * @param request the parameters of the run
   * @param token   the cancellation flag
   * @return the outcome of the job
   */
  public JobResult run(ChangeDetectionRequest request, CancellationToken token) {
    requireNonNull(request, "request must not be null");
    requireNonNull(token, "token must not be null");

    var bands = BandPair.from(request.bands());
    requirePositive("windowSize", request.windowSize());
    requirePositive("neighbourhoodSize", request.neighbourhoodSize());

    var stopwatch = Stopwatch.createStarted();
    var input = describeInput(request.input(), bands, request.storeConfig());
    var output = schemaPlanner.create(input, request.output(), request.storeConfig());
    var grid = taskPartitioner.gridOf(output);
    logger.info("Computing change map {} from bands {} and {} of {}: {}x{} tiles, window {}",
      output.uri().asString(), bands.first(), bands.second(), input.uri().asString(),
      grid.tilesX(), grid.tilesY(), request.windowSize());

    var tasks = taskPartitioner.partition(input.uri(), output, bands, request.windowSize(), request.storeConfig());
    var tileWorker = new TileWorker(store, config.despeckle().create(request.neighbourhoodSize()));
    var result = new Dispatcher(workerPool, tileWorker).dispatch(output.uri(), tasks, token);

    if (result.isCompleted()) {
      logger.info("Change map {} completed in {} ms", output.uri().asString(), stopwatch.elapsed(MILLISECONDS));
    } else {
      logger.error("Change map {} failed after {} ms; the partial output is left in place",
        output.uri().asString(), stopwatch.elapsed(MILLISECONDS));
    }
    return result;
  }

  private ArrayDescriptor describeInput(ArrayUri uri, BandPair bands, StoreConfig storeConfig) {
    ArrayDescriptor descriptor;
    try {
      if (!store.exists(uri, storeConfig)) {
        throw new InputUnavailableException(uri, "input array does not exist: " + uri.asString());
      }
      descriptor = store.describe(uri, storeConfig);
    } catch (ArrayStoreException e) {
      throw new InputUnavailableException(uri, "input array is unreadable: " + uri.asString(), e);
    }

    if (descriptor.rank() != 3) {
      throw new InputUnavailableException(uri, "expected a (band, y, x) stack, got " + descriptor.rank() + " dimensions for " + uri.asString());
    }
    if (descriptor.attributeType() != DataType.COMPLEX128) {
      throw new InputUnavailableException(uri, "expected complex values, got " + descriptor.attributeType() + " for " + uri.asString());
    }
    var bandDimension = descriptor.dimension(0);
    if (!bandDimension.contains(bands.first()) || !bandDimension.contains(bands.second())) {
      throw new InputUnavailableException(uri, "bands " + bands.first() + " and " + bands.second() + " are not both within ["
        + bandDimension.start() + ", " + bandDimension.end() + "] of " + uri.asString());
    }
    return descriptor;
  }

  private static void requirePositive(String name, int value) {
    if (value <= 0) throw new IllegalArgumentException(name + " must be > 0, got: " + value);
  }
}
