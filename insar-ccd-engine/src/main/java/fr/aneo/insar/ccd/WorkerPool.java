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

import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import fr.aneo.insar.ccd.internal.concurrent.Futures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

import static java.util.Objects.requireNonNull;
import static java.util.concurrent.CompletableFuture.failedFuture;
import static java.util.concurrent.TimeUnit.SECONDS;

/**
 * Fixed-size pool of worker threads executing tile tasks.
 * <p>
 * The pool is an explicit resource: the caller creates it, hands it to one or more
 * {@link ChangeDetectionJob}s and closes it once done, typically with try-with-resources:
 * <pre>{@code
 * try (var workerPool = WorkerPool.fixed(8)) {
 *   var job = new ChangeDetectionJob(store, workerPool, config);
 *   var result = job.run(request);
 * }
 * }</pre>
 * Threads are daemon threads named {@code insar-ccd-worker-<index>}. Submission never blocks:
 * tasks exceeding the pool size are queued.
 */
public final class WorkerPool implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(WorkerPool.class);

  private final ListeningExecutorService executor;
  private final int size;

  private WorkerPool(ListeningExecutorService executor, int size) {
    this.executor = executor;
    this.size = size;
  }

  /**
   * Creates a pool of {@code workers} threads.
   *
   * @param workers number of threads; strictly positive
   * @return a started pool
   * @throws IllegalArgumentException if {@code workers <= 0}
   */
  public static WorkerPool fixed(int workers) {
    if (workers <= 0) {
      throw new IllegalArgumentException("workers must be > 0, got: " + workers);
    }
    var threadFactory = new ThreadFactoryBuilder().setNameFormat("insar-ccd-worker-%d")
                                                  .setDaemon(true)
                                                  .build();
    logger.info("Starting worker pool with {} threads", workers);
    return new WorkerPool(MoreExecutors.listeningDecorator(Executors.newFixedThreadPool(workers, threadFactory)), workers);
  }

  public int size() {
    return size;
  }

  /**
   * Schedules {@code work} on the pool.
   * <p>
   * If the pool no longer accepts work, the returned stage is already failed with a
   * {@link RejectedExecutionException}.
   *
   * @param work the work to run; must not be {@code null}
   * @return a stage completed with the outcome of {@code work}
   */
  public <T> CompletionStage<T> submit(Callable<T> work) {
    requireNonNull(work, "work must not be null");
    try {
      return Futures.toCompletionStage(executor.submit(work));
    } catch (RejectedExecutionException e) {
      return failedFuture(e);
    }
  }

  public boolean isClosed() {
    return executor.isShutdown();
  }

  /**
   * Stops accepting work and waits up to 30 seconds for queued and running tasks to finish,
   * then interrupts whatever is still running. Calling this method more than once has no
   * further effect.
   */
  @Override
  public void close() {
    if (executor.isShutdown()) return;

    logger.info("Shutting down worker pool...");
    executor.shutdown();
    try {
      if (!executor.awaitTermination(30, SECONDS)) {
        logger.warn("Worker pool graceful shutdown timed out. Forcing shutdown...");
        executor.shutdownNow();
        executor.awaitTermination(5, SECONDS);
      }
      logger.info("Worker pool stopped.");
    } catch (InterruptedException e) {
      logger.warn("Worker pool shutdown interrupted");
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
