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

import fr.aneo.insar.ccd.domain.ArrayUri;
import fr.aneo.insar.ccd.domain.CcdException;
import fr.aneo.insar.ccd.domain.JobResult;
import fr.aneo.insar.ccd.domain.TaskDescriptor;
import fr.aneo.insar.ccd.domain.TaskFailureException;
import fr.aneo.insar.ccd.internal.concurrent.Futures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * Fans the tile tasks of a job out to a {@link WorkerPool} and gathers their outcomes.
 *
 * <h2>Failure policy</h2>
 * <p>
 * Every task is submitted exactly once and the dispatcher waits for all of them to report,
 * whether or not some already failed: sibling tasks are never cancelled because of a failure.
 * The job then fails with the first {@link TaskFailureException} reported, in completion order;
 * the failures reported after it are attached to it as suppressed exceptions. No task is retried.
 * <p>
 * A processor that throws instead of returning a {@link TaskOutcome.Failure}, or a task the pool
 * rejects, is reported as a failure of that task.
 *
 * <h2>Threading</h2>
 * <p>
 * {@link #dispatch} is called from the job driver thread, which blocks only while waiting for
 * the last outcome. Outcomes are recorded on the worker threads as they complete.
 */
public final class Dispatcher {
  private static final Logger logger = LoggerFactory.getLogger(Dispatcher.class);

  private final WorkerPool workerPool;
  private final TileProcessor tileProcessor;

  public Dispatcher(WorkerPool workerPool, TileProcessor tileProcessor) {
    this.workerPool = requireNonNull(workerPool, "workerPool must not be null");
    this.tileProcessor = requireNonNull(tileProcessor, "tileProcessor must not be null");
  }

  /**
   * Runs every task of {@code tasks} and folds their outcomes into a job result.
   *
   * @param output location of the change map written by the tasks
   * @param tasks  the tasks, consumed once
   * @param token  cancellation flag shared by the tasks
   * @return {@link JobResult.Completed} if every task succeeded, otherwise {@link JobResult.Failed}
   *         with the first failure
   */
  public JobResult dispatch(ArrayUri output, Stream<TaskDescriptor> tasks, CancellationToken token) {
    requireNonNull(output, "output must not be null");
    requireNonNull(tasks, "tasks must not be null");
    requireNonNull(token, "token must not be null");

    var gathering = new Gathering();
    List<CompletionStage<TaskOutcome>> stages = new ArrayList<>();
    tasks.forEach(task -> stages.add(submit(task, token).thenApply(gathering::record)));
    logger.debug("Submitted {} tasks for {}", stages.size(), output.asString());

    try {
      Futures.allOf(stages).toCompletableFuture().get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.warn("Interrupted while waiting for the tasks of {}", output.asString());
      return JobResult.failed(new CcdException("interrupted while waiting for the tasks of " + output.asString(), e));
    } catch (ExecutionException e) {
      return JobResult.failed(new CcdException("unexpected error while gathering the tasks of " + output.asString(), e.getCause()));
    }

    return gathering.result(output, stages.size());
  }

  private CompletionStage<TaskOutcome> submit(TaskDescriptor task, CancellationToken token) {
    return workerPool.submit(() -> tileProcessor.process(task, token))
                     .handle((outcome, throwable) -> {
                       if (throwable != null) return TaskOutcome.failure(asTaskFailure(task, throwable));
                       if (outcome == null) {
                         return TaskOutcome.failure(new TaskFailureException(task, new IllegalStateException("processor returned no outcome")));
                       }
                       return outcome;
                     });
  }

  private static TaskFailureException asTaskFailure(TaskDescriptor task, Throwable throwable) {
    var cause = throwable instanceof CompletionException && throwable.getCause() != null ? throwable.getCause() : throwable;
    return cause instanceof TaskFailureException failure ? failure : new TaskFailureException(task, cause);
  }

  private static final class Gathering {
    private final AtomicReference<TaskFailureException> firstFailure = new AtomicReference<>();
    private final ConcurrentLinkedQueue<TaskFailureException> laterFailures = new ConcurrentLinkedQueue<>();

    TaskOutcome record(TaskOutcome outcome) {
      if (outcome instanceof TaskOutcome.Failure failure && !firstFailure.compareAndSet(null, failure.error())) {
        laterFailures.add(failure.error());
      }
      return outcome;
    }

    JobResult result(ArrayUri output, int taskCount) {
      var first = firstFailure.get();
      if (first == null) {
        logger.info("All {} tasks of {} succeeded", taskCount, output.asString());
        return JobResult.completed(output);
      }

      laterFailures.forEach(first::addSuppressed);
      logger.error("{} of {} tasks of {} failed, first failure: {}",
        laterFailures.size() + 1, taskCount, output.asString(), first.getMessage());
      return JobResult.failed(first);
    }
  }
}
