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

import fr.aneo.insar.ccd.domain.TaskDescriptor;
import fr.aneo.insar.ccd.domain.TaskFailureException;

import static java.util.Objects.requireNonNull;

/**
 * Outcome of processing a single tile task.
 * <p>
 * Produced by a {@link TileProcessor} and consumed by the {@link Dispatcher}, which folds the
 * outcomes of all tasks of a job into a single {@link fr.aneo.insar.ccd.domain.JobResult}.
 *
 * <h2>Usage</h2>
 * <ul>
 *   <li>Return {@link #success(TaskDescriptor)} once the tile has been written.</li>
 *   <li>Return {@link #failure(TaskFailureException)} when the tile could not be produced.
 *       Exceptions escaping a processor are converted to {@link Failure} by the dispatcher.</li>
 * </ul>
 */
public sealed interface TaskOutcome {

  static Success success(TaskDescriptor task) {
    return new Success(task);
  }

  static Failure failure(TaskFailureException error) {
    return new Failure(error);
  }

  /**
   * @return the task this outcome reports on
   */
  TaskDescriptor task();

  /**
   * The tile was computed and written.
   *
   * @param task the completed task
   */
  record Success(TaskDescriptor task) implements TaskOutcome {
    public Success {
      requireNonNull(task, "task must not be null");
    }
  }

  /**
   * The tile could not be produced.
   *
   * @param error the failure, carrying the originating task
   */
  record Failure(TaskFailureException error) implements TaskOutcome {
    public Failure {
      requireNonNull(error, "error must not be null");
    }

    @Override
    public TaskDescriptor task() {
      return error.task();
    }
  }
}
