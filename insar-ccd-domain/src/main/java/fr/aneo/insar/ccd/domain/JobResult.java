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
package fr.aneo.insar.ccd.domain;

import static java.util.Objects.requireNonNull;

/**
 * Terminal outcome of a change detection job.
 *
 * <h2>Usage</h2>
 * <ul>
 *   <li>{@link Completed} carries the location of a fully written change map.</li>
 *   <li>{@link Failed} carries the first error reported by the job. The output array, if it was
 *       created, is left in place for inspection but must be considered unusable: it may hold
 *       a mixture of computed tiles and default filled regions.</li>
 * </ul>
 */
public sealed interface JobResult {

  static Completed completed(ArrayUri output) {
    return new Completed(output);
  }

  static Failed failed(CcdException error) {
    return new Failed(error);
  }

  default boolean isCompleted() {
    return this instanceof Completed;
  }

  /**
   * Returns the output location of a completed job, or throws the error of a failed one.
   *
   * @return the location of the change map
   * @throws CcdException the error of a failed job
   */
  default ArrayUri outputOrThrow() {
    if (this instanceof Completed completed) {
      return completed.output();
    }
    throw ((Failed) this).error();
  }

  /**
   * All tiles were computed and written.
   *
   * @param output location of the change map
   */
  record Completed(ArrayUri output) implements JobResult {
    public Completed {
      requireNonNull(output, "output must not be null");
    }
  }

  /**
   * At least one tile could not be computed.
   *
   * @param error the first error reported; later task failures are attached as suppressed exceptions
   */
  record Failed(CcdException error) implements JobResult {
    public Failed {
      requireNonNull(error, "error must not be null");
    }
  }
}
