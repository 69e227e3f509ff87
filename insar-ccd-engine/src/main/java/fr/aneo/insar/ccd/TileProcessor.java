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

/**
 * Computes and writes the change map of one tile.
 * <p>
 * Implementations are invoked concurrently from the threads of a {@link WorkerPool}, once per
 * task. They should report failures through {@link TaskOutcome.Failure} rather than by throwing.
 */
@FunctionalInterface
public interface TileProcessor {

  /**
   * @param task  the tile to produce
   * @param token cancellation flag of the job
   * @return the outcome of the task; never {@code null}
   */
  TaskOutcome process(TaskDescriptor task, CancellationToken token);
}
