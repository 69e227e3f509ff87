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

import fr.aneo.insar.ccd.domain.TaskCancelledException;
import fr.aneo.insar.ccd.domain.TaskDescriptor;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag shared by the tasks of a job.
 * <p>
 * Cancelling never interrupts a thread: tasks check the flag before they start and between
 * rows of estimation windows, and stop with a {@link TaskCancelledException} once it is set.
 * Every task is still accounted for by the job, which then reports a failure. Tiles already
 * written stay in place.
 */
public final class CancellationToken {
  private static final CancellationToken NONE = new CancellationToken(false);

  private final AtomicBoolean cancelled = new AtomicBoolean();
  private final boolean cancellable;

  private CancellationToken(boolean cancellable) {
    this.cancellable = cancellable;
  }

  /**
   * @return a fresh token, not cancelled
   */
  public static CancellationToken create() {
    return new CancellationToken(true);
  }

  /**
   * @return a shared token that can never be cancelled
   */
  public static CancellationToken none() {
    return NONE;
  }

  /**
   * Requests cancellation of every task observing this token.
   *
   * @throws UnsupportedOperationException if called on {@link #none()}
   */
  public void cancel() {
    if (!cancellable) throw new UnsupportedOperationException("this token cannot be cancelled");
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  void throwIfCancelled(TaskDescriptor task) {
    if (isCancelled()) throw new TaskCancelledException(task);
  }
}
