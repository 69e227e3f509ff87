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
 * Reports the failure of the task computing one tile.
 * <p>
 * The originating {@link TaskDescriptor} is kept so that the failing tile can be identified and,
 * if needed, re-dispatched by the caller. When several tasks of a job fail, the first failure
 * is reported and the later ones are attached to it as suppressed exceptions.
 */
public class TaskFailureException extends CcdException {
  private final transient TaskDescriptor task;

  public TaskFailureException(TaskDescriptor task, Throwable cause) {
    super(messageOf(task, cause), cause);
    this.task = requireNonNull(task, "task must not be null");
  }

  protected TaskFailureException(TaskDescriptor task, String message) {
    super(message);
    this.task = requireNonNull(task, "task must not be null");
  }

  public TaskDescriptor task() {
    return task;
  }

  private static String messageOf(TaskDescriptor task, Throwable cause) {
    String reason = cause == null
      ? "unknown error"
      : (cause.getMessage() != null ? cause.getMessage() : cause.toString());
    return "tile " + task.coordinate() + " of " + task.output().asString() + " failed: " + reason;
  }
}
