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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkerPoolTest {

  @Test
  @DisplayName("should run work on named daemon threads")
  void should_run_work_on_named_daemon_threads() throws Exception {
    try (var workerPool = WorkerPool.fixed(2)) {
      // When
      var thread = workerPool.submit(Thread::currentThread).toCompletableFuture().get();

      // Then
      assertThat(workerPool.size()).isEqualTo(2);
      assertThat(thread.getName()).startsWith("insar-ccd-worker-");
      assertThat(thread.isDaemon()).isTrue();
    }
  }

  @Test
  @DisplayName("should complete the stage exceptionally when the work fails")
  void should_propagate_work_failure() {
    try (var workerPool = WorkerPool.fixed(1)) {
      // When
      var stage = workerPool.submit(() -> {
        throw new IllegalStateException("boom");
      }).toCompletableFuture();

      // Then
      assertThatThrownBy(stage::get).isInstanceOf(ExecutionException.class)
                                    .hasCauseInstanceOf(IllegalStateException.class);
    }
  }

  @Test
  @DisplayName("should reject work once closed")
  void should_reject_work_once_closed() {
    // Given
    var workerPool = WorkerPool.fixed(1);

    // When
    workerPool.close();
    workerPool.close();
    var stage = workerPool.submit(() -> "late").toCompletableFuture();

    // Then
    assertThat(workerPool.isClosed()).isTrue();
    assertThatThrownBy(stage::get).hasCauseInstanceOf(RejectedExecutionException.class);
  }

  @Test
  @DisplayName("should require at least one worker")
  void should_require_at_least_one_worker() {
    assertThatThrownBy(() -> WorkerPool.fixed(0)).isInstanceOf(IllegalArgumentException.class);
  }
}
