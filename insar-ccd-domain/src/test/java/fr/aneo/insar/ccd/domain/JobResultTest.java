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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobResultTest {

  @Test
  @DisplayName("should return the output of a completed job")
  void should_return_output_of_completed_job() {
    // Given
    var result = JobResult.completed(ArrayUri.from("mem://out"));

    // When - Then
    assertThat(result.isCompleted()).isTrue();
    assertThat(result.outputOrThrow()).isEqualTo(ArrayUri.from("mem://out"));
  }

  @Test
  @DisplayName("should rethrow the error of a failed job")
  void should_rethrow_error_of_failed_job() {
    // Given
    var error = new SchemaConflictException(ArrayUri.from("mem://out"));
    var result = JobResult.failed(error);

    // When - Then
    assertThat(result.isCompleted()).isFalse();
    assertThatThrownBy(result::outputOrThrow).isSameAs(error);
  }
}
