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

class ArrayUriTest {

  @Test
  @DisplayName("should derive a sibling uri by appending a suffix")
  void should_append_suffix() {
    // Given
    var input = ArrayUri.from("s3://bucket/stack");

    // When
    var output = input.withSuffix("_result_AB12");

    // Then
    assertThat(output.asString()).isEqualTo("s3://bucket/stack_result_AB12");
    assertThat(input.asString()).isEqualTo("s3://bucket/stack");
  }

  @Test
  @DisplayName("should be equal when string representations are equal")
  void should_compare_by_value() {
    assertThat(ArrayUri.from("mem://a")).isEqualTo(ArrayUri.from("mem://a"))
                                        .hasSameHashCodeAs(ArrayUri.from("mem://a"))
                                        .isNotEqualTo(ArrayUri.from("mem://b"));
  }

  @Test
  @DisplayName("should reject blank uris and empty suffixes")
  void should_reject_blank_values() {
    assertThatThrownBy(() -> ArrayUri.from(" ")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> ArrayUri.from(null)).isInstanceOf(NullPointerException.class);
    assertThatThrownBy(() -> ArrayUri.from("mem://a").withSuffix("")).isInstanceOf(IllegalArgumentException.class);
  }
}
