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

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArrayDescriptorTest {

  @Test
  @DisplayName("should describe a radar stack as band, y and x dimensions of complex values")
  void should_describe_stack() {
    // When
    var stack = ArrayDescriptor.stack(ArrayUri.from("mem://stack"), 2, 100, 80, 50, 40);

    // Then
    assertThat(stack.rank()).isEqualTo(3);
    assertThat(stack.dimensions()).extracting(Dimension::name)
                                  .containsExactly(Dimension.BANDS, Dimension.Y, Dimension.X);
    assertThat(stack.attribute()).isEqualTo(ArrayDescriptor.STACK_ATTRIBUTE);
    assertThat(stack.attributeType()).isEqualTo(DataType.COMPLEX128);
    assertThat(stack.rows()).isEqualTo(new Dimension(Dimension.Y, 0, 99, 50));
    assertThat(stack.columns()).isEqualTo(new Dimension(Dimension.X, 0, 79, 40));
    assertThat(stack.elementCount()).isEqualTo(2L * 100 * 80);
  }

  @Test
  @DisplayName("should reject sparse arrays")
  void should_reject_sparse_arrays() {
    var dimensions = List.of(Dimension.of(Dimension.Y, 10, 5));

    assertThatThrownBy(() -> new ArrayDescriptor(ArrayUri.from("mem://a"), dimensions, "c", DataType.FLOAT32, true))
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessageContaining("sparse");
  }

  @Test
  @DisplayName("should reject arrays without dimensions")
  void should_reject_arrays_without_dimensions() {
    assertThatThrownBy(() -> ArrayDescriptor.dense(ArrayUri.from("mem://a"), List.of(), "c", DataType.FLOAT32))
      .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("should reject a non positive tile extent")
  void should_reject_non_positive_tile_extent() {
    assertThatThrownBy(() -> Dimension.of(Dimension.X, 10, 0))
      .isInstanceOf(IllegalArgumentException.class);
  }
}
