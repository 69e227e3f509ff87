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

import fr.aneo.insar.ccd.domain.ComplexMatrix;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static fr.aneo.insar.ccd.TestDataFactory.gaussianBand;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.data.Offset.offset;

class ChangeMetricKernelTest {

  @Test
  @DisplayName("should report no change when both samples are identical")
  void should_report_no_change_for_identical_samples() {
    // Given
    var b1 = gaussianBand(new Random(42), 7, 7);
    var b2 = b1.copy();

    // When
    var changeMap = ChangeMetricKernel.apply(b1, b2);

    // Then
    assertThat(changeMap.rows()).isEqualTo(7);
    assertThat(changeMap.columns()).isEqualTo(7);
    assertThat(changeMap.toArray()).containsOnly(1f);
  }

  @Test
  @DisplayName("should report no change when both samples hold no energy")
  void should_report_no_change_without_energy() {
    // Given
    var b1 = ComplexMatrix.zeros(5, 5);
    var b2 = ComplexMatrix.zeros(5, 5);

    // When
    var alpha = ChangeMetricKernel.alpha(b1, b2);

    // Then
    assertThat(alpha).isEqualTo(1.0);
  }

  @Test
  @DisplayName("should report complete change when one sample holds no energy")
  void should_report_complete_change_when_one_sample_is_empty() {
    // Given
    var b1 = gaussianBand(new Random(1), 4, 4);
    var b2 = ComplexMatrix.zeros(4, 4);

    // When
    var alpha = ChangeMetricKernel.alpha(b1, b2);

    // Then
    assertThat(alpha).isEqualTo(0.0);
  }

  @Test
  @DisplayName("should keep estimates within [0, 1] for unrelated samples")
  void should_keep_estimates_in_unit_interval() {
    var random = new Random(7);
    for (int i = 0; i < 200; i++) {
      // Given
      var b1 = randomBand(random, 6, 6);
      var b2 = randomBand(random, 6, 6);

      // When
      var alpha = ChangeMetricKernel.alpha(b1, b2);

      // Then
      assertThat(alpha).isNotNaN().isBetween(0.0, 1.0);
    }
  }

  @Test
  @DisplayName("should ignore a common phase rotation")
  void should_ignore_common_phase_rotation() {
    // Given
    var b1 = randomBand(new Random(3), 5, 5);
    var b2 = ComplexMatrix.zeros(5, 5);
    for (int r = 0; r < 5; r++) {
      for (int c = 0; c < 5; c++) {
        // multiply by i
        b2.set(r, c, -b1.imaginary(r, c), b1.real(r, c));
      }
    }

    // When
    var alpha = ChangeMetricKernel.alpha(b1, b2);

    // Then
    assertThat(alpha).isCloseTo(1.0, offset(1e-12));
  }

  @Test
  @DisplayName("should only consider the requested rectangle")
  void should_only_consider_requested_rectangle() {
    // Given
    var b1 = gaussianBand(new Random(5), 4, 4);
    var b2 = b1.copy();
    b2.set(3, 3, 100, -100);

    // When
    var inside = ChangeMetricKernel.alpha(b1, b2, 0, 2, 0, 2);
    var whole = ChangeMetricKernel.alpha(b1, b2);

    // Then
    assertThat(inside).isEqualTo(1.0);
    assertThat(whole).isLessThan(1.0);
  }

  @Test
  @DisplayName("should reject samples of different shapes")
  void should_reject_different_shapes() {
    assertThatThrownBy(() -> ChangeMetricKernel.alpha(ComplexMatrix.zeros(2, 2), ComplexMatrix.zeros(2, 3)))
      .isInstanceOf(IllegalArgumentException.class);
  }

  private static ComplexMatrix randomBand(Random random, int rows, int columns) {
    var band = ComplexMatrix.zeros(rows, columns);
    for (int r = 0; r < rows; r++) {
      for (int c = 0; c < columns; c++) {
        band.set(r, c, random.nextGaussian(), random.nextGaussian());
      }
    }
    return band;
  }
}
