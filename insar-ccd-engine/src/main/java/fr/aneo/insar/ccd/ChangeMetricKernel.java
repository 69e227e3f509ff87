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

import fr.aneo.insar.ccd.domain.ChangeMap;
import fr.aneo.insar.ccd.domain.ComplexMatrix;

import static java.util.Objects.requireNonNull;

/**
 * Maximum likelihood estimator of the coherence between two co-registered complex returns of
 * the same scene acquired at two epochs.
 * <p>
 * Given two equally shaped samples {@code b1} and {@code b2}, the estimated "no change"
 * confidence is
 * <pre>
 *   alpha = 2 |sum(conj(b1) * b2)| / (sum(|b1|^2) + sum(|b2|^2))
 * </pre>
 * which assumes zero thermal noise and approximately equal average reflectivity at both epochs.
 * {@code 1} means the samples are perfectly correlated (no change), lower values mean change.
 *
 * <h2>Degenerate samples</h2>
 * <p>
 * The estimate is always reported within {@code [0, 1]}. Samples without any energy
 * ({@code 0 / 0}) and any value above {@code 1} caused by rounding are reported as {@code 1}.
 * No lower clamp is needed since every term of the ratio is non-negative.
 * </p>
 *
 * <p>This class is stateless and safe to call from any number of threads.</p>
 */
public final class ChangeMetricKernel {

  private ChangeMetricKernel() {
  }

  /**
   * Estimates the change metric over the whole of two equally shaped samples.
   *
   * @return the estimate, within {@code [0, 1]}
   * @throws IllegalArgumentException if the samples do not share the same shape
   */
  public static double alpha(ComplexMatrix b1, ComplexMatrix b2) {
    return alpha(b1, b2, 0, b1.rows(), 0, b1.columns());
  }

  /**
   * Estimates the change metric over the rectangle {@code [row0, row1) x [column0, column1)}
   * of two equally shaped samples.
   *
   * @return the estimate, within {@code [0, 1]}
   * @throws IllegalArgumentException if the samples do not share the same shape
   */
  public static double alpha(ComplexMatrix b1, ComplexMatrix b2, int row0, int row1, int column0, int column1) {
    requireNonNull(b1, "b1 must not be null");
    requireNonNull(b2, "b2 must not be null");
    if (!b1.hasSameShape(b2)) {
      throw new IllegalArgumentException("samples must share the same shape, got " + b1 + " and " + b2);
    }

    double a12 = 0;
    double a22 = 0;
    double crossReal = 0;
    double crossImaginary = 0;
    for (int r = row0; r < row1; r++) {
      for (int c = column0; c < column1; c++) {
        double re1 = b1.real(r, c);
        double im1 = b1.imaginary(r, c);
        double re2 = b2.real(r, c);
        double im2 = b2.imaginary(r, c);

        a12 += re1 * re1 + im1 * im1;
        a22 += re2 * re2 + im2 * im2;
        // conj(b1) * b2
        crossReal += re1 * re2 + im1 * im2;
        crossImaginary += re1 * im2 - im1 * re2;
      }
    }

    double alpha = 2 * Math.hypot(crossReal, crossImaginary) / (a12 + a22);
    if (Double.isNaN(alpha) || alpha > 1) {
      return 1;
    }
    return alpha;
  }

  /**
   * Returns a map of the shape of the samples filled with their change metric.
   */
  public static ChangeMap apply(ComplexMatrix b1, ComplexMatrix b2) {
    return ChangeMap.filled(b1.rows(), b1.columns(), (float) alpha(b1, b2));
  }
}
