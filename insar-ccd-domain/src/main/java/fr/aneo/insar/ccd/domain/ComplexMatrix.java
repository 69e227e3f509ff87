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
 * Dense two-dimensional matrix of complex values stored row-major as separate real and
 * imaginary parts.
 * <p>
 * Instances are not defensively copied: the arrays handed to the constructor are owned by the
 * matrix afterwards.
 */
public final class ComplexMatrix {
  private final int rows;
  private final int columns;
  private final double[] real;
  private final double[] imaginary;

  public ComplexMatrix(int rows, int columns, double[] real, double[] imaginary) {
    requireNonNull(real, "real must not be null");
    requireNonNull(imaginary, "imaginary must not be null");
    if (rows < 0 || columns < 0) {
      throw new IllegalArgumentException("shape must be >= 0, got: " + rows + "x" + columns);
    }
    if (real.length != rows * columns || imaginary.length != rows * columns) {
      throw new IllegalArgumentException("expected " + rows * columns + " values, got real=" + real.length + ", imaginary=" + imaginary.length);
    }
    this.rows = rows;
    this.columns = columns;
    this.real = real;
    this.imaginary = imaginary;
  }

  public static ComplexMatrix zeros(int rows, int columns) {
    return new ComplexMatrix(rows, columns, new double[rows * columns], new double[rows * columns]);
  }

  public int rows() {
    return rows;
  }

  public int columns() {
    return columns;
  }

  public double real(int row, int column) {
    return real[index(row, column)];
  }

  public double imaginary(int row, int column) {
    return imaginary[index(row, column)];
  }

  public void set(int row, int column, double re, double im) {
    int i = index(row, column);
    real[i] = re;
    imaginary[i] = im;
  }

  public boolean hasSameShape(ComplexMatrix other) {
    return rows == other.rows && columns == other.columns;
  }

  /**
   * Returns a copy of this matrix.
   */
  public ComplexMatrix copy() {
    return new ComplexMatrix(rows, columns, real.clone(), imaginary.clone());
  }

  private int index(int row, int column) {
    if (row < 0 || row >= rows || column < 0 || column >= columns) {
      throw new IndexOutOfBoundsException("(" + row + ", " + column + ") outside " + rows + "x" + columns);
    }
    return row * columns + column;
  }

  @Override
  public String toString() {
    return "ComplexMatrix{" + rows + "x" + columns + '}';
  }
}
