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

import java.util.Arrays;

import static java.util.Objects.requireNonNull;

/**
 * Dense row-major matrix of single precision change metrics.
 * <p>
 * Values produced by the engine are within {@code [0, 1]}: {@code 1} means no detected change.
 * A change map is mutable while its producing worker fills it, and must not be modified once
 * handed to the store.
 */
public final class ChangeMap {
  private final int rows;
  private final int columns;
  private final float[] values;

  public ChangeMap(int rows, int columns, float[] values) {
    requireNonNull(values, "values must not be null");
    if (rows < 0 || columns < 0) {
      throw new IllegalArgumentException("shape must be >= 0, got: " + rows + "x" + columns);
    }
    if (values.length != rows * columns) {
      throw new IllegalArgumentException("expected " + rows * columns + " values, got " + values.length);
    }
    this.rows = rows;
    this.columns = columns;
    this.values = values;
  }

  public static ChangeMap filled(int rows, int columns, float value) {
    var values = new float[rows * columns];
    Arrays.fill(values, value);
    return new ChangeMap(rows, columns, values);
  }

  public int rows() {
    return rows;
  }

  public int columns() {
    return columns;
  }

  public float get(int row, int column) {
    return values[index(row, column)];
  }

  public void set(int row, int column, float value) {
    values[index(row, column)] = value;
  }

  /**
   * Assigns {@code value} to every cell of the rectangle {@code [row0, row1) x [column0, column1)}.
   */
  public void fill(int row0, int row1, int column0, int column1, float value) {
    if (column1 <= column0) return;
    if (column1 > columns) {
      throw new IndexOutOfBoundsException("column " + column1 + " outside " + rows + "x" + columns);
    }
    for (int r = row0; r < row1; r++) {
      int offset = index(r, column0);
      Arrays.fill(values, offset, offset + (column1 - column0), value);
    }
  }

  /**
   * Returns the values of column {@code column}, top to bottom.
   */
  public float[] column(int column) {
    var result = new float[rows];
    for (int r = 0; r < rows; r++) {
      result[r] = get(r, column);
    }
    return result;
  }

  /**
   * Returns a copy of the backing values, row-major.
   */
  public float[] toArray() {
    return values.clone();
  }

  public ChangeMap copy() {
    return new ChangeMap(rows, columns, values.clone());
  }

  private int index(int row, int column) {
    if (row < 0 || row >= rows || column < 0 || column >= columns) {
      throw new IndexOutOfBoundsException("(" + row + ", " + column + ") outside " + rows + "x" + columns);
    }
    return row * columns + column;
  }

  @Override
  public boolean equals(Object obj) {
    if (obj == this) return true;
    if (obj == null || obj.getClass() != this.getClass()) return false;
    var that = (ChangeMap) obj;
    return rows == that.rows && columns == that.columns && Arrays.equals(values, that.values);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * rows + columns) + Arrays.hashCode(values);
  }

  @Override
  public String toString() {
    return "ChangeMap{" + rows + "x" + columns + '}';
  }
}
