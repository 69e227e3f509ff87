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
 * Applies the {@link ChangeMetricKernel} over non-overlapping square windows stepped across a tile.
 * <p>
 * Windows start at every multiple of the window size along each axis. When the tile extent is
 * not a multiple of the window size, the last window of each row or column is cut at the tile
 * border and the kernel runs on the smaller rectangle left. Each window's estimate is broadcast
 * over every cell of that window.
 */
public final class WindowedChangeEstimator {
  private final int windowSize;

  /**
   * @param windowSize edge length of the windows; strictly positive
   */
  public WindowedChangeEstimator(int windowSize) {
    if (windowSize <= 0) {
      throw new IllegalArgumentException("windowSize must be > 0, got: " + windowSize);
    }
    this.windowSize = windowSize;
  }

  public int windowSize() {
    return windowSize;
  }

  public ChangeMap estimate(ComplexMatrix b1, ComplexMatrix b2) {
    return estimate(b1, b2, () -> {});
  }

  /**
   * Estimates the change map of a tile.
   *
   * @param b1            reference epoch of the tile
   * @param b2            compared epoch of the tile, same shape as {@code b1}
   * @param beforeEachRow called before each row of windows; may throw to abort the estimation
   * @return the change map, same shape as the samples
   */
  public ChangeMap estimate(ComplexMatrix b1, ComplexMatrix b2, Runnable beforeEachRow) {
    requireNonNull(b1, "b1 must not be null");
    requireNonNull(b2, "b2 must not be null");
    requireNonNull(beforeEachRow, "beforeEachRow must not be null");
    if (!b1.hasSameShape(b2)) {
      throw new IllegalArgumentException("samples must share the same shape, got " + b1 + " and " + b2);
    }

    int rows = b1.rows();
    int columns = b1.columns();
    var changeMap = ChangeMap.filled(rows, columns, 1f);

    for (int y1 = 0; y1 < rows; y1 += windowSize) {
      beforeEachRow.run();
      int y1End = Math.min(y1 + windowSize, rows);
      for (int x1 = 0; x1 < columns; x1 += windowSize) {
        int x1End = Math.min(x1 + windowSize, columns);
        float alpha = (float) ChangeMetricKernel.alpha(b1, b2, y1, y1End, x1, x1End);
        changeMap.fill(y1, y1End, x1, x1End, alpha);
      }
    }
    return changeMap;
  }
}
