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

import java.util.Arrays;

/**
 * Replaces each cell by the median of the {@code n x n} neighbourhood centred on it.
 * <p>
 * The neighbourhood is cut at the tile border. For an even count of neighbours the lower of the
 * two middle values is used, so the result is always one of the input values.
 */
public final class MedianDespeckleFilter implements DespeckleFilter {
  private final int neighbourhoodSize;

  /**
   * @param neighbourhoodSize edge length of the neighbourhood; strictly positive
   */
  public MedianDespeckleFilter(int neighbourhoodSize) {
    if (neighbourhoodSize <= 0) {
      throw new IllegalArgumentException("neighbourhoodSize must be > 0, got: " + neighbourhoodSize);
    }
    this.neighbourhoodSize = neighbourhoodSize;
  }

  public int neighbourhoodSize() {
    return neighbourhoodSize;
  }

  @Override
  public ChangeMap apply(ChangeMap tile) {
    if (neighbourhoodSize == 1) return tile;

    int rows = tile.rows();
    int columns = tile.columns();
    int before = (neighbourhoodSize - 1) / 2;
    int after = neighbourhoodSize / 2;
    var filtered = new float[rows * columns];
    var neighbours = new float[neighbourhoodSize * neighbourhoodSize];

    for (int r = 0; r < rows; r++) {
      int r0 = Math.max(0, r - before);
      int r1 = Math.min(rows, r + after + 1);
      for (int c = 0; c < columns; c++) {
        int c0 = Math.max(0, c - before);
        int c1 = Math.min(columns, c + after + 1);
        int count = 0;
        for (int nr = r0; nr < r1; nr++) {
          for (int nc = c0; nc < c1; nc++) {
            neighbours[count++] = tile.get(nr, nc);
          }
        }
        Arrays.sort(neighbours, 0, count);
        filtered[r * columns + c] = neighbours[(count - 1) / 2];
      }
    }
    return new ChangeMap(rows, columns, filtered);
  }

  @Override
  public String toString() {
    return "MedianDespeckleFilter{" + neighbourhoodSize + "x" + neighbourhoodSize + '}';
  }
}
