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
 * Immutable description of the work needed to produce one tile of a change map.
 * <p>
 * A descriptor names the input stack and output map, the compared bands, the tile position
 * in the partition grid and the spatial region it covers in both arrays. Descriptors of the
 * same job never cover overlapping regions, so they can be executed in any order, concurrently,
 * and re-executed: each one always writes the same values to the same region.
 *
 * @param input       the radar stack read by the task
 * @param output      the change map written by the task
 * @param bands       the compared bands
 * @param coordinate  position of the tile in the partition grid
 * @param rows        rows of the spatial plane covered by the tile
 * @param columns     columns of the spatial plane covered by the tile
 * @param windowSize  edge length of the estimation windows stepped across the tile
 * @param storeConfig settings forwarded to the store when opening both arrays
 */
public record TaskDescriptor(ArrayUri input,
                             ArrayUri output,
                             BandPair bands,
                             TileCoordinate coordinate,
                             Range rows,
                             Range columns,
                             int windowSize,
                             StoreConfig storeConfig) {

  public TaskDescriptor {
    requireNonNull(input, "input must not be null");
    requireNonNull(output, "output must not be null");
    requireNonNull(bands, "bands must not be null");
    requireNonNull(coordinate, "coordinate must not be null");
    requireNonNull(rows, "rows must not be null");
    requireNonNull(columns, "columns must not be null");
    requireNonNull(storeConfig, "storeConfig must not be null");
    if (rows.isEmpty() || columns.isEmpty()) {
      throw new IllegalArgumentException("tile " + coordinate + " covers an empty region: rows=" + rows + ", columns=" + columns);
    }
    if (windowSize <= 0) {
      throw new IllegalArgumentException("windowSize must be > 0, got: " + windowSize);
    }
  }

  public int tileHeight() {
    return rows.length();
  }

  public int tileWidth() {
    return columns.length();
  }

  @Override
  public String toString() {
    return "TaskDescriptor{" +
      "input=" + input.asString() +
      ", output=" + output.asString() +
      ", bands=" + bands +
      ", tile=" + coordinate +
      ", rows=" + rows +
      ", columns=" + columns +
      ", windowSize=" + windowSize +
      '}';
  }
}
