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

/**
 * Position of a tile in the partition grid of a job.
 *
 * @param tileX column of the tile in the grid
 * @param tileY row of the tile in the grid
 */
public record TileCoordinate(long tileX, long tileY) {

  public TileCoordinate {
    if (tileX < 0 || tileY < 0) {
      throw new IllegalArgumentException("tile coordinates must be >= 0, got: (" + tileX + ", " + tileY + ")");
    }
  }

  public static TileCoordinate of(long tileX, long tileY) {
    return new TileCoordinate(tileX, tileY);
  }

  @Override
  public String toString() {
    return "(" + tileX + ", " + tileY + ")";
  }
}
