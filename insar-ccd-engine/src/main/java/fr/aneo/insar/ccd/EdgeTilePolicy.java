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

/**
 * How the partition grid treats an array extent that is not a multiple of its tile extent.
 */
public enum EdgeTilePolicy {
  /**
   * Only whole tiles are scheduled (floor division). Rows and columns past the last whole tile
   * are never computed and keep the default value of the output array.
   * <p>
   * Ingested stacks are padded to a whole number of tiles, so this matches their layout.
   */
  TRUNCATE {
    @Override
    public long tileCount(long extent, long tileExtent) {
      return extent / tileExtent;
    }
  },

  /**
   * Every cell is scheduled (ceiling division). The trailing tile of each axis is clipped to
   * the array extent and may be smaller than the native tile.
   */
  CLIP {
    @Override
    public long tileCount(long extent, long tileExtent) {
      return (extent + tileExtent - 1) / tileExtent;
    }
  };

  /**
   * Returns the number of tiles scheduled along an axis.
   *
   * @param extent     number of cells along the axis
   * @param tileExtent number of cells per native tile along the axis
   */
  public abstract long tileCount(long extent, long tileExtent);

  public static EdgeTilePolicy named(String name) {
    for (var policy : values()) {
      if (policy.name().equalsIgnoreCase(name.trim())) return policy;
    }
    throw new IllegalArgumentException("Unknown edge tile policy '" + name + "'. Expected one of TRUNCATE, CLIP");
  }
}
