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
 * One dimension of a dense tiled array.
 * <p>
 * The domain is inclusive on both ends, as declared by the store: a dimension of extent
 * {@code n} starting at zero has {@code start = 0} and {@code end = n - 1}. The tile extent is
 * the native write granularity of the store along this dimension.
 *
 * @param name       dimension name, e.g. {@code "BANDS"}, {@code "Y"} or {@code "X"}
 * @param start      first valid index
 * @param end        last valid index
 * @param tileExtent number of indices per native tile; strictly positive
 */
public record Dimension(String name, long start, long end, long tileExtent) {
  public static final String BANDS = "BANDS";
  public static final String Y = "Y";
  public static final String X = "X";

  public Dimension {
    requireNonNull(name, "name must not be null");
    if (start < 0) {
      throw new IllegalArgumentException("start must be >= 0 for dimension " + name + ", got: " + start);
    }
    if (end < start) {
      throw new IllegalArgumentException("end must be >= start for dimension " + name + ", got: [" + start + ", " + end + "]");
    }
    if (tileExtent <= 0) {
      throw new IllegalArgumentException("tileExtent must be > 0 for dimension " + name + ", got: " + tileExtent);
    }
  }

  /**
   * Creates a zero-based dimension holding {@code extent} indices.
   */
  public static Dimension of(String name, long extent, long tileExtent) {
    if (extent <= 0) {
      throw new IllegalArgumentException("extent must be > 0 for dimension " + name + ", got: " + extent);
    }
    return new Dimension(name, 0, extent - 1, tileExtent);
  }

  /**
   * @return the number of indices in this dimension
   */
  public long extent() {
    return end - start + 1;
  }

  /**
   * @return {@code true} if {@code index} lies within the domain of this dimension
   */
  public boolean contains(long index) {
    return index >= start && index <= end;
  }
}
