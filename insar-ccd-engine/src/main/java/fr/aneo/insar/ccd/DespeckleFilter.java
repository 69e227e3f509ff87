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

/**
 * Speckle reduction applied to each tile of a change map before it is written.
 * <p>
 * Filters only see the tile they are applied to, so that tiles remain independent of each other.
 * Implementations must be stateless and keep values within {@code [0, 1]}.
 */
@FunctionalInterface
public interface DespeckleFilter {

  /**
   * Filter leaving change maps untouched.
   */
  DespeckleFilter NONE = tile -> tile;

  /**
   * @param tile the change map of one tile; must not be modified
   * @return the filtered change map, same shape as {@code tile}; may be {@code tile} itself
   */
  ChangeMap apply(ChangeMap tile);

  /**
   * Closed set of filters selectable by configuration.
   */
  enum Type {
    NONE,
    MEDIAN;

    /**
     * Creates the filter of this type.
     *
     * @param neighbourhoodSize edge length of the neighbourhood considered around each cell
     */
    public DespeckleFilter create(int neighbourhoodSize) {
      return this == MEDIAN ? new MedianDespeckleFilter(neighbourhoodSize) : DespeckleFilter.NONE;
    }

    /**
     * Resolves a type by name, ignoring case.
     *
     * @throws IllegalArgumentException if no type has that name
     */
    public static Type named(String name) {
      for (var type : values()) {
        if (type.name().equalsIgnoreCase(name.trim())) return type;
      }
      throw new IllegalArgumentException("Unknown despeckle filter '" + name + "'. Expected one of NONE, MEDIAN");
    }
  }
}
