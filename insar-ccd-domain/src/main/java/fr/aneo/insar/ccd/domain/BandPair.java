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

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * The two zero-based band indices compared by a change detection job.
 * <p>
 * The first band is the reference epoch, the second the epoch compared against it. Both may
 * designate the same band.
 *
 * @param first  index of the reference band
 * @param second index of the compared band
 */
public record BandPair(int first, int second) {

  public BandPair {
    if (first < 0 || second < 0) {
      throw new InvalidBandSelectionException("band indices must be >= 0, got: [" + first + ", " + second + "]");
    }
  }

  public static BandPair of(int first, int second) {
    return new BandPair(first, second);
  }

  /**
   * Builds a pair from an arbitrary selection, which must hold exactly two indices.
   *
   * @param selection the selected band indices
   * @return the pair
   * @throws InvalidBandSelectionException if {@code selection} does not hold exactly two non-null indices
   */
  public static BandPair from(List<Integer> selection) {
    requireNonNull(selection, "selection must not be null");
    if (selection.size() != 2) {
      throw new InvalidBandSelectionException("change detection requires exactly two band indices, got " + selection.size() + ": " + selection);
    }
    if (selection.get(0) == null || selection.get(1) == null) {
      throw new InvalidBandSelectionException("band indices must not be null, got: " + selection);
    }

    return new BandPair(selection.get(0), selection.get(1));
  }
}
