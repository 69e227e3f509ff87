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
 * Ordered layers of equally shaped complex matrices, as read from a radar stack.
 */
public final class ComplexStack {
  private final List<ComplexMatrix> bands;

  private ComplexStack(List<ComplexMatrix> bands) {
    this.bands = bands;
  }

  public static ComplexStack of(List<ComplexMatrix> bands) {
    requireNonNull(bands, "bands must not be null");
    if (bands.isEmpty()) throw new IllegalArgumentException("a stack needs at least one band");

    var first = bands.get(0);
    for (var band : bands) {
      if (!band.hasSameShape(first)) {
        throw new IllegalArgumentException("all bands must share the same shape, got " + first + " and " + band);
      }
    }
    return new ComplexStack(List.copyOf(bands));
  }

  public static ComplexStack of(ComplexMatrix... bands) {
    return of(List.of(bands));
  }

  public int bandCount() {
    return bands.size();
  }

  public int rows() {
    return bands.get(0).rows();
  }

  public int columns() {
    return bands.get(0).columns();
  }

  public ComplexMatrix band(int index) {
    return bands.get(index);
  }
}
