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
 * Half-open integer interval {@code [start, end)} used to address a slice along one dimension.
 *
 * @param start first index included
 * @param end   first index excluded; never lower than {@code start}
 */
public record Range(long start, long end) {

  public Range {
    if (start < 0) {
      throw new IllegalArgumentException("start must be >= 0, got: " + start);
    }
    if (end < start) {
      throw new IllegalArgumentException("end must be >= start, got: [" + start + ", " + end + ")");
    }
  }

  public static Range of(long start, long end) {
    return new Range(start, end);
  }

  /**
   * Returns the range holding the single index {@code index}.
   */
  public static Range single(long index) {
    return new Range(index, index + 1);
  }

  public int length() {
    return Math.toIntExact(end - start);
  }

  public boolean isEmpty() {
    return end == start;
  }

  @Override
  public String toString() {
    return "[" + start + ", " + end + ")";
  }
}
