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

import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Immutable identifier of a tiled array within an {@link ArrayStoreClient}.
 * <p>
 * The identifier is opaque to the engine: it may be a file-system path, an object-store URI
 * or any other location understood by the store. Two identifiers are equal when their string
 * representations are equal.
 */
public final class ArrayUri {
  private final String uri;

  private ArrayUri(String uri) {
    this.uri = uri;
  }

  /**
   * Returns the string representation of this identifier, as understood by the store.
   *
   * @return the array location
   */
  public String asString() {
    return uri;
  }

  /**
   * Derives a sibling identifier by appending {@code suffix} to this one.
   *
   * @param suffix text appended verbatim; must not be {@code null} or empty
   * @return a new identifier
   */
  public ArrayUri withSuffix(String suffix) {
    requireNonNull(suffix, "suffix must not be null");
    if (suffix.isEmpty()) throw new IllegalArgumentException("suffix must not be empty");

    return new ArrayUri(uri + suffix);
  }

  public static ArrayUri from(String uri) {
    requireNonNull(uri, "uri must not be null");
    if (uri.isBlank()) throw new IllegalArgumentException("uri must not be blank");

    return new ArrayUri(uri);
  }

  @Override
  public boolean equals(Object obj) {
    if (obj == this) return true;
    if (obj == null || obj.getClass() != this.getClass()) return false;
    var that = (ArrayUri) obj;
    return Objects.equals(this.uri, that.uri);
  }

  @Override
  public int hashCode() {
    return Objects.hash(uri);
  }

  @Override
  public String toString() {
    return "ArrayUri{" +
      "uri='" + uri + '\'' +
      '}';
  }
}
