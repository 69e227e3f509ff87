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
 * Schema of a dense tiled array: its location, ordered dimensions and single attribute.
 * <p>
 * Ingested radar stacks are described by three dimensions {@code (BANDS, Y, X)} holding
 * {@link DataType#COMPLEX128} values in the {@value #STACK_ATTRIBUTE} attribute. Change maps
 * derived from them keep the spatial dimensions {@code (Y, X)} only and hold
 * {@link DataType#FLOAT32} values in the {@value #CHANGE_ATTRIBUTE} attribute.
 * <p>
 * Only dense arrays are supported; a sparse descriptor is rejected at construction.
 *
 * @param uri           location of the array
 * @param dimensions    ordered dimensions; at least one
 * @param attribute     attribute name
 * @param attributeType element type of the attribute
 * @param sparse        sparsity flag; always {@code false}
 */
public record ArrayDescriptor(ArrayUri uri,
                              List<Dimension> dimensions,
                              String attribute,
                              DataType attributeType,
                              boolean sparse) {

  public static final String STACK_ATTRIBUTE = "TDB_VALUES";
  public static final String CHANGE_ATTRIBUTE = "c";

  public ArrayDescriptor {
    requireNonNull(uri, "uri must not be null");
    requireNonNull(dimensions, "dimensions must not be null");
    requireNonNull(attribute, "attribute must not be null");
    requireNonNull(attributeType, "attributeType must not be null");
    if (dimensions.isEmpty()) {
      throw new IllegalArgumentException("an array needs at least one dimension: " + uri.asString());
    }
    if (sparse) {
      throw new IllegalArgumentException("sparse arrays are not supported: " + uri.asString());
    }
    dimensions = List.copyOf(dimensions);
  }

  /**
   * Creates a dense array descriptor.
   */
  public static ArrayDescriptor dense(ArrayUri uri, List<Dimension> dimensions, String attribute, DataType attributeType) {
    return new ArrayDescriptor(uri, dimensions, attribute, attributeType, false);
  }

  /**
   * Describes a radar stack of {@code bands} complex layers of {@code height x width} pixels.
   */
  public static ArrayDescriptor stack(ArrayUri uri, long bands, long height, long width, long tileHeight, long tileWidth) {
    return dense(uri,
                 List.of(Dimension.of(Dimension.BANDS, bands, 1),
                         Dimension.of(Dimension.Y, height, tileHeight),
                         Dimension.of(Dimension.X, width, tileWidth)),
                 STACK_ATTRIBUTE,
                 DataType.COMPLEX128);
  }

  public int rank() {
    return dimensions.size();
  }

  public Dimension dimension(int index) {
    return dimensions.get(index);
  }

  /**
   * Returns the second to last dimension, i.e. rows of the spatial plane.
   */
  public Dimension rows() {
    if (rank() < 2) {
      throw new IllegalStateException("array has no spatial plane: " + uri.asString());
    }
    return dimensions.get(rank() - 2);
  }

  /**
   * Returns the last dimension, i.e. columns of the spatial plane.
   */
  public Dimension columns() {
    if (rank() < 2) {
      throw new IllegalStateException("array has no spatial plane: " + uri.asString());
    }
    return dimensions.get(rank() - 1);
  }

  /**
   * @return the number of elements held by the array
   */
  public long elementCount() {
    return dimensions.stream().mapToLong(Dimension::extent).reduce(1L, Math::multiplyExact);
  }
}
