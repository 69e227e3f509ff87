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
 * Open access to one array of an {@link ArrayStoreClient}.
 * <p>
 * Handles opened for {@link AccessMode#READ} only support reads and handles opened for
 * {@link AccessMode#WRITE} only support writes. Several handles may be open on the same array
 * at once; concurrent writes through distinct handles are safe as long as they target disjoint
 * regions.
 */
public interface ArrayHandle extends AutoCloseable {

  ArrayDescriptor descriptor();

  AccessMode mode();

  /**
   * Reads a region of a three-dimensional complex stack.
   *
   * @param bands   bands to read
   * @param rows    rows of the spatial plane to read
   * @param columns columns of the spatial plane to read
   * @return one matrix per band, in band order
   * @throws ArrayStoreException if the handle is not readable, the array is not a complex stack
   *                             or the region lies outside the array
   */
  ComplexStack readComplex(Range bands, Range rows, Range columns);

  /**
   * Reads a region of a two-dimensional single precision array.
   *
   * @throws ArrayStoreException if the handle is not readable, the array does not hold
   *                             single precision values or the region lies outside the array
   */
  ChangeMap readFloat(Range rows, Range columns);

  /**
   * Writes {@code values} into a region of a two-dimensional single precision array.
   *
   * @throws ArrayStoreException if the handle is not writable, the shapes do not match or the
   *                             region lies outside the array
   */
  void write(Range rows, Range columns, ChangeMap values);

  @Override
  void close();
}
