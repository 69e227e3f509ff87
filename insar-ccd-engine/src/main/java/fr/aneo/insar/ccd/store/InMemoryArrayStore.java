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
package fr.aneo.insar.ccd.store;

import fr.aneo.insar.ccd.domain.AccessMode;
import fr.aneo.insar.ccd.domain.ArrayAlreadyExistsException;
import fr.aneo.insar.ccd.domain.ArrayDescriptor;
import fr.aneo.insar.ccd.domain.ArrayHandle;
import fr.aneo.insar.ccd.domain.ArrayStoreClient;
import fr.aneo.insar.ccd.domain.ArrayStoreException;
import fr.aneo.insar.ccd.domain.ArrayUri;
import fr.aneo.insar.ccd.domain.ChangeMap;
import fr.aneo.insar.ccd.domain.ComplexMatrix;
import fr.aneo.insar.ccd.domain.ComplexStack;
import fr.aneo.insar.ccd.domain.DataType;
import fr.aneo.insar.ccd.domain.Dimension;
import fr.aneo.insar.ccd.domain.Range;
import fr.aneo.insar.ccd.domain.StoreConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.util.Objects.requireNonNull;

/**
 * {@link ArrayStoreClient} keeping dense arrays in heap memory.
 * <p>
 * Arrays of {@link DataType#COMPLEX128} must be three-dimensional {@code (band, y, x)} stacks;
 * arrays of {@link DataType#FLOAT32} must be two-dimensional {@code (y, x)} maps. Newly created
 * arrays are filled with zeros. {@link StoreConfig} settings are accepted and ignored.
 * <p>
 * This store is thread-safe for concurrent reads and for concurrent writes to disjoint regions;
 * values written by a task are visible to readers that synchronize with its completion.
 */
public final class InMemoryArrayStore implements ArrayStoreClient {
  private static final Logger logger = LoggerFactory.getLogger(InMemoryArrayStore.class);

  private final ConcurrentMap<ArrayUri, StoredArray> arrays = new ConcurrentHashMap<>();

  @Override
  public boolean exists(ArrayUri uri, StoreConfig config) {
    requireNonNull(uri, "uri must not be null");
    return arrays.containsKey(uri);
  }

  @Override
  public ArrayDescriptor describe(ArrayUri uri, StoreConfig config) {
    return lookup(uri).descriptor;
  }

  @Override
  public void createSchema(ArrayDescriptor descriptor, StoreConfig config) {
    requireNonNull(descriptor, "descriptor must not be null");

    var array = StoredArray.allocate(descriptor);
    if (arrays.putIfAbsent(descriptor.uri(), array) != null) {
      throw new ArrayAlreadyExistsException(descriptor.uri());
    }
    logger.debug("Created {} array {} with dimensions {}", descriptor.attributeType(), descriptor.uri().asString(), descriptor.dimensions());
  }

  @Override
  public ArrayHandle open(ArrayUri uri, AccessMode mode, StoreConfig config) {
    requireNonNull(mode, "mode must not be null");
    return new Handle(lookup(uri), mode);
  }

  /**
   * Stores {@code stack} as a new {@code (band, y, x)} array at {@code uri}, with native tiles of
   * one band by {@code tileHeight x tileWidth} pixels.
   *
   * @return the schema of the created array
   * @throws ArrayAlreadyExistsException if {@code uri} already holds an array
   */
  public ArrayDescriptor ingest(ArrayUri uri, ComplexStack stack, long tileHeight, long tileWidth) {
    requireNonNull(uri, "uri must not be null");
    requireNonNull(stack, "stack must not be null");

    var descriptor = ArrayDescriptor.stack(uri, stack.bandCount(), stack.rows(), stack.columns(), tileHeight, tileWidth);
    createSchema(descriptor, StoreConfig.empty());
    var array = arrays.get(uri);
    for (int b = 0; b < stack.bandCount(); b++) {
      var band = stack.band(b);
      for (int y = 0; y < stack.rows(); y++) {
        for (int x = 0; x < stack.columns(); x++) {
          int offset = array.offset(b, y, x);
          array.real[offset] = band.real(y, x);
          array.imaginary[offset] = band.imaginary(y, x);
        }
      }
    }
    logger.debug("Ingested {} bands of {}x{} pixels into {}", stack.bandCount(), stack.rows(), stack.columns(), uri.asString());
    return descriptor;
  }

  /**
   * Removes the array at {@code uri}, if any.
   *
   * @return {@code true} if an array was removed
   */
  public boolean delete(ArrayUri uri) {
    requireNonNull(uri, "uri must not be null");
    return arrays.remove(uri) != null;
  }

  private StoredArray lookup(ArrayUri uri) {
    requireNonNull(uri, "uri must not be null");
    var array = arrays.get(uri);
    if (array == null) throw new ArrayStoreException("no array at " + uri.asString());
    return array;
  }

  private static final class StoredArray {
    private final ArrayDescriptor descriptor;
    private final double[] real;
    private final double[] imaginary;
    private final float[] values;

    private StoredArray(ArrayDescriptor descriptor, double[] real, double[] imaginary, float[] values) {
      this.descriptor = descriptor;
      this.real = real;
      this.imaginary = imaginary;
      this.values = values;
    }

    static StoredArray allocate(ArrayDescriptor descriptor) {
      int size;
      try {
        size = Math.toIntExact(descriptor.elementCount());
      } catch (ArithmeticException e) {
        throw new ArrayStoreException("array too large to be held in memory: " + descriptor.uri().asString(), e);
      }

      if (descriptor.attributeType() == DataType.COMPLEX128) {
        requireRank(descriptor, 3);
        return new StoredArray(descriptor, new double[size], new double[size], null);
      }
      requireRank(descriptor, 2);
      return new StoredArray(descriptor, null, null, new float[size]);
    }

    private static void requireRank(ArrayDescriptor descriptor, int rank) {
      if (descriptor.rank() != rank) {
        throw new ArrayStoreException(descriptor.attributeType() + " arrays must have " + rank + " dimensions, got "
          + descriptor.rank() + " for " + descriptor.uri().asString());
      }
    }

    int offset(long band, long row, long column) {
      return Math.toIntExact((band * descriptor.rows().extent() + row) * descriptor.columns().extent() + column);
    }

    int offset(long row, long column) {
      return Math.toIntExact(row * descriptor.columns().extent() + column);
    }

    void checkBounds(Dimension dimension, Range range) {
      if (range.isEmpty() || range.start() < dimension.start() || range.end() > dimension.end() + 1) {
        throw new ArrayStoreException("range " + range + " outside dimension " + dimension.name() + " ["
          + dimension.start() + ", " + dimension.end() + "] of " + descriptor.uri().asString());
      }
    }
  }

  private static final class Handle implements ArrayHandle {
    private final StoredArray array;
    private final AccessMode mode;
    private final AtomicBoolean closed = new AtomicBoolean();

    private Handle(StoredArray array, AccessMode mode) {
      this.array = array;
      this.mode = mode;
    }

    @Override
    public ArrayDescriptor descriptor() {
      return array.descriptor;
    }

    @Override
    public AccessMode mode() {
      return mode;
    }

    @Override
    public ComplexStack readComplex(Range bands, Range rows, Range columns) {
      requireUsable(AccessMode.READ, DataType.COMPLEX128);
      var descriptor = array.descriptor;
      var bandDimension = descriptor.dimension(0);
      array.checkBounds(bandDimension, bands);
      array.checkBounds(descriptor.rows(), rows);
      array.checkBounds(descriptor.columns(), columns);

      var matrices = new ArrayList<ComplexMatrix>(bands.length());
      for (long b = bands.start(); b < bands.end(); b++) {
        var matrix = ComplexMatrix.zeros(rows.length(), columns.length());
        for (long y = rows.start(); y < rows.end(); y++) {
          for (long x = columns.start(); x < columns.end(); x++) {
            int offset = array.offset(b - bandDimension.start(), y - descriptor.rows().start(), x - descriptor.columns().start());
            matrix.set((int) (y - rows.start()), (int) (x - columns.start()), array.real[offset], array.imaginary[offset]);
          }
        }
        matrices.add(matrix);
      }
      return ComplexStack.of(matrices);
    }

    @Override
    public ChangeMap readFloat(Range rows, Range columns) {
      requireUsable(AccessMode.READ, DataType.FLOAT32);
      var descriptor = array.descriptor;
      array.checkBounds(descriptor.rows(), rows);
      array.checkBounds(descriptor.columns(), columns);

      var result = ChangeMap.filled(rows.length(), columns.length(), 0f);
      for (long y = rows.start(); y < rows.end(); y++) {
        for (long x = columns.start(); x < columns.end(); x++) {
          var value = array.values[array.offset(y - descriptor.rows().start(), x - descriptor.columns().start())];
          result.set((int) (y - rows.start()), (int) (x - columns.start()), value);
        }
      }
      return result;
    }

    @Override
    public void write(Range rows, Range columns, ChangeMap values) {
      requireNonNull(values, "values must not be null");
      requireUsable(AccessMode.WRITE, DataType.FLOAT32);
      var descriptor = array.descriptor;
      array.checkBounds(descriptor.rows(), rows);
      array.checkBounds(descriptor.columns(), columns);
      if (values.rows() != rows.length() || values.columns() != columns.length()) {
        throw new ArrayStoreException("cannot write " + values + " into region " + rows + " x " + columns
          + " of " + descriptor.uri().asString());
      }

      for (long y = rows.start(); y < rows.end(); y++) {
        for (long x = columns.start(); x < columns.end(); x++) {
          array.values[array.offset(y - descriptor.rows().start(), x - descriptor.columns().start())] =
            values.get((int) (y - rows.start()), (int) (x - columns.start()));
        }
      }
    }

    @Override
    public void close() {
      closed.set(true);
    }

    private void requireUsable(AccessMode requiredMode, DataType requiredType) {
      var uri = array.descriptor.uri().asString();
      if (closed.get()) throw new ArrayStoreException("handle on " + uri + " is closed");
      if (mode != requiredMode) {
        throw new ArrayStoreException("handle on " + uri + " was opened for " + mode + ", not " + requiredMode);
      }
      if (array.descriptor.attributeType() != requiredType) {
        throw new ArrayStoreException(uri + " holds " + array.descriptor.attributeType() + " values, not " + requiredType);
      }
    }
  }
}
