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

import fr.aneo.insar.ccd.domain.ArrayAlreadyExistsException;
import fr.aneo.insar.ccd.domain.ArrayDescriptor;
import fr.aneo.insar.ccd.domain.ArrayStoreException;
import fr.aneo.insar.ccd.domain.ArrayUri;
import fr.aneo.insar.ccd.domain.ChangeMap;
import fr.aneo.insar.ccd.domain.ComplexMatrix;
import fr.aneo.insar.ccd.domain.ComplexStack;
import fr.aneo.insar.ccd.domain.DataType;
import fr.aneo.insar.ccd.domain.Dimension;
import fr.aneo.insar.ccd.domain.Range;
import fr.aneo.insar.ccd.domain.StoreConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static fr.aneo.insar.ccd.domain.AccessMode.READ;
import static fr.aneo.insar.ccd.domain.AccessMode.WRITE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryArrayStoreTest {
  private static final ArrayUri STACK = ArrayUri.from("mem://stack");
  private static final ArrayUri CHANGE = ArrayUri.from("mem://change");
  private static final StoreConfig CONFIG = StoreConfig.empty();

  private InMemoryArrayStore store;

  @BeforeEach
  void setUp() {
    store = new InMemoryArrayStore();
  }

  private static ArrayDescriptor changeMap(ArrayUri uri, Dimension rows, Dimension columns) {
    return ArrayDescriptor.dense(uri, List.of(rows, columns), ArrayDescriptor.CHANGE_ATTRIBUTE, DataType.FLOAT32);
  }

  @Test
  @DisplayName("should read back ingested bands region by region")
  void should_read_ingested_bands() {
    // Given
    var first = ComplexMatrix.zeros(4, 6);
    var second = ComplexMatrix.zeros(4, 6);
    first.set(2, 3, 1.5, -2.5);
    second.set(3, 5, 7, 8);
    var descriptor = store.ingest(STACK, ComplexStack.of(first, second), 2, 3);

    // When
    ComplexStack region;
    try (var handle = store.open(STACK, READ, CONFIG)) {
      region = handle.readComplex(Range.of(0, 2), Range.of(2, 4), Range.of(3, 6));
    }

    // Then
    assertThat(store.describe(STACK, CONFIG)).isEqualTo(descriptor);
    assertThat(region.bandCount()).isEqualTo(2);
    assertThat(region.band(0).real(0, 0)).isEqualTo(1.5);
    assertThat(region.band(0).imaginary(0, 0)).isEqualTo(-2.5);
    assertThat(region.band(1).real(1, 2)).isEqualTo(7.0);
    assertThat(region.band(1).imaginary(1, 2)).isEqualTo(8.0);
  }

  @Test
  @DisplayName("should write and read change maps at absolute indices")
  void should_write_and_read_at_absolute_indices() {
    // Given
    store.createSchema(changeMap(CHANGE, new Dimension(Dimension.Y, 10, 13, 2), new Dimension(Dimension.X, 100, 103, 2)), CONFIG);

    // When
    try (var handle = store.open(CHANGE, WRITE, CONFIG)) {
      handle.write(Range.of(12, 14), Range.of(100, 102), ChangeMap.filled(2, 2, 0.25f));
    }
    ChangeMap whole;
    try (var handle = store.open(CHANGE, READ, CONFIG)) {
      whole = handle.readFloat(Range.of(10, 14), Range.of(100, 104));
    }

    // Then
    assertThat(whole.get(2, 0)).isEqualTo(0.25f);
    assertThat(whole.get(3, 1)).isEqualTo(0.25f);
    assertThat(whole.get(0, 0)).isEqualTo(0f);
    assertThat(whole.get(2, 2)).isEqualTo(0f);
  }

  @Test
  @DisplayName("should refuse to create an array twice")
  void should_refuse_to_create_twice() {
    // Given
    var descriptor = changeMap(CHANGE, Dimension.of(Dimension.Y, 4, 2), Dimension.of(Dimension.X, 4, 2));
    store.createSchema(descriptor, CONFIG);

    // When - Then
    assertThatThrownBy(() -> store.createSchema(descriptor, CONFIG))
      .isInstanceOf(ArrayAlreadyExistsException.class)
      .satisfies(e -> assertThat(((ArrayAlreadyExistsException) e).uri()).isEqualTo(CHANGE));
  }

  @Test
  @DisplayName("should enforce the access mode of handles")
  void should_enforce_access_mode() {
    // Given
    store.createSchema(changeMap(CHANGE, Dimension.of(Dimension.Y, 4, 2), Dimension.of(Dimension.X, 4, 2)), CONFIG);

    // When - Then
    try (var reader = store.open(CHANGE, READ, CONFIG); var writer = store.open(CHANGE, WRITE, CONFIG)) {
      assertThatThrownBy(() -> reader.write(Range.of(0, 2), Range.of(0, 2), ChangeMap.filled(2, 2, 1f)))
        .isInstanceOf(ArrayStoreException.class);
      assertThatThrownBy(() -> writer.readFloat(Range.of(0, 2), Range.of(0, 2)))
        .isInstanceOf(ArrayStoreException.class);
    }
  }

  @Test
  @DisplayName("should reject regions outside the array and mismatched shapes")
  void should_reject_invalid_regions() {
    // Given
    store.createSchema(changeMap(CHANGE, Dimension.of(Dimension.Y, 4, 2), Dimension.of(Dimension.X, 4, 2)), CONFIG);

    // When - Then
    try (var writer = store.open(CHANGE, WRITE, CONFIG)) {
      assertThatThrownBy(() -> writer.write(Range.of(3, 5), Range.of(0, 2), ChangeMap.filled(2, 2, 1f)))
        .isInstanceOf(ArrayStoreException.class);
      assertThatThrownBy(() -> writer.write(Range.of(0, 2), Range.of(0, 2), ChangeMap.filled(1, 2, 1f)))
        .isInstanceOf(ArrayStoreException.class);
    }
  }

  @Test
  @DisplayName("should reject reads of the wrong element type and access to missing arrays")
  void should_reject_wrong_type_and_missing_arrays() {
    // Given
    store.ingest(STACK, ComplexStack.of(ComplexMatrix.zeros(2, 2)), 1, 1);

    // When - Then
    try (var reader = store.open(STACK, READ, CONFIG)) {
      assertThatThrownBy(() -> reader.readFloat(Range.of(0, 1), Range.of(0, 1))).isInstanceOf(ArrayStoreException.class);
    }
    assertThat(store.exists(CHANGE, CONFIG)).isFalse();
    assertThatThrownBy(() -> store.describe(CHANGE, CONFIG)).isInstanceOf(ArrayStoreException.class);
    assertThatThrownBy(() -> store.open(CHANGE, READ, CONFIG)).isInstanceOf(ArrayStoreException.class);
  }

  @Test
  @DisplayName("should reject reads through a closed handle")
  void should_reject_closed_handle() {
    // Given
    store.ingest(STACK, ComplexStack.of(ComplexMatrix.zeros(2, 2)), 1, 1);
    var handle = store.open(STACK, READ, CONFIG);

    // When
    handle.close();

    // Then
    assertThatThrownBy(() -> handle.readComplex(Range.of(0, 1), Range.of(0, 1), Range.of(0, 1)))
      .isInstanceOf(ArrayStoreException.class)
      .hasMessageContaining("closed");
  }

  @Test
  @DisplayName("should forget deleted arrays")
  void should_forget_deleted_arrays() {
    store.ingest(STACK, ComplexStack.of(ComplexMatrix.zeros(2, 2)), 1, 1);

    assertThat(store.delete(STACK)).isTrue();
    assertThat(store.exists(STACK, CONFIG)).isFalse();
    assertThat(store.delete(STACK)).isFalse();
  }
}
