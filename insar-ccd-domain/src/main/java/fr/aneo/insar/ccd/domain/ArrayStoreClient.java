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
 * Contract of the dense tiled array store the engine reads stacks from and writes change maps to.
 * <p>
 * Implementations must allow concurrent calls from several worker threads. The engine relies on
 * the following guarantees:
 * </p>
 * <ul>
 *   <li>{@link #createSchema(ArrayDescriptor, StoreConfig)} is strictly additive: it never
 *       replaces an existing array.</li>
 *   <li>A freshly created array reads as zeros until written.</li>
 *   <li>Writes to disjoint regions through distinct handles do not interfere.</li>
 * </ul>
 */
public interface ArrayStoreClient {

  /**
   * @return {@code true} if an array exists at {@code uri}
   * @throws ArrayStoreException if the store cannot be queried
   */
  boolean exists(ArrayUri uri, StoreConfig config);

  /**
   * Returns the schema of the array at {@code uri}.
   *
   * @throws ArrayStoreException if there is no readable array at {@code uri}
   */
  ArrayDescriptor describe(ArrayUri uri, StoreConfig config);

  /**
   * Creates an empty array matching {@code descriptor}.
   *
   * @throws ArrayAlreadyExistsException if an array already exists at {@code descriptor.uri()}
   * @throws ArrayStoreException         if the array cannot be created
   */
  void createSchema(ArrayDescriptor descriptor, StoreConfig config);

  /**
   * Opens the array at {@code uri}. The returned handle must be closed by the caller.
   *
   * @throws ArrayStoreException if there is no array at {@code uri}
   */
  ArrayHandle open(ArrayUri uri, AccessMode mode, StoreConfig config);
}
