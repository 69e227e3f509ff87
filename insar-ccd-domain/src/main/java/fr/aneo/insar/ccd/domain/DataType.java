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
 * Element types of the array attributes handled by the engine.
 */
public enum DataType {
  /** Two IEEE-754 doubles per element (real, imaginary). Used by ingested radar stacks. */
  COMPLEX128(16),
  /** One IEEE-754 float per element. Used by change maps. */
  FLOAT32(4);

  private final int byteSize;

  DataType(int byteSize) {
    this.byteSize = byteSize;
  }

  /**
   * @return the size in bytes of one element of this type
   */
  public int byteSize() {
    return byteSize;
  }
}
