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
 * Thrown when the output location of a job already holds an array.
 * <p>
 * Outputs are only ever created, never overwritten or appended to, so that results of
 * separate runs cannot be mixed. The caller must choose another location.
 */
public class SchemaConflictException extends CcdException {
  private final ArrayUri output;

  public SchemaConflictException(ArrayUri output) {
    super("output array already exists: " + output.asString());
    this.output = output;
  }

  public SchemaConflictException(ArrayUri output, Throwable cause) {
    super("output array already exists: " + output.asString(), cause);
    this.output = output;
  }

  public ArrayUri output() {
    return output;
  }
}
