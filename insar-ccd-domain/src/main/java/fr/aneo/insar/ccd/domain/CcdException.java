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
 * Base runtime exception for all change detection errors.
 * <p>
 * {@code CcdException} is thrown, or carried by {@link JobResult.Failed}, when a job cannot
 * produce a usable change map because of:
 * </p>
 * <ul>
 *   <li>an invalid request (see {@link InvalidBandSelectionException})</li>
 *   <li>an output location that is already taken (see {@link SchemaConflictException})</li>
 *   <li>a missing or malformed input stack (see {@link InputUnavailableException})</li>
 *   <li>a failure while computing one tile (see {@link TaskFailureException})</li>
 *   <li>a failure of the underlying array store (see {@link ArrayStoreException})</li>
 * </ul>
 * <p>
 * Numeric edge cases of the change metric are never reported through this hierarchy: they are
 * normalised to valid metric values.
 * </p>
 */
public class CcdException extends RuntimeException {

  public CcdException(String message) {
    super(message);
  }

  public CcdException(String message, Throwable cause) {
    super(message, cause);
  }
}
