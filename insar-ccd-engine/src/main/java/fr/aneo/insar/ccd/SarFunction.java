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
package fr.aneo.insar.ccd;

import fr.aneo.insar.ccd.domain.JobResult;

import static java.util.Objects.requireNonNull;

/**
 * Closed set of processing functions applicable to a radar stack.
 * <p>
 * Functions are selected by name with {@link #named(String)}; an unknown name is rejected
 * immediately rather than ignored.
 */
public sealed interface SarFunction permits SarFunction.CoherentChangeDetection {

  /**
   * @return the name the function is selected by
   */
  String name();

  JobResult run(ChangeDetectionJob job, ChangeDetectionRequest request);

  /**
   * Resolves a function by name, ignoring case.
   *
   * @param name the function name, e.g. {@code "ccd"}
   * @return the function
   * @throws IllegalArgumentException if no function has that name
   */
  static SarFunction named(String name) {
    requireNonNull(name, "name must not be null");
    if (CoherentChangeDetection.NAME.equalsIgnoreCase(name.trim())) {
      return new CoherentChangeDetection();
    }
    throw new IllegalArgumentException("Unknown SAR function '" + name + "'. Expected one of: " + CoherentChangeDetection.NAME);
  }

  /**
   * Coherent change detection between two bands of the stack.
   */
  record CoherentChangeDetection() implements SarFunction {
    static final String NAME = "ccd";

    @Override
    public String name() {
      return NAME;
    }

    @Override
    public JobResult run(ChangeDetectionJob job, ChangeDetectionRequest request) {
      return job.run(request);
    }
  }
}
