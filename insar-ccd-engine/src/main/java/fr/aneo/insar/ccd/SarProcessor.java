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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Entry point applying one {@link SarFunction}, chosen when the processor is built, to
 * radar stacks.
 */
public final class SarProcessor {
  private static final Logger logger = LoggerFactory.getLogger(SarProcessor.class);

  private final SarFunction function;
  private final ChangeDetectionJob job;

  /**
   * @param functionName name of the function to apply
   * @param job          job the function runs on
   * @throws IllegalArgumentException if {@code functionName} names no known function
   */
  public SarProcessor(String functionName, ChangeDetectionJob job) {
    this(SarFunction.named(functionName), job);
  }

  public SarProcessor(SarFunction function, ChangeDetectionJob job) {
    this.function = requireNonNull(function, "function must not be null");
    this.job = requireNonNull(job, "job must not be null");
  }

  public SarFunction function() {
    return function;
  }

  public JobResult process(ChangeDetectionRequest request) {
    requireNonNull(request, "request must not be null");
    logger.info("Applying {} to {}", function.name(), request.input().asString());
    return function.run(job, request);
  }
}
