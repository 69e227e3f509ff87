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

import fr.aneo.insar.ccd.domain.ArrayUri;
import fr.aneo.insar.ccd.domain.StoreConfig;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Parameters of one change detection run.
 * <p>
 * The band selection is kept as given, so that an invalid selection is reported by
 * {@link ChangeDetectionJob#run(ChangeDetectionRequest)} as an
 * {@link fr.aneo.insar.ccd.domain.InvalidBandSelectionException} rather than when the request
 * is built. Window sizes are validated by the job as well.
 *
 * @param input             the radar stack to compare
 * @param bands             the selected band indices; change detection needs exactly two
 * @param output            location of the change map, or {@code null} to let the job name it
 * @param windowSize        edge length of the estimation windows
 * @param neighbourhoodSize edge length of the despeckle neighbourhood
 * @param storeConfig       settings forwarded to the store
 */
public record ChangeDetectionRequest(ArrayUri input,
                                     List<Integer> bands,
                                     ArrayUri output,
                                     int windowSize,
                                     int neighbourhoodSize,
                                     StoreConfig storeConfig) {

  public static final int DEFAULT_WINDOW_SIZE = 7;
  public static final int DEFAULT_NEIGHBOURHOOD_SIZE = 5;

  public ChangeDetectionRequest {
    requireNonNull(input, "input must not be null");
    requireNonNull(bands, "bands must not be null");
    requireNonNull(storeConfig, "storeConfig must not be null");
    bands = Collections.unmodifiableList(new ArrayList<>(bands));
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private ArrayUri input;
    private final List<Integer> bands = new ArrayList<>();
    private ArrayUri output;
    private int windowSize = DEFAULT_WINDOW_SIZE;
    private int neighbourhoodSize = DEFAULT_NEIGHBOURHOOD_SIZE;
    private StoreConfig storeConfig = StoreConfig.empty();

    Builder() {
    }

    public Builder input(ArrayUri input) {
      this.input = input;
      return this;
    }

    public Builder input(String input) {
      return input(ArrayUri.from(input));
    }

    /**
     * Replaces the band selection.
     */
    public Builder bands(Integer... bands) {
      return bands(Arrays.asList(bands));
    }

    public Builder bands(List<Integer> bands) {
      this.bands.clear();
      this.bands.addAll(bands);
      return this;
    }

    /**
     * Sets the output location. Left unset, a fresh name is derived from the input.
     */
    public Builder output(ArrayUri output) {
      this.output = output;
      return this;
    }

    public Builder output(String output) {
      return output(ArrayUri.from(output));
    }

    public Builder windowSize(int windowSize) {
      this.windowSize = windowSize;
      return this;
    }

    public Builder neighbourhoodSize(int neighbourhoodSize) {
      this.neighbourhoodSize = neighbourhoodSize;
      return this;
    }

    public Builder storeConfig(StoreConfig storeConfig) {
      this.storeConfig = storeConfig;
      return this;
    }

    /**
     * @throws NullPointerException if no input was set
     */
    public ChangeDetectionRequest build() {
      return new ChangeDetectionRequest(input, bands, output, windowSize, neighbourhoodSize, storeConfig);
    }
  }
}
