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

import fr.aneo.insar.ccd.domain.StoreConfig;
import fr.aneo.insar.ccd.internal.GsonStoreConfigReader;

import java.nio.file.Path;
import java.util.Map;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 * Immutable configuration of the change detection engine.
 * <p>
 * Create instances using the builder pattern, or from environment variables with
 * {@link #fromEnvironment(Map)}.
 *
 * @see ChangeDetectionJob
 */
public final class CcdConfig {
  public static final String WORKERS_ENV = "InsarCcd__Workers";
  public static final String WINDOW_SIZE_ENV = "InsarCcd__WindowSize";
  public static final String NEIGHBOURHOOD_SIZE_ENV = "InsarCcd__NeighbourhoodSize";
  public static final String DESPECKLE_ENV = "InsarCcd__Despeckle";
  public static final String EDGE_TILE_POLICY_ENV = "InsarCcd__EdgeTilePolicy";
  public static final String STORE_CONFIG_ENV = "InsarCcd__StoreConfig";

  private final int workerCount;
  private final int windowSize;
  private final int neighbourhoodSize;
  private final DespeckleFilter.Type despeckle;
  private final EdgeTilePolicy edgeTilePolicy;
  private final StoreConfig storeConfig;

  private CcdConfig(Builder builder) {
    this.workerCount = builder.workerCount;
    this.windowSize = builder.windowSize;
    this.neighbourhoodSize = builder.neighbourhoodSize;
    this.despeckle = builder.despeckle;
    this.edgeTilePolicy = builder.edgeTilePolicy;
    this.storeConfig = builder.storeConfig;
  }

  /**
   * Returns the number of threads of the worker pool.
   *
   * @return the worker count, at least 1
   */
  public int workerCount() {
    return workerCount;
  }

  /**
   * Returns the default edge length of the estimation windows.
   *
   * @return the window size, at least 1
   */
  public int windowSize() {
    return windowSize;
  }

  /**
   * Returns the default edge length of the despeckle neighbourhood.
   *
   * @return the neighbourhood size, at least 1
   */
  public int neighbourhoodSize() {
    return neighbourhoodSize;
  }

  /**
   * Returns the despeckle filter applied to each tile before it is written.
   *
   * @return the filter type
   */
  public DespeckleFilter.Type despeckle() {
    return despeckle;
  }

  /**
   * Returns how trailing partial tiles are handled.
   *
   * @return the edge tile policy
   */
  public EdgeTilePolicy edgeTilePolicy() {
    return edgeTilePolicy;
  }

  /**
   * Returns the default settings forwarded to the store.
   *
   * @return the store settings, possibly empty
   */
  public StoreConfig storeConfig() {
    return storeConfig;
  }

  /**
   * Creates a request builder prefilled with the defaults of this configuration.
   *
   * @return a new request builder
   */
  public ChangeDetectionRequest.Builder requestBuilder() {
    return ChangeDetectionRequest.builder()
                                 .windowSize(windowSize)
                                 .neighbourhoodSize(neighbourhoodSize)
                                 .storeConfig(storeConfig);
  }

  /**
   * Creates a new builder for constructing a {@link CcdConfig}.
   *
   * @return a new builder instance
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builds a configuration from environment variables. Variables not present keep their default.
   * <ul>
   *   <li>{@value #WORKERS_ENV}: worker count</li>
   *   <li>{@value #WINDOW_SIZE_ENV}: window size</li>
   *   <li>{@value #NEIGHBOURHOOD_SIZE_ENV}: neighbourhood size</li>
   *   <li>{@value #DESPECKLE_ENV}: {@code NONE} or {@code MEDIAN}</li>
   *   <li>{@value #EDGE_TILE_POLICY_ENV}: {@code TRUNCATE} or {@code CLIP}</li>
   *   <li>{@value #STORE_CONFIG_ENV}: path to a JSON file of store settings</li>
   * </ul>
   *
   * @param environment the variables, typically {@link System#getenv()}
   * @return the configuration
   * @throws IllegalArgumentException if a variable holds an invalid value
   */
  public static CcdConfig fromEnvironment(Map<String, String> environment) {
    requireNonNull(environment, "environment must not be null");

    var builder = builder();
    ifPresent(environment, WORKERS_ENV, value -> builder.workerCount(parseInt(WORKERS_ENV, value)));
    ifPresent(environment, WINDOW_SIZE_ENV, value -> builder.windowSize(parseInt(WINDOW_SIZE_ENV, value)));
    ifPresent(environment, NEIGHBOURHOOD_SIZE_ENV, value -> builder.neighbourhoodSize(parseInt(NEIGHBOURHOOD_SIZE_ENV, value)));
    ifPresent(environment, DESPECKLE_ENV, value -> builder.despeckle(DespeckleFilter.Type.named(value)));
    ifPresent(environment, EDGE_TILE_POLICY_ENV, value -> builder.edgeTilePolicy(EdgeTilePolicy.named(value)));
    ifPresent(environment, STORE_CONFIG_ENV, value -> builder.storeConfig(new GsonStoreConfigReader().read(Path.of(value))));
    return builder.build();
  }

  private static void ifPresent(Map<String, String> environment, String name, Consumer<String> action) {
    var value = environment.get(name);
    if (value != null && !value.isBlank()) action.accept(value.trim());
  }

  private static int parseInt(String name, String value) {
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(name + " must be an integer, got: '" + value + "'", e);
    }
  }

  @Override
  public String toString() {
    return "CcdConfig{" +
      "workerCount=" + workerCount +
      ", windowSize=" + windowSize +
      ", neighbourhoodSize=" + neighbourhoodSize +
      ", despeckle=" + despeckle +
      ", edgeTilePolicy=" + edgeTilePolicy +
      ", storeConfig=" + storeConfig +
      '}';
  }

  /**
   * Builder for {@link CcdConfig}.
   * <p>
   * Use fluent methods to override the defaults, then call {@link #build()} to create an
   * immutable configuration instance.
   */
  public static final class Builder {
    private int workerCount = Math.max(2, Runtime.getRuntime().availableProcessors());
    private int windowSize = ChangeDetectionRequest.DEFAULT_WINDOW_SIZE;
    private int neighbourhoodSize = ChangeDetectionRequest.DEFAULT_NEIGHBOURHOOD_SIZE;
    private DespeckleFilter.Type despeckle = DespeckleFilter.Type.NONE;
    private EdgeTilePolicy edgeTilePolicy = EdgeTilePolicy.TRUNCATE;
    private StoreConfig storeConfig = StoreConfig.empty();

    private Builder() {
    }

    /**
     * Sets the number of threads of the worker pool. Defaults to the number of available
     * processors, and at least 2.
     */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /**
     * Sets the default window size. Defaults to {@value ChangeDetectionRequest#DEFAULT_WINDOW_SIZE}.
     */
    public Builder windowSize(int windowSize) {
      this.windowSize = windowSize;
      return this;
    }

    /**
     * Sets the default neighbourhood size. Defaults to
     * {@value ChangeDetectionRequest#DEFAULT_NEIGHBOURHOOD_SIZE}.
     */
    public Builder neighbourhoodSize(int neighbourhoodSize) {
      this.neighbourhoodSize = neighbourhoodSize;
      return this;
    }

    public Builder despeckle(DespeckleFilter.Type despeckle) {
      this.despeckle = despeckle;
      return this;
    }

    public Builder edgeTilePolicy(EdgeTilePolicy edgeTilePolicy) {
      this.edgeTilePolicy = edgeTilePolicy;
      return this;
    }

    public Builder storeConfig(StoreConfig storeConfig) {
      this.storeConfig = storeConfig;
      return this;
    }

    /**
     * Builds the configuration.
     *
     * @return a new configuration
     * @throws IllegalArgumentException if a size is not strictly positive
     * @throws NullPointerException     if a required setting was set to {@code null}
     */
    public CcdConfig build() {
      requirePositive("workerCount", workerCount);
      requirePositive("windowSize", windowSize);
      requirePositive("neighbourhoodSize", neighbourhoodSize);
      requireNonNull(despeckle, "despeckle must not be null");
      requireNonNull(edgeTilePolicy, "edgeTilePolicy must not be null");
      requireNonNull(storeConfig, "storeConfig must not be null");
      return new CcdConfig(this);
    }

    private static void requirePositive(String name, int value) {
      if (value <= 0) throw new IllegalArgumentException(name + " must be > 0, got: " + value);
    }
  }
}
