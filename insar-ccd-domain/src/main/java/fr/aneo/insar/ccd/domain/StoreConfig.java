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

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import static java.util.Objects.requireNonNull;

/**
 * Immutable key/value settings forwarded verbatim to the {@link ArrayStoreClient}.
 * <p>
 * The engine never interprets these settings; credentials, caching or endpoint options are a
 * matter between the caller and the store implementation.
 */
public final class StoreConfig {
  private static final StoreConfig EMPTY = new StoreConfig(Map.of());

  private final Map<String, String> options;

  private StoreConfig(Map<String, String> options) {
    this.options = options;
  }

  public static StoreConfig empty() {
    return EMPTY;
  }

  public static StoreConfig from(Map<String, String> options) {
    requireNonNull(options, "options must not be null");
    return options.isEmpty() ? EMPTY : new StoreConfig(Map.copyOf(options));
  }

  public Optional<String> get(String key) {
    return Optional.ofNullable(options.get(key));
  }

  public Map<String, String> asMap() {
    return options;
  }

  public boolean isEmpty() {
    return options.isEmpty();
  }

  @Override
  public boolean equals(Object obj) {
    if (obj == this) return true;
    if (obj == null || obj.getClass() != this.getClass()) return false;
    return options.equals(((StoreConfig) obj).options);
  }

  @Override
  public int hashCode() {
    return options.hashCode();
  }

  @Override
  public String toString() {
    return "StoreConfig" + new TreeMap<>(options).keySet();
  }
}
