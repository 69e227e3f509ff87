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
package fr.aneo.insar.ccd.internal;

import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import fr.aneo.insar.ccd.domain.CcdException;
import fr.aneo.insar.ccd.domain.StoreConfig;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.toMap;

/**
 * Loads {@link StoreConfig} settings from a JSON document using Gson.
 * <p>
 * The document must be a single flat object whose values are all strings:
 * </p>
 * <pre>{@code
 * {
 *   "vfs.s3.region": "eu-west-3",
 *   "sm.tile_cache_size": "10000000"
 * }
 * }</pre>
 * <p>
 * This class is thread-safe.
 * </p>
 */
public final class GsonStoreConfigReader {

  /**
   * Reads the settings stored in {@code file}, encoded in UTF-8.
   *
   * @param file the JSON file; must not be {@code null}
   * @return the settings
   * @throws CcdException             if the file cannot be read
   * @throws IllegalArgumentException if the file is not a flat JSON object of strings
   */
  public StoreConfig read(Path file) {
    requireNonNull(file, "file cannot be null");

    try {
      return parse(Files.readString(file, StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new CcdException("Unable to read store configuration file " + file, e);
    }
  }

  /**
   * Parses settings from a JSON document.
   *
   * @param json the JSON document; must not be {@code null}
   * @return the settings
   * @throws IllegalArgumentException if {@code json} is not a flat JSON object of strings
   */
  public StoreConfig parse(String json) {
    requireNonNull(json, "json cannot be null");

    try {
      var root = JsonParser.parseString(json);
      if (!root.isJsonObject()) {
        throw new IllegalArgumentException("Store configuration must be a JSON object, got: " + root);
      }
      return StoreConfig.from(settingsOf(root.getAsJsonObject()));
    } catch (JsonParseException e) {
      throw new IllegalArgumentException("Invalid JSON format for store configuration", e);
    }
  }

  private static Map<String, String> settingsOf(JsonObject jsonObject) {
    return jsonObject.entrySet()
                     .stream()
                     .collect(toMap(
                       Map.Entry::getKey,
                       entry -> {
                         var value = entry.getValue();
                         if (!value.isJsonPrimitive() || !value.getAsJsonPrimitive().isString()) {
                           throw new IllegalArgumentException("Store setting '" + entry.getKey() + "' must be a string, got: " + value);
                         }
                         return value.getAsString();
                       }
                     ));
  }
}
