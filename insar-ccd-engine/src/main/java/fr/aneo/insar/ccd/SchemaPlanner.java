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

import fr.aneo.insar.ccd.domain.ArrayAlreadyExistsException;
import fr.aneo.insar.ccd.domain.ArrayDescriptor;
import fr.aneo.insar.ccd.domain.ArrayStoreClient;
import fr.aneo.insar.ccd.domain.ArrayUri;
import fr.aneo.insar.ccd.domain.CcdException;
import fr.aneo.insar.ccd.domain.DataType;
import fr.aneo.insar.ccd.domain.SchemaConflictException;
import fr.aneo.insar.ccd.domain.StoreConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Derives the schema of a change map from the schema of its input stack and creates it.
 * <p>
 * The change map keeps the spatial dimensions of the input, with their domains and native tile
 * extents unchanged, and drops the band dimension. It holds a single
 * {@link DataType#FLOAT32} attribute named {@value ArrayDescriptor#CHANGE_ATTRIBUTE}.
 * <p>
 * Creation is strictly additive: an existing array is never reused. When the caller does not
 * name the output, a sibling of the input named {@code <input>_result_<TOKEN>} is created,
 * where {@code TOKEN} is made of four characters from {@code [A-Z0-9]}. A taken name is
 * replaced by a fresh one, up to {@value #MAX_NAMING_ATTEMPTS} times.
 */
public final class SchemaPlanner {
  private static final Logger logger = LoggerFactory.getLogger(SchemaPlanner.class);

  static final int MAX_NAMING_ATTEMPTS = 16;
  static final String RESULT_SUFFIX = "_result_";
  private static final String TOKEN_ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
  private static final int TOKEN_LENGTH = 4;

  private final ArrayStoreClient store;
  private final Supplier<String> tokens;

  public SchemaPlanner(ArrayStoreClient store) {
    this(store, SchemaPlanner::randomToken);
  }

  SchemaPlanner(ArrayStoreClient store, Supplier<String> tokens) {
    this.store = requireNonNull(store, "store must not be null");
    this.tokens = requireNonNull(tokens, "tokens must not be null");
  }

  /**
   * Computes the schema of the change map of {@code input} located at {@code output}.
   * No store access is performed.
   *
   * @param input  schema of a stack with dimensions {@code (band, y, x)}
   * @param output location of the change map
   * @return the change map schema
   * @throws IllegalArgumentException if {@code input} is not three-dimensional
   */
  public static ArrayDescriptor derive(ArrayDescriptor input, ArrayUri output) {
    requireNonNull(input, "input must not be null");
    requireNonNull(output, "output must not be null");
    if (input.rank() != 3) {
      throw new IllegalArgumentException("expected a (band, y, x) stack, got " + input.rank() + " dimensions for " + input.uri().asString());
    }

    return ArrayDescriptor.dense(output,
                                 input.dimensions().subList(1, 3),
                                 ArrayDescriptor.CHANGE_ATTRIBUTE,
                                 DataType.FLOAT32);
  }

  /**
   * Creates the change map of {@code input}.
   *
   * @param input  schema of the input stack
   * @param output requested output location, or {@code null} to synthesize one next to the input
   * @param config settings forwarded to the store
   * @return the schema of the created change map
   * @throws SchemaConflictException if {@code output} already holds an array, or if no free
   *                                 name could be synthesized
   */
  public ArrayDescriptor create(ArrayDescriptor input, ArrayUri output, StoreConfig config) {
    requireNonNull(input, "input must not be null");
    requireNonNull(config, "config must not be null");

    return output != null
      ? createExplicit(derive(input, output), config)
      : createSynthesized(input, config);
  }

  private ArrayDescriptor createExplicit(ArrayDescriptor schema, StoreConfig config) {
    if (store.exists(schema.uri(), config)) {
      throw new SchemaConflictException(schema.uri());
    }
    try {
      store.createSchema(schema, config);
    } catch (ArrayAlreadyExistsException e) {
      throw new SchemaConflictException(schema.uri(), e);
    }
    logger.info("Created output array {}", schema.uri().asString());
    return schema;
  }

  private ArrayDescriptor createSynthesized(ArrayDescriptor input, StoreConfig config) {
    ArrayUri candidate = null;
    for (int attempt = 1; attempt <= MAX_NAMING_ATTEMPTS; attempt++) {
      candidate = input.uri().withSuffix(RESULT_SUFFIX + tokens.get());
      if (store.exists(candidate, config)) {
        logger.debug("Output name {} is taken (attempt {}/{})", candidate.asString(), attempt, MAX_NAMING_ATTEMPTS);
        continue;
      }
      try {
        var schema = derive(input, candidate);
        store.createSchema(schema, config);
        logger.info("Created output array {}", candidate.asString());
        return schema;
      } catch (ArrayAlreadyExistsException e) {
        logger.debug("Output name {} was taken concurrently (attempt {}/{})", candidate.asString(), attempt, MAX_NAMING_ATTEMPTS);
      }
    }
    throw new SchemaConflictException(candidate,
      new CcdException("no free output name found next to " + input.uri().asString() + " after " + MAX_NAMING_ATTEMPTS + " attempts"));
  }

  static String randomToken() {
    var random = ThreadLocalRandom.current();
    var token = new StringBuilder(TOKEN_LENGTH);
    for (int i = 0; i < TOKEN_LENGTH; i++) {
      token.append(TOKEN_ALPHABET.charAt(random.nextInt(TOKEN_ALPHABET.length())));
    }
    return token.toString();
  }
}
