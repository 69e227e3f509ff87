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
package fr.aneo.insar.ccd.internal.concurrent;

import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.ListenableFuture;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import static com.google.common.util.concurrent.Futures.addCallback;
import static com.google.common.util.concurrent.MoreExecutors.directExecutor;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.CompletableFuture.completedFuture;

/**
 * Bridges Guava {@link ListenableFuture}s to {@link CompletionStage}s and combines stages.
 */
public final class Futures {

  private Futures() {
  }

  /**
   * Adapts a Guava {@link ListenableFuture} into a {@link CompletionStage}.
   * <ul>
   *   <li>If the source succeeds, the result completes with the same value.</li>
   *   <li>If the source fails, the result completes exceptionally with the same cause,
   *       unless it is a {@link CancellationException}, in which case the result is cancelled.</li>
   *   <li>If the returned stage is cancelled, the source is cancelled as well, with interruption allowed.</li>
   * </ul>
   * Callbacks run on the thread completing the source future.
   *
   * @param listenableFuture the source future to adapt; must not be {@code null}
   * @param <T>              the result type
   * @return a {@link CompletionStage} reflecting the source future's outcome
   */
  public static <T> CompletionStage<T> toCompletionStage(ListenableFuture<T> listenableFuture) {
    requireNonNull(listenableFuture);

    CompletableFuture<T> completableFuture = new CompletableFuture<>();
    addCallback(listenableFuture, completingCallback(completableFuture), directExecutor());

    completableFuture.whenComplete((value, throwable) -> {
      if (completableFuture.isCancelled()) listenableFuture.cancel(true);
    });

    return completableFuture;
  }

  /**
   * Returns a {@link CompletionStage} that completes once every given stage has completed.
   *
   * <p>The returned stage:</p>
   * <ul>
   *   <li>Completes successfully with the results in the order of the input stages, if all succeed.</li>
   *   <li>Completes exceptionally if any stage fails, but only after all stages have completed.</li>
   * </ul>
   *
   * @param stages the stages to combine
   * @param <T>    the result type
   * @return a stage that yields a list of results or fails if any input stage fails
   */
  public static <T> CompletionStage<List<T>> allOf(Collection<? extends CompletionStage<T>> stages) {
    if (stages.isEmpty()) return completedFuture(List.of());

    var futures = stages.stream().map(CompletionStage::toCompletableFuture).toList();

    return CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new))
                            .thenApply(v -> futures.stream()
                                                   // allOf ensures all futures are completed, so join() will not block here.
                                                   .map(CompletableFuture::join)
                                                   .toList());
  }

  private static <T> FutureCallback<T> completingCallback(CompletableFuture<T> completableFuture) {
    return new FutureCallback<>() {
      @Override
      public void onSuccess(T result) {
        completableFuture.complete(result);
      }

      @Override
      public void onFailure(Throwable throwable) {
        if (throwable instanceof CancellationException) {
          completableFuture.cancel(false);
        } else {
          completableFuture.completeExceptionally(throwable);
        }
      }
    };
  }
}
