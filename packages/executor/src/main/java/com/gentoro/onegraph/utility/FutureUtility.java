package com.gentoro.onegraph.utility;

import java.util.Arrays;
import java.util.Collection;
import java.util.concurrent.CompletableFuture;

public class FutureUtility {

  /**
   * Cancel {@code upstream} when {@code downstream} is cancelled. Dependent stages created with
   * {@code thenApply}, {@code thenCompose}, {@code handle} or {@code allOf} do not forward
   * cancellation to the futures they were derived from.
   *
   * @return {@code downstream}
   */
  public static <T> CompletableFuture<T> propagateCancellation(
      CompletableFuture<T> downstream, Collection<? extends CompletableFuture<?>> upstream) {
    downstream.whenComplete(
        (result, failure) -> {
          if (downstream.isCancelled()) {
            for (CompletableFuture<?> future : upstream) {
              future.cancel(true);
            }
          }
        });
    return downstream;
  }

  public static <T> CompletableFuture<T> propagateCancellation(
      CompletableFuture<T> downstream, CompletableFuture<?>... upstream) {
    return propagateCancellation(downstream, Arrays.asList(upstream));
  }
}
