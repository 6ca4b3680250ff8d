package org.waabox.chorus;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;

/**
 * The consumer-supplied operation that re-fetches its data.
 *
 * <p>The operation is asynchronous: the returned stage completes when the
 * data was reloaded, or completes exceptionally on failure. An exception
 * thrown by {@link #refresh()} itself also counts as a failure.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface RefreshOperation {

  /**
   * Starts a refresh.
   *
   * @return a stage that completes when the refresh is done, never null
   */
  CompletionStage<?> refresh();

  /**
   * Adapts code that refreshes on the calling thread.
   *
   * @param task the refresh code, never null
   * @return the operation, never null
   */
  static RefreshOperation synchronous(final Callable<?> task) {
    Objects.requireNonNull(task, "task must not be null");
    return () -> {
      try {
        return CompletableFuture.completedFuture(task.call());
      } catch (final Exception e) {
        return CompletableFuture.failedFuture(e);
      }
    };
  }

  /**
   * Adapts blocking refresh code by running it on the given executor.
   *
   * @param task     the refresh code, never null
   * @param executor the executor that runs it, never null
   * @return the operation, never null
   */
  static RefreshOperation blocking(final Callable<?> task,
      final Executor executor) {
    Objects.requireNonNull(task, "task must not be null");
    Objects.requireNonNull(executor, "executor must not be null");
    return () -> CompletableFuture.supplyAsync(() -> {
      try {
        return task.call();
      } catch (final RuntimeException e) {
        throw e;
      } catch (final Exception e) {
        throw new CompletionException(e);
      }
    }, executor);
  }
}
