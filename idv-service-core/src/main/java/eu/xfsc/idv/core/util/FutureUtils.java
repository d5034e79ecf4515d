package eu.xfsc.idv.core.util;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Helpers for {@link java.util.concurrent.CompletableFuture} pipelines.
 */
public final class FutureUtils {

  private FutureUtils() {
  }

  /**
   * Strips the {@link CompletionException} / {@link ExecutionException} wrappers the future machinery adds,
   * so the original storage or crypto failure reaches the caller.
   *
   * @param error the error a future completed with
   * @return the underlying cause
   */
  public static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
