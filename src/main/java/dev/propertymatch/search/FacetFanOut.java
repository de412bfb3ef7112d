package dev.propertymatch.search;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.jspecify.annotations.Nullable;

/**
 * Runs the independent per-facet calls of one search stage concurrently and joins them under a
 * single deadline.
 *
 * <p>The first failure, the deadline passing, or interruption of the waiting thread cancels every
 * task still running (with interruption) and surfaces as one exception. Failures that are already
 * a {@link SimilaritySearchException} propagate unchanged; anything else is wrapped in a {@link
 * CollaboratorFailureException} naming the stage, as is a call that returns null.
 */
final class FacetFanOut {

  private final ExecutorService executor;

  FacetFanOut(ExecutorService executor) {
    this.executor = executor;
  }

  /**
   * Runs one task per facet and waits for all of them.
   *
   * @param stage stage name used in failure messages
   * @param tasks the call to make for each facet
   * @param timeout budget for the whole stage
   * @return each facet's result
   */
  <T> Map<Facet, T> invokeAll(String stage, Map<Facet, Callable<T>> tasks, Duration timeout) {
    CompletionService<FacetResult<T>> completion = new ExecutorCompletionService<>(executor);
    List<Future<FacetResult<T>>> inFlight = new ArrayList<>(tasks.size());
    long deadline = System.nanoTime() + timeout.toNanos();
    try {
      for (Map.Entry<Facet, Callable<T>> entry : tasks.entrySet()) {
        Facet facet = entry.getKey();
        Callable<T> task = entry.getValue();
        inFlight.add(completion.submit(() -> new FacetResult<>(facet, task.call())));
      }
      Map<Facet, T> results = new EnumMap<>(Facet.class);
      for (int i = 0; i < inFlight.size(); i++) {
        Future<FacetResult<T>> done =
            completion.poll(deadline - System.nanoTime(), TimeUnit.NANOSECONDS);
        if (done == null) {
          throw new CollaboratorFailureException(
              stage, "timed out after " + timeout.toMillis() + " ms");
        }
        FacetResult<T> result = done.get();
        results.put(result.facet(), requireResult(stage, result.value()));
      }
      return results;
    } catch (ExecutionException e) {
      throw unwrap(stage, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CollaboratorFailureException(stage, "interrupted", e);
    } catch (RejectedExecutionException e) {
      throw new CollaboratorFailureException(stage, "executor rejected the call", e);
    } finally {
      // No-op for tasks that already completed
      inFlight.forEach(future -> future.cancel(true));
    }
  }

  /**
   * Runs a single call under a deadline, with the same failure semantics as {@link #invokeAll}.
   */
  <T> T invoke(String stage, Callable<T> task, Duration timeout) {
    Future<T> future;
    try {
      future = executor.submit(task);
    } catch (RejectedExecutionException e) {
      throw new CollaboratorFailureException(stage, "executor rejected the call", e);
    }
    try {
      return requireResult(stage, future.get(timeout.toNanos(), TimeUnit.NANOSECONDS));
    } catch (TimeoutException e) {
      throw new CollaboratorFailureException(
          stage, "timed out after " + timeout.toMillis() + " ms", e);
    } catch (ExecutionException e) {
      throw unwrap(stage, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CollaboratorFailureException(stage, "interrupted", e);
    } finally {
      future.cancel(true);
    }
  }

  private static <T> T requireResult(String stage, @Nullable T value) {
    if (value == null) {
      throw new CollaboratorFailureException(stage, "returned no result");
    }
    return value;
  }

  private static RuntimeException unwrap(String stage, ExecutionException e) {
    Throwable cause = e.getCause() == null ? e : e.getCause();
    if (cause instanceof SimilaritySearchException searchFailure) {
      return searchFailure;
    }
    return new CollaboratorFailureException(stage, String.valueOf(cause.getMessage()), cause);
  }

  private record FacetResult<T>(Facet facet, @Nullable T value) {}
}
