package com.flamingo.ai.extraction.service.agent;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.core.task.AsyncTaskExecutor;

/**
 * A model call submitted to a shared executor.
 *
 * <p>The call's timeout is measured from the moment a worker thread starts running it. Time spent
 * queued behind other documents is only bounded by the caller's deadline.
 *
 * @param <T> result type
 */
public final class AgentTask<T> {

  private static final long NOT_STARTED = Long.MIN_VALUE;

  private final AtomicLong startedAt = new AtomicLong(NOT_STARTED);
  private final Future<T> future;

  private AgentTask(AsyncTaskExecutor executor, Callable<T> call) {
    this.future =
        executor.submit(
            () -> {
              startedAt.set(System.nanoTime());
              return call.call();
            });
  }

  /**
   * Submits a call.
   *
   * @throws org.springframework.core.task.TaskRejectedException if the executor refuses it
   */
  public static <T> AgentTask<T> submit(AsyncTaskExecutor executor, Callable<T> call) {
    return new AgentTask<>(executor, call);
  }

  /**
   * Waits for the result.
   *
   * @param timeout budget of the call once it is running
   * @param deadlineNanos {@link System#nanoTime()} value after which to stop waiting, queued or
   *     not; {@link Long#MAX_VALUE} for none
   * @throws TimeoutException if the call ran longer than {@code timeout} or the deadline passed;
   *     the task is left running
   */
  public T await(Duration timeout, long deadlineNanos)
      throws InterruptedException, ExecutionException, TimeoutException {
    long timeoutNanos = timeout.toNanos();
    while (true) {
      long now = System.nanoTime();
      long started = startedAt.get();
      long runDeadline = (started == NOT_STARTED ? now : started) + timeoutNanos;
      long waitUntil = Math.min(runDeadline, deadlineNanos);
      try {
        return future.get(Math.max(0L, waitUntil - now), TimeUnit.NANOSECONDS);
      } catch (TimeoutException e) {
        long after = System.nanoTime();
        long startedNow = startedAt.get();
        boolean overrun = startedNow != NOT_STARTED && after - startedNow >= timeoutNanos;
        if (overrun || after >= deadlineNanos) {
          throw e;
        }
        // still queued, or started late in this wait slice
      }
    }
  }

  /** Whether a worker thread has picked the call up. */
  public boolean isStarted() {
    return startedAt.get() != NOT_STARTED;
  }

  /** Running time so far, zero while queued. */
  public Duration runningTime() {
    long started = startedAt.get();
    return started == NOT_STARTED ? Duration.ZERO : Duration.ofNanos(System.nanoTime() - started);
  }

  public boolean isDone() {
    return future.isDone();
  }

  public boolean isCancelled() {
    return future.isCancelled();
  }

  /** Cancels the call, interrupting it if it is running. */
  public void cancel() {
    future.cancel(true);
  }
}
