package com.example.resilientdatasource.core.resilience;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import java.lang.System.Logger;
import java.sql.SQLException;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a blocking JDBC call on a worker thread and waits for it at most a fixed time: whichever of
 * the call and the timer settles first wins.
 *
 * <p>When the timer wins the caller gets an {@link AbandonedCallException} right away. Cleanup
 * never runs on the caller thread. {@code onTimeout} (typically {@link
 * java.sql.Statement#cancel()}) and the worker interrupt are submitted to the executor, and {@code
 * afterAbandoned} runs on the worker itself once the call has returned. Anything the call was
 * using must not be reused before {@code afterAbandoned} runs.
 */
public final class TimeoutRace {

  private static final Logger logger = System.getLogger(TimeoutRace.class.getName());

  private TimeoutRace() {}

  /**
   * Callable that can throw {@link SQLException}.
   *
   * @param <T> result type
   */
  @FunctionalInterface
  public interface SqlCallable<T> {
    T call() throws SQLException;
  }

  /**
   * Races {@code operation} against {@code timeout}, for calls that own all of their resources.
   *
   * @see #race(SqlCallable, Duration, ExecutorService, Runnable, Runnable)
   */
  public static <T> T race(
      final SqlCallable<T> operation,
      final Duration timeout,
      final ExecutorService executor,
      final Runnable onTimeout)
      throws SQLException {
    return race(operation, timeout, executor, onTimeout, null);
  }

  /**
   * Races {@code operation} against {@code timeout}.
   *
   * @param operation blocking call
   * @param timeout how long to wait
   * @param executor worker pool
   * @param onTimeout hook run on another worker when the timer wins, may be null
   * @param afterAbandoned hook run on the call's worker after an abandoned call returns, may be
   *     null; never runs when the caller received the call's own result or failure
   * @param <T> result type
   * @return the operation result
   * @throws AbandonedCallException when the timer wins or the wait is interrupted
   * @throws SQLException when the operation fails
   */
  public static <T> T race(
      final SqlCallable<T> operation,
      final Duration timeout,
      final ExecutorService executor,
      final Runnable onTimeout,
      final Runnable afterAbandoned)
      throws SQLException {
    final var call = new Call<>(operation, afterAbandoned);
    final var future = executor.submit(call);
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (final TimeoutException e) {
      if (!call.abandon()) return settled(future);
      cleanUp(call, onTimeout, executor);
      throw new AbandonedCallException(
          "Query timeout after " + timeout.toMillis() + " ms", "HYT00", e);
    } catch (final ExecutionException e) {
      throw unwrap(e);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      if (call.abandon()) cleanUp(call, onTimeout, executor);
      throw new AbandonedCallException("Interrupted while waiting for database call", "HY008", e);
    }
  }

  // the call already returned, so this does not block for long
  private static <T> T settled(final Future<T> future) throws SQLException {
    var interrupted = false;
    try {
      while (true) {
        try {
          return future.get();
        } catch (final InterruptedException e) {
          interrupted = true;
        } catch (final ExecutionException e) {
          throw unwrap(e);
        }
      }
    } finally {
      if (interrupted) Thread.currentThread().interrupt();
    }
  }

  private static void cleanUp(
      final Call<?> call, final Runnable onTimeout, final ExecutorService executor) {
    final Runnable cleanup =
        () -> {
          if (onTimeout != null) {
            try {
              onTimeout.run();
            } catch (final RuntimeException e) {
              logger.log(WARNING, "Timeout hook failed", e);
            }
          }
          call.interrupt();
        };
    try {
      executor.execute(cleanup);
    } catch (final RejectedExecutionException e) {
      logger.log(DEBUG, "Executor rejected timeout cleanup, using a dedicated thread");
      final var thread = new Thread(cleanup, "resilient-db-timeout-cleanup");
      thread.setDaemon(true);
      thread.start();
    }
  }

  private static SQLException unwrap(final ExecutionException e) {
    final var cause = e.getCause();
    if (cause instanceof SQLException sql) return sql;
    if (cause instanceof RuntimeException runtime) throw runtime;
    if (cause instanceof Error error) throw error;
    return new SQLException(cause.getMessage(), cause);
  }

  /** Worker side of one race. Exactly one of the caller and the worker ends up owning cleanup. */
  private static final class Call<T> implements Callable<T> {

    private static final int RUNNING = 0;
    private static final int RETURNED = 1;
    private static final int ABANDONED = 2;

    private final SqlCallable<T> operation;
    private final Runnable afterAbandoned;
    private final AtomicInteger state = new AtomicInteger(RUNNING);
    private Thread runner;

    Call(final SqlCallable<T> operation, final Runnable afterAbandoned) {
      this.operation = operation;
      this.afterAbandoned = afterAbandoned;
    }

    @Override
    public T call() throws SQLException {
      synchronized (this) {
        runner = Thread.currentThread();
      }
      try {
        return operation.call();
      } finally {
        synchronized (this) {
          runner = null;
        }
        if (!state.compareAndSet(RUNNING, RETURNED)) runAfterAbandoned();
      }
    }

    boolean abandon() {
      return state.compareAndSet(RUNNING, ABANDONED);
    }

    synchronized void interrupt() {
      if (runner != null) runner.interrupt();
    }

    private void runAfterAbandoned() {
      // a late interrupt from the cleanup must not leak into the hook
      Thread.interrupted();
      if (afterAbandoned == null) return;
      try {
        afterAbandoned.run();
      } catch (final RuntimeException e) {
        logger.log(WARNING, "Cleanup after abandoned call failed", e);
      }
    }
  }
}
