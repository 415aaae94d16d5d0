package com.example.resilientdatasource.core.resilience;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import java.lang.System.Logger;
import java.sql.SQLException;

/**
 * Bounded retry with exponential backoff for connection acquisition, coupled to a {@link
 * CircuitBreaker}.
 *
 * <ul>
 *   <li>An open circuit fails immediately with {@link CircuitOpenException}; no attempt is made.
 *   <li>Fatal kinds abort on the first failure and are reported to the breaker.
 *   <li>Transient and contention kinds are retried until the policy is exhausted; the last failure
 *       is then rethrown and the breaker stays closed.
 *   <li>Unrecognized failures are rethrown without retry.
 * </ul>
 */
public final class RetryExecutor {

  private static final Logger logger = System.getLogger(RetryExecutor.class.getName());

  private final CircuitBreaker circuitBreaker;
  private final ConnectionStats stats;
  private final Policy defaultPolicy;

  public RetryExecutor(final CircuitBreaker circuitBreaker, final ConnectionStats stats) {
    this(circuitBreaker, stats, Policy.defaultPolicy());
  }

  public RetryExecutor(
      final CircuitBreaker circuitBreaker,
      final ConnectionStats stats,
      final Policy defaultPolicy) {
    if (circuitBreaker == null) throw new IllegalArgumentException("circuitBreaker cannot be null");
    if (stats == null) throw new IllegalArgumentException("stats cannot be null");
    if (defaultPolicy == null) throw new IllegalArgumentException("defaultPolicy cannot be null");
    this.circuitBreaker = circuitBreaker;
    this.stats = stats;
    this.defaultPolicy = defaultPolicy;
  }

  /**
   * Supplier that can throw {@link SQLException}.
   *
   * @param <T> result type
   */
  @FunctionalInterface
  public interface SqlSupplier<T> {
    T get() throws SQLException;
  }

  /**
   * Retry policy configuration supporting exponential backoff.
   *
   * @param maxAttempts maximum number of attempts (including first), must be >= 1
   * @param initialDelayMillis delay before the first retry in milliseconds, must be >= 0
   * @param maxDelayMillis maximum delay cap for exponential backoff, must be >= initialDelayMillis
   * @param backoffMultiplier multiplier for exponential backoff (1.0 = fixed delay), must be >= 1.0
   * @param jitter whether to add random jitter (up to 25%) to delays
   */
  public record Policy(
      int maxAttempts,
      long initialDelayMillis,
      long maxDelayMillis,
      double backoffMultiplier,
      boolean jitter) {

    public Policy {
      if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
      if (initialDelayMillis < 0)
        throw new IllegalArgumentException("initialDelayMillis must be >= 0");
      if (maxDelayMillis < initialDelayMillis)
        throw new IllegalArgumentException("maxDelayMillis must be >= initialDelayMillis");
      if (backoffMultiplier < 1.0)
        throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
    }

    /**
     * Three retries after the first attempt, doubling from 1 s up to 5 s.
     *
     * @return default acquisition policy
     */
    public static Policy defaultPolicy() {
      return retries(3, 1_000L, 5_000L);
    }

    /**
     * Creates a doubling backoff policy expressed in retries rather than attempts.
     *
     * @param maxRetries retries after the first attempt
     * @param minDelayMillis delay before the first retry
     * @param maxDelayMillis delay cap
     * @return exponential policy without jitter
     */
    public static Policy retries(
        final int maxRetries, final long minDelayMillis, final long maxDelayMillis) {
      return new Policy(maxRetries + 1, minDelayMillis, maxDelayMillis, 2.0, false);
    }

    /**
     * Creates a fixed delay retry policy.
     *
     * @param attempts number of attempts (including first)
     * @param delayMillis delay between attempts in milliseconds
     * @return fixed delay retry policy
     */
    public static Policy fixed(final int attempts, final long delayMillis) {
      return new Policy(attempts, delayMillis, delayMillis, 1.0, false);
    }

    /**
     * Calculates the delay to wait before the given attempt.
     *
     * @param attempt attempt about to start (1-based)
     * @return delay in milliseconds, 0 for the first attempt
     */
    public long delayBefore(final int attempt) {
      if (attempt <= 1) return 0L;

      var delay = initialDelayMillis;
      if (backoffMultiplier > 1.0) {
        delay = (long) (initialDelayMillis * Math.pow(backoffMultiplier, attempt - 2));
        delay = Math.min(delay, maxDelayMillis);
      }

      if (jitter) {
        final var jitterAmount = (long) (delay * 0.25 * Math.random());
        delay += jitterAmount;
      }

      return delay;
    }
  }

  public <T> T withRetry(final SqlSupplier<T> action) throws SQLException {
    return withRetry(action, defaultPolicy);
  }

  /**
   * Runs {@code action} under the retry and circuit rules described on the class.
   *
   * @param action operation to run, typically a connection acquisition
   * @param policy retry policy for this call
   * @param <T> result type
   * @return action result
   * @throws CircuitOpenException if the circuit is (or becomes) open
   * @throws SQLException the last failure when the action cannot complete
   */
  public <T> T withRetry(final SqlSupplier<T> action, final Policy policy) throws SQLException {
    var attempt = 0;
    while (true) {
      attempt++;
      if (circuitBreaker.isOpen()) throw new CircuitOpenException(circuitBreaker.state());

      stats.recordAttempt();
      try {
        final var result = action.get();
        stats.recordSuccess();
        circuitBreaker.recordSuccess();
        return result;
      } catch (final SQLException e) {
        final var kind = ErrorClassifier.classify(e);
        if (kind == ErrorKind.CIRCUIT_OPEN) throw e;
        stats.recordFailure(kind);

        if (kind.isFatal()) {
          logger.log(WARNING, "Fatal database error {0}, not retrying: {1}", kind, e.getMessage());
          circuitBreaker.recordFailure(kind);
          throw e;
        }

        if (!kind.isRetryable()) {
          logger.log(WARNING, "Unrecognized database error, not retrying: {0}", e.getMessage());
          throw e;
        }

        if (attempt >= policy.maxAttempts()) {
          logger.log(WARNING, "All {0} attempts failed, last error {1}", attempt, kind);
          throw e;
        }

        final var delay = policy.delayBefore(attempt + 1);
        logger.log(
            DEBUG, "Attempt {0} failed with {1}, retrying in {2} ms", attempt, kind, delay);

        if (delay > 0) {
          try {
            Thread.sleep(delay);
          } catch (final InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw e;
          }
        }
      }
    }
  }
}
