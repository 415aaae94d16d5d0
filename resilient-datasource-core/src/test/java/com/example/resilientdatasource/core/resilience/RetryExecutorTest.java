package com.example.resilientdatasource.core.resilience;

import static org.junit.jupiter.api.Assertions.*;

import com.example.resilientdatasource.core.resilience.RetryExecutor.Policy;
import java.net.SocketTimeoutException;
import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class RetryExecutorTest {

  private static final Policy NO_DELAY = Policy.retries(3, 0L, 0L);

  private CircuitBreaker breaker;
  private ConnectionStats stats;
  private RetryExecutor retry;

  @BeforeEach
  void setUp() {
    breaker = new CircuitBreaker(Duration.ofSeconds(30));
    stats = new ConnectionStats();
    retry = new RetryExecutor(breaker, stats, NO_DELAY);
  }

  @AfterEach
  void clearInterruptFlag() {
    if (Thread.currentThread().isInterrupted()) Thread.interrupted();
  }

  private static SQLException accessDenied() {
    return new SQLException("Access denied for user 'app'", "28000", 1045);
  }

  private static SQLException timeout() {
    return new SQLNonTransientConnectionException(
        "Communications link failure", "08S01", 0, new SocketTimeoutException("timed out"));
  }

  @Nested
  @DisplayName("Fatal Errors")
  class FatalErrors {

    @Test
    @DisplayName("Should make exactly one attempt and open the circuit on a fatal error")
    void shouldAbortOnFatalError() {
      final var attempts = new AtomicInteger();

      final var thrown =
          assertThrows(
              SQLException.class,
              () ->
                  retry.withRetry(
                      () -> {
                        attempts.incrementAndGet();
                        throw accessDenied();
                      }));

      assertEquals(1045, thrown.getErrorCode());
      assertEquals(1, attempts.get());
      assertTrue(breaker.isOpen());
      assertEquals(ErrorKind.AUTH_REJECTED, breaker.state().trippedBy());
      assertEquals(1, stats.snapshot().attempts());
      assertEquals(1, stats.snapshot().failures());
    }

    @Test
    @DisplayName("Should fail fast without calling the action while the circuit is open")
    void shouldFailFastWhenOpen() {
      breaker.recordFailure(ErrorKind.UNKNOWN_DATABASE);
      final var attempts = new AtomicInteger();

      final var thrown =
          assertThrows(
              CircuitOpenException.class,
              () -> retry.withRetry(() -> attempts.incrementAndGet()));

      assertEquals(0, attempts.get());
      assertEquals(0, stats.snapshot().attempts());
      assertEquals(ErrorKind.UNKNOWN_DATABASE, thrown.state().trippedBy());
    }
  }

  @Nested
  @DisplayName("Transient Errors")
  class TransientErrors {

    @Test
    @DisplayName("Should retry transient errors until success")
    void shouldRetryUntilSuccess() throws Exception {
      final var attempts = new AtomicInteger();

      final var result =
          retry.withRetry(
              () -> {
                if (attempts.incrementAndGet() < 3) throw timeout();
                return "connected";
              });

      assertEquals("connected", result);
      assertEquals(3, attempts.get());
      assertFalse(breaker.isOpen());
      final var snapshot = stats.snapshot();
      assertEquals(3, snapshot.attempts());
      assertEquals(1, snapshot.successes());
      assertEquals(2, snapshot.failures());
      assertEquals(2, snapshot.timeouts());
    }

    @Test
    @DisplayName("Should rethrow the last failure after exhausting retries and stay closed")
    void shouldExhaustRetries() {
      final var attempts = new AtomicInteger();

      assertThrows(
          SQLException.class,
          () ->
              retry.withRetry(
                  () -> {
                    attempts.incrementAndGet();
                    throw timeout();
                  }));

      assertEquals(4, attempts.get());
      assertFalse(breaker.isOpen());
    }

    @Test
    @DisplayName("Should retry deadlocks")
    void shouldRetryContention() throws Exception {
      final var attempts = new AtomicInteger();

      final var result =
          retry.withRetry(
              () -> {
                if (attempts.incrementAndGet() == 1)
                  throw new SQLException("Deadlock found", "40001", 1213);
                return 1;
              });

      assertEquals(1, result);
      assertEquals(2, attempts.get());
    }

    @Test
    @DisplayName("Should honor a per-call policy")
    void shouldHonorPerCallPolicy() {
      final var attempts = new AtomicInteger();

      assertThrows(
          SQLException.class,
          () ->
              retry.withRetry(
                  () -> {
                    attempts.incrementAndGet();
                    throw timeout();
                  },
                  Policy.fixed(2, 0L)));

      assertEquals(2, attempts.get());
    }

    @Test
    @DisplayName("Should stop retrying and keep the interrupt flag when interrupted")
    void shouldStopWhenInterrupted() {
      final var slow = new RetryExecutor(breaker, stats, Policy.fixed(5, 1_000L));
      final var attempts = new AtomicInteger();
      Thread.currentThread().interrupt();

      assertThrows(
          SQLException.class,
          () ->
              slow.withRetry(
                  () -> {
                    attempts.incrementAndGet();
                    throw timeout();
                  }));

      assertEquals(1, attempts.get());
      assertTrue(Thread.currentThread().isInterrupted());
    }
  }

  @Nested
  @DisplayName("Unexpected Errors")
  class UnexpectedErrors {

    @Test
    @DisplayName("Should not retry unrecognized errors")
    void shouldNotRetryUnknown() {
      final var attempts = new AtomicInteger();

      assertThrows(
          SQLException.class,
          () ->
              retry.withRetry(
                  () -> {
                    attempts.incrementAndGet();
                    throw new SQLException("You have an error in your SQL syntax", "42000", 1064);
                  }));

      assertEquals(1, attempts.get());
      assertFalse(breaker.isOpen());
    }
  }

  @Nested
  @DisplayName("Policy")
  class PolicyTests {

    @Test
    @DisplayName("Should double delays from 1 s and cap them at 5 s by default")
    void shouldComputeDefaultDelays() {
      final var policy = Policy.defaultPolicy();
      assertEquals(4, policy.maxAttempts());
      assertEquals(0L, policy.delayBefore(1));
      assertEquals(1_000L, policy.delayBefore(2));
      assertEquals(2_000L, policy.delayBefore(3));
      assertEquals(4_000L, policy.delayBefore(4));
      assertEquals(5_000L, policy.delayBefore(5));
    }

    @Test
    @DisplayName("Should keep a fixed delay")
    void shouldComputeFixedDelays() {
      final var policy = Policy.fixed(3, 250L);
      assertEquals(250L, policy.delayBefore(2));
      assertEquals(250L, policy.delayBefore(3));
    }

    @Test
    @DisplayName("Should add at most 25% jitter")
    void shouldBoundJitter() {
      final var policy = new Policy(5, 1_000L, 1_000L, 1.0, true);
      for (var i = 0; i < 100; i++) {
        final var delay = policy.delayBefore(2);
        assertTrue(delay >= 1_000L && delay <= 1_250L, "delay out of range: " + delay);
      }
    }

    @Test
    @DisplayName("Should reject invalid policies")
    void shouldRejectInvalidPolicies() {
      assertThrows(IllegalArgumentException.class, () -> new Policy(0, 0L, 0L, 1.0, false));
      assertThrows(IllegalArgumentException.class, () -> new Policy(1, -1L, 0L, 1.0, false));
      assertThrows(IllegalArgumentException.class, () -> new Policy(1, 10L, 5L, 1.0, false));
      assertThrows(IllegalArgumentException.class, () -> new Policy(1, 0L, 0L, 0.5, false));
    }
  }
}
