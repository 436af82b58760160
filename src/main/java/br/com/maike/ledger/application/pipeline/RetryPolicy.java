package br.com.maike.ledger.application.pipeline;

import br.com.maike.ledger.application.port.MetricsPort;
import br.com.maike.ledger.application.port.Sleeper;
import br.com.maike.ledger.application.port.StoreException;
import br.com.maike.ledger.validation.Numbers;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Bounded exponential-backoff retry for store round-trips.
 * <p><strong>Policy:</strong> only {@link StoreException.Kind#TIMEOUT} failures are retried. The wait before
 * retry {@code n} (1-based) is {@code initialBackoffMillis * 2^(n-1)}; no wait follows the last attempt. Every
 * other failure kind is rethrown at once.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share.</p>
 * <p><strong>Observability:</strong> Increments {@code retry.attempt} per retry and {@code retry.exhausted} when
 * the bound is hit.</p>
 *
 * @since 0.1.0
 */
public final class RetryPolicy {
  private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

  private final int maxAttempts;
  private final long initialBackoffMillis;
  private final Sleeper sleeper;
  private final MetricsPort metrics;

  /**
   * Creates a policy.
   *
   * @param maxAttempts total attempts including the first, at least 1
   * @param initialBackoffMillis wait before the first retry
   * @param sleeper pause implementation
   * @param metrics metrics sink
   */
  public RetryPolicy(int maxAttempts, long initialBackoffMillis, Sleeper sleeper, MetricsPort metrics) {
    this.maxAttempts = (int) Numbers.requireRange("maxAttempts", maxAttempts, 1, 20);
    this.initialBackoffMillis = Numbers.requireRange("initialBackoffMillis", initialBackoffMillis, 0, 600_000);
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /** A store round-trip that may fail with a {@link StoreException}. */
  @FunctionalInterface
  public interface StoreCall<T> {
    T call() throws StoreException;
  }

  /**
   * Runs a call, retrying timeouts.
   *
   * @param operation label used in logs
   * @param call round-trip to run
   * @param <T> result type
   * @return result of the first successful attempt
   * @throws StoreException the last timeout once attempts are exhausted, or the first non-timeout failure
   * @throws InterruptedException when interrupted during backoff
   */
  public <T> T execute(String operation, StoreCall<T> call) throws StoreException, InterruptedException {
    Objects.requireNonNull(call, "call");
    int attempt = 1;
    while (true) {
      try {
        return call.call();
      } catch (StoreException ex) {
        if (!ex.isTimeout()) {
          throw ex;
        }
        if (attempt >= maxAttempts) {
          metrics.increment("retry.exhausted");
          log.warn("{} timed out after {} attempt(s)", operation, attempt);
          throw ex;
        }
        long wait = backoffBefore(attempt + 1);
        metrics.increment("retry.attempt");
        log.info("{} timed out (attempt {}/{}); retrying in {} ms", operation, attempt, maxAttempts, wait);
        sleeper.sleep(wait);
        attempt++;
      }
    }
  }

  /**
   * Returns the wait preceding a given attempt.
   *
   * @param attempt 1-based attempt number
   * @return {@code 0} for the first attempt, else {@code initialBackoffMillis * 2^(attempt-2)}
   */
  public long backoffBefore(int attempt) {
    if (attempt <= 1) {
      return 0L;
    }
    return initialBackoffMillis << Math.min(attempt - 2, 20);
  }

  /**
   * Returns the configured attempt bound.
   *
   * @return total attempts
   */
  public int maxAttempts() {
    return maxAttempts;
  }
}
