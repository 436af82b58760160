package br.com.maike.ledger.application.port;

/**
 * Blocking pause used for retry backoff and write throttling.
 *
 * @since 0.1.0
 * @see br.com.maike.ledger.infrastructure.time.ThreadSleeper
 */
@FunctionalInterface
public interface Sleeper {
  /**
   * Pauses the calling thread.
   *
   * @param millis pause length in milliseconds; non-positive values return immediately
   * @throws InterruptedException when the thread is interrupted while paused
   */
  void sleep(long millis) throws InterruptedException;

  /** Sleeper that never pauses; intended for tests and dry runs. */
  Sleeper NONE = millis -> {};
}
