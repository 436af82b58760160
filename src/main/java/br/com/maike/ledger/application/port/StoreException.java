package br.com.maike.ledger.application.port;

import java.util.Objects;

/**
 * Checked failure raised by storage and source ports.
 *
 * <p>The {@link Kind} drives the engine's recovery policy: timeouts are retried with backoff, conflicts are
 * benign only for keyed financial inserts, and unavailability short-circuits the whole run.</p>
 *
 * @since 0.1.0
 */
public class StoreException extends Exception {
  private static final long serialVersionUID = 1L;

  /** Failure classification. */
  public enum Kind {
    /** The round-trip timed out; safe to retry. */
    TIMEOUT,
    /** A natural-key uniqueness constraint rejected the write. */
    CONFLICT,
    /** No connection could be obtained. */
    UNAVAILABLE,
    /** Any other failure. */
    FAILURE
  }

  private final Kind kind;

  /**
   * Creates an exception.
   *
   * @param kind failure classification
   * @param message diagnostic message
   * @param cause underlying failure, may be {@code null}
   */
  public StoreException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  /**
   * Creates an exception without a cause.
   *
   * @param kind failure classification
   * @param message diagnostic message
   */
  public StoreException(Kind kind, String message) {
    this(kind, message, null);
  }

  /**
   * Returns the failure classification.
   *
   * @return kind
   */
  public Kind kind() {
    return kind;
  }

  /**
   * Shortcut for {@code kind() == TIMEOUT}.
   *
   * @return {@code true} when the failure is a timeout
   */
  public boolean isTimeout() {
    return kind == Kind.TIMEOUT;
  }
}
