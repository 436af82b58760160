package br.com.maike.ledger.application.port;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;

/**
 * <strong>What:</strong> Domain port supplying wall-clock time to the reconciliation engine.
 * <p><strong>Why:</strong> Snapshot and history timestamps come from the application, not the database clock,
 * so tests can pin them.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @implNote Default implementation delegates to {@link System#currentTimeMillis()}.
 * @since 0.1.0
 * @see br.com.maike.ledger.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /**
   * Returns the current local time in the JVM zone, truncated to milliseconds.
   *
   * @return local wall-clock time
   */
  default LocalDateTime now() {
    return LocalDateTime.ofInstant(java.time.Instant.ofEpochMilli(nowMillis()), ZoneId.systemDefault())
        .truncatedTo(ChronoUnit.MILLIS);
  }

  /**
   * Default {@link ClockPort} using {@link System#currentTimeMillis()}.
   */
  ClockPort SYSTEM = System::currentTimeMillis;
}
