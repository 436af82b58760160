package br.com.maike.ledger.infrastructure.time;

import br.com.maike.ledger.application.port.ClockPort;

/**
 * {@link ClockPort} implementation backed by {@link System#currentTimeMillis()}.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  /**
   * Creates a system clock adapter.
   */
  public SystemClockAdapter() {}

  /**
   * Returns the current epoch milliseconds.
   *
   * @return current epoch milliseconds
   * @implNote Delegates to {@link System#currentTimeMillis()}; snapshot and history timestamps derive from it.
   */
  @Override
  public long nowMillis() {
    return System.currentTimeMillis();
  }
}
