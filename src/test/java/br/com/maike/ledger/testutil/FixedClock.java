package br.com.maike.ledger.testutil;

import br.com.maike.ledger.application.port.ClockPort;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneId;

/**
 * Manually advanced clock.
 */
public final class FixedClock implements ClockPort {
  private LocalDateTime now;

  public FixedClock(LocalDateTime start) {
    this.now = start;
  }

  @Override
  public long nowMillis() {
    return now.atZone(ZoneId.systemDefault()).toInstant().toEpochMilli();
  }

  @Override
  public LocalDateTime now() {
    return now;
  }

  public void advance(Duration duration) {
    now = now.plus(duration);
  }
}
