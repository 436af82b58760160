package br.com.maike.ledger.infrastructure.time;

import br.com.maike.ledger.application.port.Sleeper;

/**
 * {@link Sleeper} backed by {@link Thread#sleep(long)}.
 *
 * @since 0.1.0
 */
public final class ThreadSleeper implements Sleeper {
  @Override
  public void sleep(long millis) throws InterruptedException {
    if (millis > 0) {
      Thread.sleep(millis);
    }
  }
}
