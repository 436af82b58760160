package br.com.maike.ledger.testutil;

import br.com.maike.ledger.application.port.Sleeper;
import java.util.ArrayList;
import java.util.List;

/**
 * Sleeper that records requested pauses instead of sleeping.
 */
public final class RecordingSleeper implements Sleeper {
  private final List<Long> pauses = new ArrayList<>();

  @Override
  public void sleep(long millis) {
    pauses.add(millis);
  }

  public List<Long> pauses() {
    return List.copyOf(pauses);
  }
}
