package br.com.maike.ledger.application.pipeline;

import br.com.maike.ledger.application.port.SnapshotStore;
import br.com.maike.ledger.application.port.StoreException;
import br.com.maike.ledger.domain.document.DocumentKind;
import br.com.maike.ledger.domain.document.ExistenceStatus;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory existence answers for one document kind, loaded in bounded batches and kept for the rest of a run.
 *
 * <p>A batch that still times out after the retry budget marks its numbers {@link ExistenceStatus#UNKNOWN}
 * instead of assuming they are absent. Not thread-safe; one instance serves one sequential run.</p>
 *
 * @since 0.1.0
 */
final class ExistenceCache {
  private static final Logger log = LoggerFactory.getLogger(ExistenceCache.class);

  private final DocumentKind kind;
  private final SnapshotStore snapshots;
  private final RetryPolicy retry;
  private final int batchSize;
  private final Map<String, ExistenceStatus> answers = new HashMap<>();

  ExistenceCache(DocumentKind kind, SnapshotStore snapshots, RetryPolicy retry, int batchSize) {
    this.kind = Objects.requireNonNull(kind, "kind");
    this.snapshots = Objects.requireNonNull(snapshots, "snapshots");
    this.retry = Objects.requireNonNull(retry, "retry");
    if (batchSize < 1) {
      throw new IllegalArgumentException("batchSize must be positive");
    }
    this.batchSize = batchSize;
  }

  /**
   * Loads answers for the given numbers, one round-trip per batch.
   *
   * @param numbers numbers to check
   * @return number of batches that ended unknown
   * @throws StoreException when the store is unavailable
   * @throws InterruptedException when interrupted during backoff
   */
  int preload(Collection<String> numbers) throws StoreException, InterruptedException {
    List<String> pending = new ArrayList<>();
    for (String number : numbers) {
      if (!answers.containsKey(number)) {
        pending.add(number);
      }
    }
    int unknownBatches = 0;
    for (int start = 0; start < pending.size(); start += batchSize) {
      List<String> batch = pending.subList(start, Math.min(start + batchSize, pending.size()));
      int batchNo = start / batchSize + 1;
      try {
        Set<String> present = retry.execute(
            kind.code() + " existence batch " + batchNo, () -> snapshots.existingNumbers(kind, batch));
        for (String number : batch) {
          answers.put(number, present.contains(number) ? ExistenceStatus.PRESENT : ExistenceStatus.ABSENT);
        }
      } catch (StoreException ex) {
        if (ex.kind() == StoreException.Kind.UNAVAILABLE) {
          throw ex;
        }
        unknownBatches++;
        log.warn("{} existence batch {} ({} numbers) unresolved: {}", kind.code(), batchNo, batch.size(),
            ex.getMessage());
        for (String number : batch) {
          answers.put(number, ExistenceStatus.UNKNOWN);
        }
      }
    }
    return unknownBatches;
  }

  ExistenceStatus status(String number) {
    return answers.getOrDefault(number, ExistenceStatus.UNKNOWN);
  }

  void markPresent(String number) {
    answers.put(number, ExistenceStatus.PRESENT);
  }

  /**
   * Re-checks one number against the store, bypassing cached answers.
   *
   * @param number number to check
   * @return fresh answer; {@link ExistenceStatus#UNKNOWN} when the check itself fails
   * @throws InterruptedException when interrupted during backoff
   */
  ExistenceStatus verify(String number) throws InterruptedException {
    try {
      Set<String> present = retry.execute(
          kind.code() + " existence re-check", () -> snapshots.existingNumbers(kind, List.of(number)));
      ExistenceStatus status = present.contains(number) ? ExistenceStatus.PRESENT : ExistenceStatus.ABSENT;
      answers.put(number, status);
      return status;
    } catch (StoreException ex) {
      log.debug("Existence re-check for {} {} failed: {}", kind.code(), number, ex.getMessage());
      return ExistenceStatus.UNKNOWN;
    }
  }
}
