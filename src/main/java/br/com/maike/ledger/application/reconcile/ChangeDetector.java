package br.com.maike.ledger.application.reconcile;

import br.com.maike.ledger.domain.document.CanonicalField;
import br.com.maike.ledger.domain.document.CanonicalFields;
import br.com.maike.ledger.domain.document.Change;
import br.com.maike.ledger.domain.document.Snapshot;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Diffs freshly observed canonical fields against the stored snapshot.
 *
 * <p>Only the fixed comparison list ({@link CanonicalField#compared()}) is inspected, in its declared order.
 * A change is reported only when the new value is present and its rendered text differs from the stored one;
 * an absent new value never reports a change. A missing snapshot yields no changes, since inception is not a
 * change.</p>
 *
 * @since 0.1.0
 */
public final class ChangeDetector {

  /**
   * Detects field-level changes.
   *
   * @param previous stored snapshot, empty for a new identity
   * @param current observed fields; must not be {@code null}
   * @param detectedAt timestamp stamped on every change
   * @return ordered changes, possibly empty
   */
  public List<Change> detect(Optional<Snapshot> previous, CanonicalFields current, LocalDateTime detectedAt) {
    Objects.requireNonNull(previous, "previous");
    Objects.requireNonNull(current, "current");
    Objects.requireNonNull(detectedAt, "detectedAt");
    if (previous.isEmpty()) {
      return List.of();
    }
    CanonicalFields stored = previous.get().fields();
    List<Change> changes = new ArrayList<>();
    for (CanonicalField field : CanonicalField.compared()) {
      String newValue = current.render(field);
      if (newValue == null) {
        continue;
      }
      String oldValue = stored.render(field);
      if (!newValue.equals(oldValue)) {
        changes.add(new Change(field.eventKind().orElseThrow(), field, oldValue, newValue, detectedAt));
      }
    }
    return List.copyOf(changes);
  }
}
