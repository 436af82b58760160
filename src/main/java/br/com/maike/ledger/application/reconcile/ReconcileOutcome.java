package br.com.maike.ledger.application.reconcile;

import br.com.maike.ledger.application.port.StoreException;
import br.com.maike.ledger.domain.document.Change;
import br.com.maike.ledger.domain.document.DocumentIdentity;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of reconciling one observation.
 *
 * @param identity document identity, {@code null} when the observation carried no number
 * @param status overall status
 * @param changes detected changes, in comparison order
 * @param historyAppended number of history rows written
 * @param failureKind failure classification when {@code status == FAILED} and a store failed, else {@code null}
 * @param failureMessage failure description when {@code status == FAILED}, else {@code null}
 * @since 0.1.0
 */
public record ReconcileOutcome(
    DocumentIdentity identity,
    Status status,
    List<Change> changes,
    int historyAppended,
    StoreException.Kind failureKind,
    String failureMessage) {

  /** Overall status of one observation. */
  public enum Status {
    /** A new snapshot row was created. */
    CREATED,
    /** The existing snapshot row was updated. */
    UPDATED,
    /** Nothing needed writing. */
    UNCHANGED,
    /** The observation could not be applied. */
    FAILED
  }

  public ReconcileOutcome {
    Objects.requireNonNull(status, "status");
    changes = changes == null ? List.of() : List.copyOf(changes);
  }

  static ReconcileOutcome failed(DocumentIdentity identity, StoreException.Kind kind, String message) {
    return new ReconcileOutcome(identity, Status.FAILED, List.of(), 0, kind, message);
  }

  /**
   * Indicates whether the observation failed.
   *
   * @return {@code true} for {@link Status#FAILED}
   */
  public boolean isFailure() {
    return status == Status.FAILED;
  }

  /**
   * Indicates whether a snapshot row was written.
   *
   * @return {@code true} for created or updated rows
   */
  public boolean wroteSnapshot() {
    return status == Status.CREATED || status == Status.UPDATED;
  }

  /**
   * Returns the failure classification.
   *
   * @return kind, empty unless a store failed
   */
  public Optional<StoreException.Kind> failure() {
    return Optional.ofNullable(failureKind);
  }
}
