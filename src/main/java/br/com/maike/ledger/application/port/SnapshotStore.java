package br.com.maike.ledger.application.port;

import br.com.maike.ledger.domain.document.CanonicalFields;
import br.com.maike.ledger.domain.document.DocumentIdentity;
import br.com.maike.ledger.domain.document.DocumentKind;
import br.com.maike.ledger.domain.document.Snapshot;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Port over the snapshot table ({@code DOCUMENTO_ADUANEIRO}).
 * <p><strong>Role:</strong> Driven port used by the snapshot upserter, history appender and orchestrators.</p>
 * <p><strong>Matching rule:</strong> identity lookups match number, kind and version, where an absent version
 * matches only a stored {@code null} version.</p>
 *
 * @since 0.1.0
 */
public interface SnapshotStore {

  /**
   * Finds the snapshot of an identity; when several rows exist the most recently updated wins.
   *
   * @param identity document identity
   * @return snapshot or empty
   * @throws StoreException when the lookup fails
   */
  Optional<Snapshot> find(DocumentIdentity identity) throws StoreException;

  /**
   * Inserts a new snapshot row.
   *
   * @param snapshot row to insert; {@code id} is ignored
   * @throws StoreException with kind {@code CONFLICT} when the identity already exists
   */
  void insert(Snapshot snapshot) throws StoreException;

  /**
   * Applies an update to an existing row.
   *
   * @param id row id
   * @param update values to write
   * @throws StoreException when the write fails
   */
  void update(long id, SnapshotUpdate update) throws StoreException;

  /**
   * Returns which of the supplied numbers already have at least one snapshot of the given kind.
   *
   * @param kind document kind
   * @param numbers candidate numbers; callers bound the batch size
   * @return subset of {@code numbers} present in storage
   * @throws StoreException when the lookup fails
   */
  Set<String> existingNumbers(DocumentKind kind, Collection<String> numbers) throws StoreException;

  /**
   * Lists snapshot rows with at least one missing canonical field, process reference, version or payload.
   *
   * @param limit maximum number of rows
   * @return incomplete rows, most recently updated first
   * @throws StoreException when the query fails
   */
  List<Snapshot> findIncomplete(int limit) throws StoreException;

  /**
   * Indicates whether another row of the same number and kind already carries a version.
   *
   * @param kind document kind
   * @param number document number
   * @param version version to look for
   * @param excludingId row to ignore
   * @return {@code true} when the version is taken
   * @throws StoreException when the lookup fails
   */
  boolean versionTaken(DocumentKind kind, String number, String version, long excludingId) throws StoreException;

  /**
   * Values applied by {@link #update(long, SnapshotUpdate)}.
   *
   * <p>{@code null} canonical components keep the stored value. {@code processReference}, {@code version} and
   * {@code rawPayload} are written only when non-null.</p>
   *
   * @param fields canonical fields to coalesce into the row
   * @param processReference new process reference or {@code null}
   * @param version version to set when the stored one is {@code null}, or {@code null}
   * @param rawPayload payload JSON or {@code null}
   * @param sourceTag data-source tag or {@code null}
   * @param at sync and update time
   */
  record SnapshotUpdate(
      CanonicalFields fields,
      String processReference,
      String version,
      String rawPayload,
      String sourceTag,
      LocalDateTime at) {}
}
