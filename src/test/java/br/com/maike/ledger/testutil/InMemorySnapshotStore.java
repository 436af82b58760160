package br.com.maike.ledger.testutil;

import br.com.maike.ledger.application.port.SnapshotStore;
import br.com.maike.ledger.application.port.StoreException;
import br.com.maike.ledger.domain.document.CanonicalFields;
import br.com.maike.ledger.domain.document.DocumentIdentity;
import br.com.maike.ledger.domain.document.DocumentKind;
import br.com.maike.ledger.domain.document.Snapshot;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Snapshot store keeping rows in a list with the same matching, coalescing and uniqueness rules as the SQL store.
 *
 * <p>Failures can be scripted per operation; each scripted failure is thrown once, in order.</p>
 */
public final class InMemorySnapshotStore implements SnapshotStore {

  /** Operations that accept scripted failures. */
  public enum Op { FIND, INSERT, UPDATE, EXISTING, INCOMPLETE, VERSION_TAKEN }

  private final List<Snapshot> rows = new ArrayList<>();
  private final Map<Op, Deque<StoreException>> failures = new EnumMap<>(Op.class);
  private final Map<Op, Integer> calls = new EnumMap<>(Op.class);
  private final List<SnapshotUpdate> updates = new ArrayList<>();
  private Runnable beforeInsert = () -> {};
  private long nextId = 1;

  public void failNext(Op op, StoreException failure) {
    failures.computeIfAbsent(op, ignored -> new ArrayDeque<>()).add(failure);
  }

  public void failNext(Op op, StoreException.Kind kind) {
    failNext(op, new StoreException(kind, "scripted " + kind + " on " + op));
  }

  /** Runs once before the next insert is applied, e.g. to simulate a concurrent writer. */
  public void beforeNextInsert(Runnable action) {
    this.beforeInsert = action;
  }

  public int calls(Op op) {
    return calls.getOrDefault(op, 0);
  }

  public List<Snapshot> rows() {
    return List.copyOf(rows);
  }

  public List<SnapshotUpdate> updates() {
    return List.copyOf(updates);
  }

  public Snapshot seed(Snapshot snapshot) {
    Snapshot stored = withId(snapshot, nextId++);
    rows.add(stored);
    return stored;
  }

  @Override
  public Optional<Snapshot> find(DocumentIdentity identity) throws StoreException {
    enter(Op.FIND);
    return rows.stream().filter(row -> row.identity().equals(identity)).findFirst();
  }

  @Override
  public void insert(Snapshot snapshot) throws StoreException {
    Runnable action = beforeInsert;
    beforeInsert = () -> {};
    action.run();
    enter(Op.INSERT);
    boolean duplicate = rows.stream().anyMatch(row -> row.identity().equals(snapshot.identity()));
    if (duplicate) {
      throw new StoreException(StoreException.Kind.CONFLICT, "duplicate key " + snapshot.identity());
    }
    rows.add(withId(snapshot, nextId++));
  }

  @Override
  public void update(long id, SnapshotUpdate update) throws StoreException {
    enter(Op.UPDATE);
    for (int i = 0; i < rows.size(); i++) {
      Snapshot row = rows.get(i);
      if (row.id() == id) {
        updates.add(update);
        CanonicalFields fields = update.fields() == null ? row.fields() : update.fields().fillMissingFrom(row.fields());
        DocumentIdentity identity = row.identity().version() == null && update.version() != null
            ? new DocumentIdentity(row.identity().number(), row.identity().kind(), update.version())
            : row.identity();
        rows.set(i, new Snapshot(
            row.id(),
            identity,
            fields,
            update.processReference() != null ? update.processReference() : row.processReference(),
            update.rawPayload() != null ? update.rawPayload() : row.rawPayload(),
            update.sourceTag() != null ? update.sourceTag() : row.sourceTag(),
            update.at(),
            row.createdAt(),
            update.at()));
        return;
      }
    }
    throw new StoreException(StoreException.Kind.FAILURE, "no snapshot row " + id);
  }

  @Override
  public Set<String> existingNumbers(DocumentKind kind, Collection<String> numbers) throws StoreException {
    enter(Op.EXISTING);
    Set<String> present = new LinkedHashSet<>();
    for (Snapshot row : rows) {
      if (row.identity().kind() == kind && numbers.contains(row.identity().number())) {
        present.add(row.identity().number());
      }
    }
    return present;
  }

  @Override
  public List<Snapshot> findIncomplete(int limit) throws StoreException {
    enter(Op.INCOMPLETE);
    List<Snapshot> incomplete = new ArrayList<>();
    for (Snapshot row : rows) {
      if (isIncomplete(row) && incomplete.size() < limit) {
        incomplete.add(row);
      }
    }
    return incomplete;
  }

  @Override
  public boolean versionTaken(DocumentKind kind, String number, String version, long excludingId)
      throws StoreException {
    enter(Op.VERSION_TAKEN);
    return rows.stream().anyMatch(row -> row.id() != excludingId
        && row.identity().kind() == kind
        && row.identity().number().equals(number)
        && version.equals(row.identity().version()));
  }

  private static boolean isIncomplete(Snapshot row) {
    CanonicalFields fields = row.fields();
    boolean missingVersion = row.identity().version() == null
        && (row.identity().kind() == DocumentKind.IMPORT_DECLARATION
            || row.identity().kind() == DocumentKind.UNIFIED_IMPORT_DECLARATION);
    return !row.hasProcessReference()
        || fields.status() == null
        || fields.statusCode() == null
        || fields.channel() == null
        || fields.situation() == null
        || fields.registrationDate() == null
        || fields.situationDate() == null
        || fields.clearanceDate() == null
        || !row.hasRawPayload()
        || missingVersion;
  }

  private void enter(Op op) throws StoreException {
    calls.merge(op, 1, Integer::sum);
    Deque<StoreException> scripted = failures.get(op);
    if (scripted != null && !scripted.isEmpty()) {
      throw scripted.poll();
    }
  }

  private static Snapshot withId(Snapshot snapshot, long id) {
    Objects.requireNonNull(snapshot, "snapshot");
    return new Snapshot(id, snapshot.identity(), snapshot.fields(), snapshot.processReference(),
        snapshot.rawPayload(), snapshot.sourceTag(), snapshot.syncedAt(), snapshot.createdAt(),
        snapshot.updatedAt());
  }
}
