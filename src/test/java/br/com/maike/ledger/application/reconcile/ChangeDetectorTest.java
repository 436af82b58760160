package br.com.maike.ledger.application.reconcile;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import br.com.maike.ledger.domain.document.CanonicalField;
import br.com.maike.ledger.domain.document.CanonicalFields;
import br.com.maike.ledger.domain.document.Change;
import br.com.maike.ledger.domain.document.ChangeEventKind;
import br.com.maike.ledger.domain.document.DocumentIdentity;
import br.com.maike.ledger.domain.document.DocumentKind;
import br.com.maike.ledger.domain.document.Snapshot;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ChangeDetectorTest {
  private static final LocalDateTime NOW = LocalDateTime.of(2025, 7, 1, 12, 0);
  private static final LocalDateTime REGISTERED = LocalDateTime.of(2025, 6, 20, 8, 30);

  private final ChangeDetector detector = new ChangeDetector();

  @Test
  void newIdentityProducesNoChanges() {
    List<Change> changes = detector.detect(Optional.empty(), fields("DESEMBARACADA", "VERDE"), NOW);

    assertTrue(changes.isEmpty());
  }

  @Test
  void singleDifferingFieldYieldsExactlyOneChange() {
    Optional<Snapshot> stored = stored(fields("EM ANALISE", "VERDE"));

    List<Change> changes = detector.detect(stored, fields("DESEMBARACADA", "VERDE"), NOW);

    assertEquals(1, changes.size());
    Change change = changes.get(0);
    assertEquals(CanonicalField.STATUS, change.field());
    assertEquals(ChangeEventKind.STATUS_CHANGE, change.eventKind());
    assertEquals("EM ANALISE", change.previousValue());
    assertEquals("DESEMBARACADA", change.newValue());
    assertEquals(NOW, change.detectedAt());
  }

  @Test
  void absentNewValueNeverReportsAChange() {
    Optional<Snapshot> stored = stored(fields("DESEMBARACADA", "VERDE"));
    CanonicalFields partial = new CanonicalFields(null, null, null, null, null, null, null);

    assertTrue(detector.detect(stored, partial, NOW).isEmpty());
  }

  @Test
  void previouslyMissingValueIsReportedWithNullPrevious() {
    Optional<Snapshot> stored = stored(new CanonicalFields("DESEMBARACADA", null, null, null, null, null, null));
    CanonicalFields current = new CanonicalFields("DESEMBARACADA", null, null, null, null, null,
        LocalDateTime.of(2025, 6, 25, 16, 45, 10));

    List<Change> changes = detector.detect(stored, current, NOW);

    assertEquals(1, changes.size());
    assertEquals(CanonicalField.CLEARANCE_DATE, changes.get(0).field());
    assertNull(changes.get(0).previousValue());
    assertEquals("2025-06-25T16:45:10", changes.get(0).newValue());
    assertEquals("clearance_date changed from '' to '2025-06-25T16:45:10'", changes.get(0).description());
  }

  @Test
  void changesFollowFixedComparisonOrder() {
    Optional<Snapshot> stored = stored(fields("A", "VERDE"));
    CanonicalFields current = new CanonicalFields("B", null, "VERMELHO", null,
        REGISTERED.plusDays(1), LocalDateTime.of(2025, 6, 21, 9, 0), null);

    List<Change> changes = detector.detect(stored, current, NOW);

    assertEquals(List.of(CanonicalField.STATUS, CanonicalField.CHANNEL, CanonicalField.REGISTRATION_DATE,
            CanonicalField.SITUATION_DATE),
        changes.stream().map(Change::field).toList());
  }

  @Test
  void statusCodeAndSituationAreStoredButNotCompared() {
    Optional<Snapshot> stored = stored(new CanonicalFields("A", "01", "VERDE", "x", REGISTERED, null, null));
    CanonicalFields current = new CanonicalFields("A", "02", "VERDE", "y", REGISTERED, null, null);

    assertTrue(detector.detect(stored, current, NOW).isEmpty());
  }

  private static CanonicalFields fields(String status, String channel) {
    return new CanonicalFields(status, status, channel, status, REGISTERED, null, null);
  }

  private static Optional<Snapshot> stored(CanonicalFields fields) {
    return Optional.of(new Snapshot(1L, DocumentIdentity.of("2512345678", DocumentKind.IMPORT_DECLARATION),
        fields, "ALH.0001/25", "{}", "SERPRO_DB", NOW.minusDays(1), NOW.minusDays(2), NOW.minusDays(1)));
  }
}
