package br.com.maike.ledger.application.pipeline;

import br.com.maike.ledger.application.json.PayloadJson;
import br.com.maike.ledger.application.port.AuthoritativeDocumentSource;
import br.com.maike.ledger.application.port.AuthoritativeDocumentSource.SourcedPayload;
import br.com.maike.ledger.application.port.ClockPort;
import br.com.maike.ledger.application.port.LegacyPayloadCache;
import br.com.maike.ledger.application.port.LegacyPayloadCache.CachedPayload;
import br.com.maike.ledger.application.port.MetricsPort;
import br.com.maike.ledger.application.port.SnapshotStore;
import br.com.maike.ledger.application.port.SnapshotStore.SnapshotUpdate;
import br.com.maike.ledger.application.port.StoreException;
import br.com.maike.ledger.application.reconcile.FieldExtractor;
import br.com.maike.ledger.config.GapFillConfig;
import br.com.maike.ledger.domain.document.CanonicalField;
import br.com.maike.ledger.domain.document.CanonicalFields;
import br.com.maike.ledger.domain.document.DocumentIdentity;
import br.com.maike.ledger.domain.document.DocumentPayload;
import br.com.maike.ledger.domain.document.Snapshot;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Fills blank fields of existing snapshot rows without touching populated ones.
 * <p><strong>Payload choice:</strong> the stored raw payload, replaced by the cached payload when that one is
 * longer, then by an authoritative minimal payload when the best one is still shorter than the configured
 * threshold. A missing process reference is taken from the cache row.</p>
 * <p><strong>Version rule:</strong> a version is written only when the row has none and no other row of the same
 * number and kind already carries it.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; runs are sequential.</p>
 * <p><strong>Observability:</strong> Emits {@code gapfill.*} counters.</p>
 *
 * @since 0.1.0
 */
public final class GapFillUseCase {
  private static final Logger log = LoggerFactory.getLogger(GapFillUseCase.class);
  // early live ingestions stored this literal instead of the unified declaration number
  private static final String PLACEHOLDER_NUMBER = "api";

  private final SnapshotStore snapshots;
  private final LegacyPayloadCache cache;
  private final List<AuthoritativeDocumentSource> sources;
  private final FieldExtractor extractor;
  private final PayloadJson json;
  private final ClockPort clock;
  private final MetricsPort metrics;

  /**
   * Creates the use case.
   *
   * @param snapshots snapshot store
   * @param cache local payload cache
   * @param sources authoritative payload sources
   * @param extractor key/value payload mapper
   * @param json payload parser
   * @param clock clock for update timestamps
   * @param metrics metrics sink
   */
  public GapFillUseCase(
      SnapshotStore snapshots,
      LegacyPayloadCache cache,
      List<AuthoritativeDocumentSource> sources,
      FieldExtractor extractor,
      PayloadJson json,
      ClockPort clock,
      MetricsPort metrics) {
    this.snapshots = Objects.requireNonNull(snapshots, "snapshots");
    this.cache = Objects.requireNonNull(cache, "cache");
    this.sources = List.copyOf(Objects.requireNonNull(sources, "sources"));
    this.extractor = Objects.requireNonNull(extractor, "extractor");
    this.json = Objects.requireNonNull(json, "json");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Runs the gap-fill.
   *
   * @param config run settings
   * @return totals; never throws for store failures
   */
  public GapFillReport run(GapFillConfig config) {
    Objects.requireNonNull(config, "config");
    List<Snapshot> rows;
    try {
      rows = snapshots.findIncomplete(config.limit());
    } catch (StoreException ex) {
      log.error("Could not list incomplete snapshots ({}): {}", ex.kind(), ex.getMessage());
      boolean unavailable = ex.kind() == StoreException.Kind.UNAVAILABLE;
      return new GapFillReport(0, 0, 0, 0, unavailable ? 0 : 1, config.dryRun(), unavailable);
    }
    log.info("{}{} incomplete snapshot row(s)", config.dryRun() ? "[DRY-RUN] " : "", rows.size());

    int updated = 0;
    int skipped = 0;
    int malformed = 0;
    int errors = 0;
    boolean unavailable = false;
    int examined = 0;
    for (Snapshot row : rows) {
      examined++;
      try {
        Result result = fill(row, config);
        switch (result) {
          case UPDATED -> updated++;
          case SKIPPED -> skipped++;
          case MALFORMED -> malformed++;
        }
        metrics.increment("gapfill." + result.name().toLowerCase(Locale.ROOT));
      } catch (StoreException ex) {
        if (ex.kind() == StoreException.Kind.UNAVAILABLE) {
          log.error("Store unavailable; stopping gap-fill: {}", ex.getMessage());
          unavailable = true;
          break;
        }
        errors++;
        metrics.increment("gapfill.errors");
        log.warn("Could not fill {} ({}): {}", row.identity(), ex.kind(), ex.getMessage());
      }
    }
    GapFillReport report = new GapFillReport(examined, updated, skipped, malformed, errors, config.dryRun(),
        unavailable);
    report.summaryLines().forEach(log::info);
    return report;
  }

  private enum Result { UPDATED, SKIPPED, MALFORMED }

  private Result fill(Snapshot row, GapFillConfig config) throws StoreException {
    DocumentIdentity identity = row.identity();
    if (row.id() == null || PLACEHOLDER_NUMBER.equalsIgnoreCase(identity.number())) {
      return Result.SKIPPED;
    }
    Optional<CachedPayload> cached = cached(identity);
    String best = bestPayload(row, cached.map(CachedPayload::json).orElse(null), config.minPayloadLength());
    if (best == null) {
      log.debug("{}: no payload to fill from", identity);
      return Result.SKIPPED;
    }
    Optional<Map<String, Object>> parsed = json.parseObject(best);
    if (parsed.isEmpty()) {
      log.warn("{}: payload is not a JSON object; skipped", identity);
      return Result.MALFORMED;
    }
    DocumentPayload payload = extractor.extract(identity.kind(), identity.number(), parsed.get());
    CanonicalFields derived = payload.canonical();

    CanonicalFields stored = row.fields();
    CanonicalFields fills = new CanonicalFields(
        stored.status() == null ? derived.status() : null,
        stored.statusCode() == null ? derived.statusCode() : null,
        stored.channel() == null ? derived.channel() : null,
        stored.situation() == null ? derived.situation() : null,
        stored.registrationDate() == null ? derived.registrationDate() : null,
        stored.situationDate() == null ? derived.situationDate() : null,
        stored.clearanceDate() == null ? derived.clearanceDate() : null);
    List<String> filled = new ArrayList<>();
    for (CanonicalField field : CanonicalField.values()) {
      if (!fills.isMissing(field)) {
        filled.add(field.fieldName());
      }
    }

    String version = null;
    if (identity.version() == null && payload.version().isPresent()) {
      String candidate = payload.version().get();
      if (snapshots.versionTaken(identity.kind(), identity.number(), candidate, row.id())) {
        log.debug("{}: version {} already used by another row", identity, candidate);
      } else {
        version = candidate;
        filled.add("version");
      }
    }

    String processReference = null;
    if (!row.hasProcessReference()) {
      processReference = cached.map(CachedPayload::processReference).orElse(null);
      if (processReference != null) {
        filled.add("process_reference");
      }
    }

    String rawPayload = null;
    if (!row.hasRawPayload()) {
      rawPayload = best;
      filled.add("raw_payload");
    }

    if (filled.isEmpty()) {
      return Result.SKIPPED;
    }
    if (config.dryRun()) {
      log.info("[DRY-RUN] {} would fill {}", identity, filled);
      return Result.UPDATED;
    }
    snapshots.update(row.id(), new SnapshotUpdate(fills, processReference, version, rawPayload, null, clock.now()));
    log.info("{} filled {}", identity, filled);
    return Result.UPDATED;
  }

  private String bestPayload(Snapshot row, String cachedJson, int minLength) throws StoreException {
    DocumentIdentity identity = row.identity();
    String best = row.hasRawPayload() ? row.rawPayload() : null;
    if (cachedJson != null && (best == null || cachedJson.length() > best.length())) {
      best = cachedJson;
    }
    if (best != null && best.length() >= minLength) {
      return best;
    }
    for (AuthoritativeDocumentSource source : sources) {
      if (!source.supports(identity.kind())) {
        continue;
      }
      Optional<SourcedPayload> fetched = source.fetch(identity.kind(), identity.number(), row.processReference());
      if (fetched.isPresent()) {
        String authoritative = json.write(fetched.get().rawPayload());
        if (authoritative != null && (best == null || authoritative.length() > best.length())) {
          best = authoritative;
        }
      }
      break;
    }
    return best;
  }

  private Optional<CachedPayload> cached(DocumentIdentity identity) {
    try {
      return cache.latest(identity.kind(), identity.number());
    } catch (StoreException ex) {
      log.debug("Cache lookup for {} failed: {}", identity, ex.getMessage());
      return Optional.empty();
    }
  }
}
