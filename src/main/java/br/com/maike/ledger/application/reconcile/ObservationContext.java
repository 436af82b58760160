package br.com.maike.ledger.application.reconcile;

import br.com.maike.ledger.domain.document.CanonicalFields;
import br.com.maike.ledger.domain.document.DocumentIdentity;
import br.com.maike.ledger.domain.document.SourceDescriptor;
import br.com.maike.ledger.validation.Strings;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Everything the history appender and snapshot upserter need about one observation.
 *
 * @param identity document identity
 * @param fields observed canonical fields
 * @param processReference shipment reference supplied with the observation, or {@code null}
 * @param rawPayload raw payload as JSON, or {@code null}
 * @param source provenance
 * @param observedAt observation time, used for every timestamp written
 * @since 0.1.0
 */
public record ObservationContext(
    DocumentIdentity identity,
    CanonicalFields fields,
    String processReference,
    String rawPayload,
    SourceDescriptor source,
    LocalDateTime observedAt) {

  public ObservationContext {
    Objects.requireNonNull(identity, "identity");
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(observedAt, "observedAt");
    fields = fields == null ? CanonicalFields.EMPTY : fields;
    processReference = Strings.trimToNull(processReference);
    rawPayload = Strings.trimToNull(rawPayload);
  }
}
