package br.com.maike.ledger.domain.process;

import br.com.maike.ledger.domain.document.DocumentKind;
import br.com.maike.ledger.validation.Strings;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Shipment row read from the local process cache.
 *
 * <p>The ledger never writes processes; it only uses them to resolve document cross-references.</p>
 *
 * @param reference shipment reference, upper-cased (for example {@code BGR.0070/25})
 * @param importId numeric import id used by the replicated consultation tables, may be {@code null}
 * @param manifestNumber cached cargo manifest number, may be {@code null}
 * @param declarationNumber cached import declaration number, may be {@code null}
 * @param unifiedDeclarationNumber cached unified declaration number, may be {@code null}
 * @since 0.1.0
 */
public record ProcessRecord(
    String reference,
    Long importId,
    String manifestNumber,
    String declarationNumber,
    String unifiedDeclarationNumber) {

  public ProcessRecord {
    reference = Objects.requireNonNull(Strings.trimToNull(reference), "reference").toUpperCase(Locale.ROOT);
    manifestNumber = Strings.trimToNull(manifestNumber);
    declarationNumber = Strings.trimToNull(declarationNumber);
    unifiedDeclarationNumber = Strings.trimToNull(unifiedDeclarationNumber);
  }

  /**
   * Creates a process record carrying only the reference.
   *
   * @param reference shipment reference
   * @return record without cached numbers
   */
  public static ProcessRecord of(String reference) {
    return new ProcessRecord(reference, null, null, null, null);
  }

  /**
   * Returns the cached number for a document kind.
   *
   * @param kind document kind
   * @return cached number; always empty for terminal-control documents, which are not cached per process
   */
  public Optional<String> cachedNumber(DocumentKind kind) {
    return Optional.ofNullable(switch (kind) {
      case CARGO_MANIFEST -> manifestNumber;
      case IMPORT_DECLARATION -> declarationNumber;
      case UNIFIED_IMPORT_DECLARATION -> unifiedDeclarationNumber;
      case TERMINAL_CONTROL -> null;
    });
  }
}
