package br.com.maike.ledger.domain.document;

import java.util.Optional;

/**
 * Typed view of one observed document, one variant per document kind.
 *
 * <p>Variants are produced by exactly one mapping function per upstream origin: the key/value
 * {@code FieldExtractor} for live API and legacy cache payloads, and the JDBC source adapters for replicated
 * authoritative tables.</p>
 *
 * @since 0.1.0
 */
public sealed interface DocumentPayload
    permits CargoManifestPayload,
        ImportDeclarationPayload,
        UnifiedDeclarationPayload,
        TerminalControlPayload {

  /**
   * Returns the document number carried by the payload, if any.
   *
   * @return document number or {@code null}
   */
  String number();

  /**
   * Returns the document kind of this variant.
   *
   * @return kind
   */
  DocumentKind kind();

  /**
   * Returns the revision key carried by the payload.
   *
   * @return version, empty when the payload carries none
   */
  Optional<String> version();

  /**
   * Projects the payload onto the canonical field set, with defaults applied.
   *
   * @return canonical fields
   */
  CanonicalFields canonical();
}
