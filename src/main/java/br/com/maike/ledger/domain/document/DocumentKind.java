package br.com.maike.ledger.domain.document;

import java.util.Locale;

/**
 * Customs document kinds tracked by the ledger, with the short code stored in {@code tipo_documento}.
 *
 * @since 0.1.0
 */
public enum DocumentKind {
  /** Cargo manifest (CE). */
  CARGO_MANIFEST("CE"),
  /** Import declaration (DI); the only kind that is re-certified through retifications. */
  IMPORT_DECLARATION("DI"),
  /** Unified import declaration (DUIMP). */
  UNIFIED_IMPORT_DECLARATION("DUIMP"),
  /** Terminal-control document (CCT). */
  TERMINAL_CONTROL("CCT");

  private final String code;

  DocumentKind(String code) {
    this.code = code;
  }

  /**
   * Returns the short code persisted in storage and accepted on the command line.
   *
   * @return document code such as {@code DI}
   */
  public String code() {
    return code;
  }

  /**
   * Indicates whether documents of this kind carry a meaningful revision number.
   *
   * @return {@code true} for import declarations
   */
  public boolean supportsRevisions() {
    return this == IMPORT_DECLARATION;
  }

  /**
   * Resolves a kind from its short code or enum name, case-insensitively.
   *
   * @param raw code such as {@code ce}, {@code DUIMP} or {@code CARGO_MANIFEST}
   * @return matching kind
   * @throws IllegalArgumentException when the value is blank or unknown
   */
  public static DocumentKind fromCode(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("document kind must not be blank");
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT);
    for (DocumentKind kind : values()) {
      if (kind.code.equals(normalized) || kind.name().equals(normalized)) {
        return kind;
      }
    }
    throw new IllegalArgumentException("unknown document kind: " + raw);
  }
}
