package br.com.maike.ledger.domain.document;

/**
 * Kinds of field-level change recorded in the history table.
 *
 * <p>The storage codes are the values external readers of {@code HISTORICO_DOCUMENTO_ADUANEIRO} filter on.</p>
 *
 * @since 0.1.0
 */
public enum ChangeEventKind {
  /** Status text changed. */
  STATUS_CHANGE("MUDANCA_STATUS", "Status change"),
  /** Customs channel changed. */
  CHANNEL_CHANGE("MUDANCA_CANAL", "Channel change"),
  /** One of the tracked dates changed. */
  DATE_CHANGE("MUDANCA_DATA", "Date change");

  private final String storageCode;
  private final String label;

  ChangeEventKind(String storageCode, String label) {
    this.storageCode = storageCode;
    this.label = label;
  }

  /**
   * Returns the value persisted in {@code tipo_evento}.
   *
   * @return storage code
   */
  public String storageCode() {
    return storageCode;
  }

  /**
   * Returns the human-readable label persisted in {@code tipo_evento_descricao}.
   *
   * @return label
   */
  public String label() {
    return label;
  }
}
