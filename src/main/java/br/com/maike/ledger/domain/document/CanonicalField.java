package br.com.maike.ledger.domain.document;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Canonical snapshot fields, their storage columns and, for compared fields, the event they raise.
 *
 * <p>Declaration order of the compared fields is the order in which changes are detected and appended.</p>
 *
 * @since 0.1.0
 */
public enum CanonicalField {
  STATUS("status", "status_documento", ChangeEventKind.STATUS_CHANGE),
  STATUS_CODE("status_code", "status_documento_codigo", null),
  CHANNEL("channel", "canal_documento", ChangeEventKind.CHANNEL_CHANGE),
  SITUATION("situation", "situacao_documento", null),
  REGISTRATION_DATE("registration_date", "data_registro", ChangeEventKind.DATE_CHANGE),
  SITUATION_DATE("situation_date", "data_situacao", ChangeEventKind.DATE_CHANGE),
  CLEARANCE_DATE("clearance_date", "data_desembaraco", ChangeEventKind.DATE_CHANGE);

  private static final List<CanonicalField> COMPARED = Arrays.stream(values())
      .filter(field -> field.eventKind != null)
      .toList();

  private final String fieldName;
  private final String column;
  private final ChangeEventKind eventKind;

  CanonicalField(String fieldName, String column, ChangeEventKind eventKind) {
    this.fieldName = fieldName;
    this.column = column;
    this.eventKind = eventKind;
  }

  /**
   * Returns the canonical field name recorded in {@code campo_alterado}.
   *
   * @return field name such as {@code status}
   */
  public String fieldName() {
    return fieldName;
  }

  /**
   * Returns the snapshot column backing this field.
   *
   * @return column name
   */
  public String column() {
    return column;
  }

  /**
   * Returns the event raised when this field changes.
   *
   * @return event kind; empty for fields that are stored but never compared
   */
  public Optional<ChangeEventKind> eventKind() {
    return Optional.ofNullable(eventKind);
  }

  /**
   * Returns the fixed comparison list: status, channel, then the three dates.
   *
   * @return immutable ordered list of compared fields
   */
  public static List<CanonicalField> compared() {
    return COMPARED;
  }
}
