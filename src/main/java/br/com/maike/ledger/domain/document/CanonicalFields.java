package br.com.maike.ledger.domain.document;

import br.com.maike.ledger.validation.Strings;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Fixed canonical field set shared by every document kind.
 *
 * <p>All components are optional and may be {@code null}. Text values are trimmed and blank text is
 * stored as {@code null}.</p>
 *
 * @param status status text
 * @param statusCode status code; approximated by the status text when the source carries no code
 * @param channel customs risk-selection channel
 * @param situation situation text; defaults to the status text
 * @param registrationDate registration date
 * @param situationDate date of the current situation
 * @param clearanceDate clearance date
 * @since 0.1.0
 */
public record CanonicalFields(
    String status,
    String statusCode,
    String channel,
    String situation,
    LocalDateTime registrationDate,
    LocalDateTime situationDate,
    LocalDateTime clearanceDate) {

  /** Field set with every component absent. */
  public static final CanonicalFields EMPTY =
      new CanonicalFields(null, null, null, null, null, null, null);

  /**
   * Trims text components.
   */
  public CanonicalFields {
    status = Strings.trimToNull(status);
    statusCode = Strings.trimToNull(statusCode);
    channel = Strings.trimToNull(channel);
    situation = Strings.trimToNull(situation);
  }

  /**
   * Applies the documented defaults: situation falls back to status, status code falls back to status.
   *
   * @return normalized copy
   */
  public CanonicalFields normalized() {
    return new CanonicalFields(
        status,
        statusCode != null ? statusCode : status,
        channel,
        situation != null ? situation : status,
        registrationDate,
        situationDate,
        clearanceDate);
  }

  /**
   * Returns the raw value of one field.
   *
   * @param field field to read
   * @return text, date or {@code null}
   */
  public Object value(CanonicalField field) {
    Objects.requireNonNull(field, "field");
    return switch (field) {
      case STATUS -> status;
      case STATUS_CODE -> statusCode;
      case CHANNEL -> channel;
      case SITUATION -> situation;
      case REGISTRATION_DATE -> registrationDate;
      case SITUATION_DATE -> situationDate;
      case CLEARANCE_DATE -> clearanceDate;
    };
  }

  /**
   * Returns the stringified value used for change comparison and history rows.
   *
   * @param field field to render
   * @return comparable text or {@code null} when absent
   */
  public String render(CanonicalField field) {
    Object value = value(field);
    if (value instanceof LocalDateTime date) {
      return DateValues.render(date);
    }
    return value == null ? null : value.toString();
  }

  /**
   * Indicates whether a field is absent.
   *
   * @param field field to check
   * @return {@code true} when the value is {@code null}
   */
  public boolean isMissing(CanonicalField field) {
    return value(field) == null;
  }

  /**
   * Returns a copy where every absent component is taken from {@code other}.
   *
   * @param other fallback values; must not be {@code null}
   * @return merged copy; present values in this instance always win
   */
  public CanonicalFields fillMissingFrom(CanonicalFields other) {
    Objects.requireNonNull(other, "other");
    return new CanonicalFields(
        status != null ? status : other.status,
        statusCode != null ? statusCode : other.statusCode,
        channel != null ? channel : other.channel,
        situation != null ? situation : other.situation,
        registrationDate != null ? registrationDate : other.registrationDate,
        situationDate != null ? situationDate : other.situationDate,
        clearanceDate != null ? clearanceDate : other.clearanceDate);
  }
}
