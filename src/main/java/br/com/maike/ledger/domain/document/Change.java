package br.com.maike.ledger.domain.document;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * One detected field-level difference between the stored snapshot and a new observation.
 *
 * @param eventKind event raised by the field
 * @param field changed field
 * @param previousValue stringified stored value, {@code null} when nothing was stored
 * @param newValue stringified observed value, never {@code null}
 * @param detectedAt detection time
 * @since 0.1.0
 */
public record Change(
    ChangeEventKind eventKind,
    CanonicalField field,
    String previousValue,
    String newValue,
    LocalDateTime detectedAt) {

  public Change {
    Objects.requireNonNull(eventKind, "eventKind");
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(newValue, "newValue");
    Objects.requireNonNull(detectedAt, "detectedAt");
  }

  /**
   * Builds the human-readable description stored with the history row.
   *
   * @return text such as {@code status changed from 'UNLOADED' to 'LINKED'}
   */
  public String description() {
    return field.fieldName() + " changed from '" + (previousValue == null ? "" : previousValue)
        + "' to '" + newValue + "'";
  }
}
