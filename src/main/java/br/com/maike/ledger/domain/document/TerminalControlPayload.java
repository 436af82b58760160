package br.com.maike.ledger.domain.document;

import br.com.maike.ledger.validation.Strings;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Terminal-control document fields.
 *
 * @param number terminal-control number
 * @param explicitVersion explicit version, usually absent
 * @param status current situation text
 * @param statusCode current situation code
 * @param situationDate date of the current situation
 * @param actualArrivalDate effective arrival date; kept in the raw payload, not a canonical field
 * @since 0.1.0
 */
public record TerminalControlPayload(
    String number,
    String explicitVersion,
    String status,
    String statusCode,
    LocalDateTime situationDate,
    LocalDateTime actualArrivalDate) implements DocumentPayload {

  @Override
  public DocumentKind kind() {
    return DocumentKind.TERMINAL_CONTROL;
  }

  @Override
  public Optional<String> version() {
    return Optional.ofNullable(Strings.trimToNull(explicitVersion));
  }

  @Override
  public CanonicalFields canonical() {
    return new CanonicalFields(status, statusCode, null, null, null, situationDate, null).normalized();
  }
}
