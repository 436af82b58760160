package br.com.maike.ledger.domain.document;

import br.com.maike.ledger.validation.Strings;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Unified import declaration fields. Unified declarations carry no clearance date of their own.
 *
 * @param number unified declaration number
 * @param explicitVersion declaration version
 * @param status latest situation text
 * @param statusCode situation code
 * @param channel consolidated channel
 * @param registrationDate registration date
 * @param situationDate date of the latest situation
 * @since 0.1.0
 */
public record UnifiedDeclarationPayload(
    String number,
    String explicitVersion,
    String status,
    String statusCode,
    String channel,
    LocalDateTime registrationDate,
    LocalDateTime situationDate) implements DocumentPayload {

  @Override
  public DocumentKind kind() {
    return DocumentKind.UNIFIED_IMPORT_DECLARATION;
  }

  @Override
  public Optional<String> version() {
    return Optional.ofNullable(Strings.trimToNull(explicitVersion));
  }

  @Override
  public CanonicalFields canonical() {
    return new CanonicalFields(
        status, statusCode, channel, null, registrationDate, situationDate, null).normalized();
  }
}
