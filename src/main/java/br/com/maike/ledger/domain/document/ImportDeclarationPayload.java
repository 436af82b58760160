package br.com.maike.ledger.domain.document;

import br.com.maike.ledger.validation.Strings;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Import declaration fields.
 *
 * @param number declaration number
 * @param retification retification number, the revision key of declarations
 * @param status declaration situation text
 * @param statusCode declaration situation code
 * @param channel parameterized selection channel
 * @param registrationDate registration date
 * @param situationDate date of the current situation
 * @param clearanceDate clearance date
 * @since 0.1.0
 */
public record ImportDeclarationPayload(
    String number,
    String retification,
    String status,
    String statusCode,
    String channel,
    LocalDateTime registrationDate,
    LocalDateTime situationDate,
    LocalDateTime clearanceDate) implements DocumentPayload {

  @Override
  public DocumentKind kind() {
    return DocumentKind.IMPORT_DECLARATION;
  }

  @Override
  public Optional<String> version() {
    return Optional.ofNullable(Strings.trimToNull(retification));
  }

  @Override
  public CanonicalFields canonical() {
    return new CanonicalFields(
        status, statusCode, channel, null, registrationDate, situationDate, clearanceDate).normalized();
  }
}
