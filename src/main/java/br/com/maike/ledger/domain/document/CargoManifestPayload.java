package br.com.maike.ledger.domain.document;

import br.com.maike.ledger.validation.Strings;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Cargo manifest fields. Manifests carry no channel.
 *
 * @param number manifest number
 * @param explicitVersion explicit version, usually absent
 * @param status cargo situation text
 * @param statusCode cargo situation code
 * @param registrationDate registration or emission date
 * @param situationDate date of the cargo situation
 * @param clearanceDate clearance date
 * @since 0.1.0
 */
public record CargoManifestPayload(
    String number,
    String explicitVersion,
    String status,
    String statusCode,
    LocalDateTime registrationDate,
    LocalDateTime situationDate,
    LocalDateTime clearanceDate) implements DocumentPayload {

  @Override
  public DocumentKind kind() {
    return DocumentKind.CARGO_MANIFEST;
  }

  @Override
  public Optional<String> version() {
    return Optional.ofNullable(Strings.trimToNull(explicitVersion));
  }

  @Override
  public CanonicalFields canonical() {
    return new CanonicalFields(
        status, statusCode, null, null, registrationDate, situationDate, clearanceDate).normalized();
  }
}
