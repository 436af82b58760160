package br.com.maike.ledger.domain.document;

import br.com.maike.ledger.validation.Strings;
import java.util.Objects;
import java.util.Optional;

/**
 * Composite natural key of one customs record.
 *
 * @param number document number as issued by customs; trimmed, never blank
 * @param kind document kind
 * @param version revision key, or {@code null} when the document carries none
 * @since 0.1.0
 */
public record DocumentIdentity(String number, DocumentKind kind, String version) {

  /**
   * Normalizes number and version; blank versions collapse to {@code null}.
   *
   * @throws IllegalArgumentException if {@code number} is blank
   */
  public DocumentIdentity {
    number = Strings.requireNonBlank("number", number);
    kind = Objects.requireNonNull(kind, "kind");
    version = Strings.trimToNull(version);
  }

  /**
   * Creates an identity without a version.
   *
   * @param number document number
   * @param kind document kind
   * @return unversioned identity
   */
  public static DocumentIdentity of(String number, DocumentKind kind) {
    return new DocumentIdentity(number, kind, null);
  }

  /**
   * Returns the version as an optional.
   *
   * @return version, empty when absent
   */
  public Optional<String> versionValue() {
    return Optional.ofNullable(version);
  }

  @Override
  public String toString() {
    return kind.code() + ":" + number + (version == null ? "" : "@" + version);
  }
}
