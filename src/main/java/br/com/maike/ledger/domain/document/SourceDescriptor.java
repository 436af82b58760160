package br.com.maike.ledger.domain.document;

import br.com.maike.ledger.validation.Strings;

/**
 * Provenance of an observation, persisted as {@code fonte_dados} and {@code api_endpoint}.
 *
 * @param tag data-source tag such as {@code SERPRO_DB} or {@code MIGRATION_2025}
 * @param endpoint endpoint or table descriptor; may be {@code null}
 * @since 0.1.0
 */
public record SourceDescriptor(String tag, String endpoint) {

  public SourceDescriptor {
    tag = Strings.requireNonBlank("tag", tag);
    endpoint = Strings.trimToNull(endpoint);
  }

  @Override
  public String toString() {
    return endpoint == null ? tag : tag + " (" + endpoint + ")";
  }
}
