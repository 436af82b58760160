package br.com.maike.ledger.infrastructure.cache;

import br.com.maike.ledger.application.port.LegacyPayloadCache;
import br.com.maike.ledger.application.port.StoreException;
import br.com.maike.ledger.domain.document.DocumentKind;
import br.com.maike.ledger.infrastructure.persistence.jdbc.JdbcRunner;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link LegacyPayloadCache} reading the per-kind payload tables of the local SQLite cache.
 *
 * @since 0.1.0
 */
public final class SqliteLegacyPayloadCache implements LegacyPayloadCache {
  private static final Map<DocumentKind, String> QUERIES = Map.of(
      DocumentKind.CARGO_MANIFEST,
      "SELECT json_completo, processo_referencia FROM ces_cache WHERE numero_ce = ?"
          + " ORDER BY atualizado_em DESC LIMIT 1",
      DocumentKind.IMPORT_DECLARATION,
      "SELECT json_completo, processo_referencia FROM dis_cache WHERE numero_di = ?"
          + " ORDER BY atualizado_em DESC LIMIT 1",
      DocumentKind.TERMINAL_CONTROL,
      "SELECT json_completo, processo_referencia FROM ccts_cache WHERE numero_cct = ?"
          + " ORDER BY atualizado_em DESC LIMIT 1",
      DocumentKind.UNIFIED_IMPORT_DECLARATION,
      "SELECT payload_completo, processo_referencia FROM duimps WHERE numero = ?"
          + " ORDER BY atualizado_em DESC LIMIT 1");

  private final JdbcRunner jdbc;

  /**
   * Creates the cache reader.
   *
   * @param jdbc connection runner of the local cache
   */
  public SqliteLegacyPayloadCache(JdbcRunner jdbc) {
    this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
  }

  @Override
  public Optional<CachedPayload> latest(DocumentKind kind, String number) throws StoreException {
    Objects.requireNonNull(kind, "kind");
    if (number == null || number.isBlank()) {
      return Optional.empty();
    }
    String sql = QUERIES.get(kind);
    return jdbc.run("cache.payload." + kind.code(), connection -> {
      try (PreparedStatement statement = jdbc.prepare(connection, sql)) {
        statement.setString(1, number.trim());
        try (ResultSet rs = statement.executeQuery()) {
          if (!rs.next()) {
            return Optional.<CachedPayload>empty();
          }
          CachedPayload cached = new CachedPayload(rs.getString(1), rs.getString(2));
          return cached.json() == null && cached.processReference() == null
              ? Optional.<CachedPayload>empty() : Optional.of(cached);
        }
      }
    });
  }
}
