package br.com.maike.ledger.infrastructure.source;

import br.com.maike.ledger.application.port.AuthoritativeDocumentSource;
import br.com.maike.ledger.application.port.StoreException;
import br.com.maike.ledger.domain.document.DocumentKind;
import br.com.maike.ledger.domain.document.SourceDescriptor;
import br.com.maike.ledger.domain.document.UnifiedDeclarationPayload;
import br.com.maike.ledger.infrastructure.persistence.jdbc.JdbcRunner;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds minimal unified declaration payloads from the unified declaration database.
 *
 * <p>Rows match either the document number or the process number; the most recent event wins.</p>
 *
 * @since 0.1.0
 */
public final class DuimpDocumentSource implements AuthoritativeDocumentSource {
  /** Source tag of payloads read from the unified declaration database. */
  public static final String SOURCE_TAG = "DUIMP_DB";

  static final SourceDescriptor SOURCE = new SourceDescriptor(SOURCE_TAG, "Duimp.duimp + joins");

  private final JdbcRunner jdbc;
  private final String sql;

  /**
   * Creates the source.
   *
   * @param jdbc connection runner reaching the unified declaration database
   * @param duimpSchema qualifier of the unified declaration tables
   */
  public DuimpDocumentSource(JdbcRunner jdbc, String duimpSchema) {
    this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
    this.sql = "SELECT d.numero, d.versao, d.data_registro, d.ultima_situacao, d.data_ultimo_evento,"
        + " drar.canal_consolidado"
        + " FROM " + JdbcRunner.qualify(duimpSchema, "duimp") + " d"
        + " LEFT JOIN " + JdbcRunner.qualify(duimpSchema, "duimp_resultado_analise_risco") + " drar"
        + " ON drar.duimp_id = d.duimp_id"
        + " WHERE d.numero = ? OR d.numero_processo = ?"
        + " ORDER BY d.data_ultimo_evento DESC";
  }

  @Override
  public boolean supports(DocumentKind kind) {
    return kind == DocumentKind.UNIFIED_IMPORT_DECLARATION;
  }

  @Override
  public Optional<SourcedPayload> fetch(DocumentKind kind, String number, String processReference)
      throws StoreException {
    if (!supports(kind) || number == null || number.isBlank()) {
      return Optional.empty();
    }
    String requested = number.trim();
    return jdbc.run("duimp.fetch", connection -> {
      try (PreparedStatement statement = jdbc.prepare(connection, sql)) {
        statement.setMaxRows(1);
        statement.setString(1, requested);
        JdbcRunner.setString(statement, 2, processReference);
        try (ResultSet rs = statement.executeQuery()) {
          return rs.next() ? Optional.of(map(rs, requested)) : Optional.<SourcedPayload>empty();
        }
      }
    });
  }

  private static SourcedPayload map(ResultSet rs, String requested) throws SQLException {
    String number = Optional.ofNullable(SourceRows.text(rs, "numero")).orElse(requested);
    String version = SourceRows.version(rs, "versao");
    LocalDateTime registrationDate = SourceRows.time(rs, "data_registro");
    String status = SourceRows.text(rs, "ultima_situacao");
    LocalDateTime situationDate = SourceRows.time(rs, "data_ultimo_evento");
    String channel = SourceRows.text(rs, "canal_consolidado");

    UnifiedDeclarationPayload payload = new UnifiedDeclarationPayload(
        number, version, status, status, channel, registrationDate, situationDate);

    Map<String, Object> raw = new LinkedHashMap<>();
    raw.put("numero", number);
    SourceRows.put(raw, "versaoDocumento", version);
    SourceRows.put(raw, "situacao", status);
    SourceRows.put(raw, "situacaoCodigo", status);
    SourceRows.put(raw, "ultimaSituacao", status);
    SourceRows.put(raw, "ultimaSituacaoData", situationDate);
    SourceRows.put(raw, "dataRegistro", registrationDate);
    SourceRows.put(raw, "canalConsolidado", channel);
    SourceRows.put(raw, "canal", channel);
    return new SourcedPayload(payload, raw, SOURCE);
  }
}
