package br.com.maike.ledger.infrastructure.source;

import br.com.maike.ledger.application.port.AuthoritativeDocumentSource;
import br.com.maike.ledger.application.port.StoreException;
import br.com.maike.ledger.domain.document.CargoManifestPayload;
import br.com.maike.ledger.domain.document.DocumentKind;
import br.com.maike.ledger.domain.document.ImportDeclarationPayload;
import br.com.maike.ledger.domain.document.SourceDescriptor;
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
 * <strong>What:</strong> Builds minimal cargo manifest and import declaration payloads from the replicated
 * authoritative tables.
 * <p><strong>Contract:</strong> the newest replicated row wins. Typed payloads are filled column by column; the raw
 * payload keeps the upstream key names so later gap-fill passes can re-extract it.</p>
 *
 * @since 0.1.0
 */
public final class SerproDocumentSource implements AuthoritativeDocumentSource {
  /** Source tag of payloads read from the replicated tables. */
  public static final String SOURCE_TAG = "SERPRO_DB";

  static final SourceDescriptor MANIFEST_SOURCE =
      new SourceDescriptor(SOURCE_TAG, "Serpro.Ce_Root_Conhecimento_Embarque");
  static final SourceDescriptor DECLARATION_SOURCE =
      new SourceDescriptor(SOURCE_TAG, "Serpro.Di_Dados_Gerais + Di_Dados_Despacho");

  private final JdbcRunner jdbc;
  private final String manifestSql;
  private final String declarationSql;

  /**
   * Creates the source.
   *
   * @param jdbc connection runner reaching the replicated tables
   * @param serproSchema qualifier of the replicated tables
   */
  public SerproDocumentSource(JdbcRunner jdbc, String serproSchema) {
    this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
    this.manifestSql = "SELECT numero, situacaoCarga, dataSituacaoCarga, dataEmissao, dataDestinoFinal,"
        + " navioPrimTransporte, portoOrigem, portoDestino, paisProcedencia"
        + " FROM " + JdbcRunner.qualify(serproSchema, "Ce_Root_Conhecimento_Embarque")
        + " WHERE numero = ? ORDER BY updatedAt DESC";
    this.declarationSql = "SELECT ddg.numeroDi, ddg.situacaoDi, ddg.dataHoraSituacaoDi, ddg.situacaoEntregaCarga,"
        + " ddg.sequencialRetificacao, diDesp.canalSelecaoParametrizada, diDesp.dataHoraRegistro,"
        + " diDesp.dataHoraDesembaraco"
        + " FROM " + JdbcRunner.qualify(serproSchema, "Di_Dados_Gerais") + " ddg"
        + " JOIN " + JdbcRunner.qualify(serproSchema, "Di_Root_Declaracao_Importacao") + " diRoot"
        + " ON ddg.dadosGeraisId = diRoot.dadosGeraisId"
        + " LEFT JOIN " + JdbcRunner.qualify(serproSchema, "Di_Dados_Despacho") + " diDesp"
        + " ON diRoot.dadosDespachoId = diDesp.dadosDespachoId"
        + " WHERE ddg.numeroDi = ? ORDER BY ddg.updatedAt DESC";
  }

  @Override
  public boolean supports(DocumentKind kind) {
    return kind == DocumentKind.CARGO_MANIFEST || kind == DocumentKind.IMPORT_DECLARATION;
  }

  @Override
  public Optional<SourcedPayload> fetch(DocumentKind kind, String number, String processReference)
      throws StoreException {
    Objects.requireNonNull(kind, "kind");
    if (number == null || number.isBlank()) {
      return Optional.empty();
    }
    return switch (kind) {
      case CARGO_MANIFEST -> fetchManifest(number.trim());
      case IMPORT_DECLARATION -> fetchDeclaration(number.trim());
      default -> Optional.empty();
    };
  }

  private Optional<SourcedPayload> fetchManifest(String number) throws StoreException {
    return jdbc.run("serpro.manifest.fetch", connection -> {
      try (PreparedStatement statement = jdbc.prepare(connection, manifestSql)) {
        statement.setMaxRows(1);
        statement.setString(1, number);
        try (ResultSet rs = statement.executeQuery()) {
          return rs.next() ? Optional.of(mapManifest(rs, number)) : Optional.<SourcedPayload>empty();
        }
      }
    });
  }

  private Optional<SourcedPayload> fetchDeclaration(String number) throws StoreException {
    return jdbc.run("serpro.declaration.fetch", connection -> {
      try (PreparedStatement statement = jdbc.prepare(connection, declarationSql)) {
        statement.setMaxRows(1);
        statement.setString(1, number);
        try (ResultSet rs = statement.executeQuery()) {
          return rs.next() ? Optional.of(mapDeclaration(rs, number)) : Optional.<SourcedPayload>empty();
        }
      }
    });
  }

  private static SourcedPayload mapManifest(ResultSet rs, String requested) throws SQLException {
    String number = Optional.ofNullable(SourceRows.text(rs, "numero")).orElse(requested);
    String status = SourceRows.text(rs, "situacaoCarga");
    LocalDateTime situationDate = SourceRows.time(rs, "dataSituacaoCarga");
    LocalDateTime issueDate = SourceRows.time(rs, "dataEmissao");

    CargoManifestPayload payload = new CargoManifestPayload(
        number, null, status, null, issueDate, situationDate, null);

    Map<String, Object> raw = new LinkedHashMap<>();
    raw.put("numero", number);
    SourceRows.put(raw, "situacaoCarga", status);
    SourceRows.put(raw, "dataSituacaoCarga", situationDate);
    SourceRows.put(raw, "dataRegistro", issueDate);
    SourceRows.put(raw, "dataDestinoFinal", SourceRows.time(rs, "dataDestinoFinal"));
    SourceRows.put(raw, "navioPrimTransporte", SourceRows.text(rs, "navioPrimTransporte"));
    SourceRows.put(raw, "portoOrigem", SourceRows.text(rs, "portoOrigem"));
    SourceRows.put(raw, "portoDestino", SourceRows.text(rs, "portoDestino"));
    SourceRows.put(raw, "paisProcedencia", SourceRows.text(rs, "paisProcedencia"));
    return new SourcedPayload(payload, raw, MANIFEST_SOURCE);
  }

  private static SourcedPayload mapDeclaration(ResultSet rs, String requested) throws SQLException {
    String number = Optional.ofNullable(SourceRows.text(rs, "numeroDi")).orElse(requested);
    String status = SourceRows.text(rs, "situacaoDi");
    LocalDateTime situationDate = SourceRows.time(rs, "dataHoraSituacaoDi");
    String retification = SourceRows.version(rs, "sequencialRetificacao");
    String channel = SourceRows.text(rs, "canalSelecaoParametrizada");
    LocalDateTime registrationDate = SourceRows.time(rs, "dataHoraRegistro");
    LocalDateTime clearanceDate = SourceRows.time(rs, "dataHoraDesembaraco");

    ImportDeclarationPayload payload = new ImportDeclarationPayload(
        number, retification, status, null, channel, registrationDate, situationDate, clearanceDate);

    Map<String, Object> raw = new LinkedHashMap<>();
    raw.put("numero", number);
    SourceRows.put(raw, "situacaoDi", status);
    SourceRows.put(raw, "dataHoraSituacaoDi", situationDate);
    SourceRows.put(raw, "situacaoEntregaCarga", SourceRows.text(rs, "situacaoEntregaCarga"));
    SourceRows.put(raw, "numeroRetificacao", retification);
    SourceRows.put(raw, "canalSelecaoParametrizada", channel);
    SourceRows.put(raw, "dataHoraRegistro", registrationDate);
    SourceRows.put(raw, "dataHoraDesembaraco", clearanceDate);
    return new SourcedPayload(payload, raw, DECLARATION_SOURCE);
  }
}
