package br.com.maike.ledger.infrastructure.source;

import br.com.maike.ledger.application.port.DocumentNumberLocator;
import br.com.maike.ledger.application.port.StoreException;
import br.com.maike.ledger.domain.document.DocumentKind;
import br.com.maike.ledger.domain.process.ProcessRecord;
import br.com.maike.ledger.infrastructure.persistence.jdbc.JdbcRunner;
import br.com.maike.ledger.validation.Strings;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.Objects;
import java.util.Optional;

/**
 * Finds manifest and declaration numbers in the replicated consultation tables by import id.
 *
 * <p>Active consultations are preferred, then the most recent one.</p>
 *
 * @since 0.1.0
 */
public final class SerproNumberLocator implements DocumentNumberLocator {
  private final JdbcRunner jdbc;
  private final String manifestSql;
  private final String declarationSql;

  /**
   * Creates the locator.
   *
   * @param jdbc connection runner reaching the replicated tables
   * @param serproSchema qualifier of the replicated tables
   */
  public SerproNumberLocator(JdbcRunner jdbc, String serproSchema) {
    this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
    this.manifestSql = "SELECT ce FROM " + JdbcRunner.qualify(serproSchema, "Ce_Consulta")
        + " WHERE idImportacao = ? ORDER BY CASE WHEN active = 1 THEN 0 ELSE 1 END, id DESC";
    this.declarationSql = "SELECT di FROM " + JdbcRunner.qualify(serproSchema, "Di_Consulta")
        + " WHERE idImportacao = ? ORDER BY CASE WHEN active = 1 THEN 0 ELSE 1 END, id DESC";
  }

  @Override
  public String name() {
    return "serpro-consulta";
  }

  @Override
  public boolean supports(DocumentKind kind) {
    return kind == DocumentKind.CARGO_MANIFEST || kind == DocumentKind.IMPORT_DECLARATION;
  }

  @Override
  public Optional<String> locate(ProcessRecord process, DocumentKind kind) throws StoreException {
    Objects.requireNonNull(process, "process");
    if (!supports(kind) || process.importId() == null) {
      return Optional.empty();
    }
    String sql = kind == DocumentKind.CARGO_MANIFEST ? manifestSql : declarationSql;
    long importId = process.importId();
    return jdbc.run("serpro.locate." + kind.code(), connection -> {
      try (PreparedStatement statement = jdbc.prepare(connection, sql)) {
        statement.setMaxRows(1);
        statement.setLong(1, importId);
        try (ResultSet rs = statement.executeQuery()) {
          return rs.next() ? Optional.ofNullable(Strings.trimToNull(rs.getString(1))) : Optional.<String>empty();
        }
      }
    });
  }
}
