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
 * Finds the unified declaration number of a process in the unified declaration database.
 *
 * @since 0.1.0
 */
public final class DuimpNumberLocator implements DocumentNumberLocator {
  private final JdbcRunner jdbc;
  private final String sql;

  /**
   * Creates the locator.
   *
   * @param jdbc connection runner reaching the unified declaration database
   * @param duimpSchema qualifier of the unified declaration tables
   */
  public DuimpNumberLocator(JdbcRunner jdbc, String duimpSchema) {
    this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
    this.sql = "SELECT numero FROM " + JdbcRunner.qualify(duimpSchema, "duimp")
        + " WHERE numero_processo = ? ORDER BY data_ultimo_evento DESC, atualizado_em DESC";
  }

  @Override
  public String name() {
    return "duimp-processo";
  }

  @Override
  public boolean supports(DocumentKind kind) {
    return kind == DocumentKind.UNIFIED_IMPORT_DECLARATION;
  }

  @Override
  public Optional<String> locate(ProcessRecord process, DocumentKind kind) throws StoreException {
    Objects.requireNonNull(process, "process");
    if (!supports(kind)) {
      return Optional.empty();
    }
    return jdbc.run("duimp.locate", connection -> {
      try (PreparedStatement statement = jdbc.prepare(connection, sql)) {
        statement.setMaxRows(1);
        statement.setString(1, process.reference());
        try (ResultSet rs = statement.executeQuery()) {
          return rs.next() ? Optional.ofNullable(Strings.trimToNull(rs.getString(1))) : Optional.<String>empty();
        }
      }
    });
  }
}
