package br.com.maike.ledger.infrastructure.persistence.jdbc;

import br.com.maike.ledger.application.port.ClockPort;
import br.com.maike.ledger.application.port.FinancialStore;
import br.com.maike.ledger.application.port.StoreException;
import br.com.maike.ledger.domain.document.DocumentKind;
import br.com.maike.ledger.domain.process.MerchandiseValue;
import br.com.maike.ledger.domain.process.TaxPayment;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * <strong>What:</strong> {@link FinancialStore} over {@code VALOR_MERCADORIA} and {@code IMPOSTO_IMPORTACAO}.
 * <p><strong>Contract:</strong> inserts rely on the natural-key unique indexes; a duplicate surfaces as
 * {@link StoreException.Kind#CONFLICT} and the caller decides whether to refresh. Refreshes address rows by the
 * same natural key.</p>
 * <ul>
 *   <li>Values: process, declaration, {@code 'DI'}, value type, currency.</li>
 *   <li>Taxes: process, declaration, {@code 'DI'}, tax type, retification (null-safe).</li>
 * </ul>
 *
 * @since 0.1.0
 */
public final class JdbcFinancialStore implements FinancialStore {
  static final String VALUE_TABLE = "VALOR_MERCADORIA";
  static final String TAX_TABLE = "IMPOSTO_IMPORTACAO";
  private static final String DOCUMENT_TYPE = DocumentKind.IMPORT_DECLARATION.code();

  private final JdbcRunner jdbc;
  private final ClockPort clock;
  private final String valueTable;
  private final String taxTable;

  /**
   * Creates the store.
   *
   * @param jdbc connection runner of the ledger database
   * @param schema validated schema qualifier, blank for none
   * @param clock source of row timestamps
   */
  public JdbcFinancialStore(JdbcRunner jdbc, String schema, ClockPort clock) {
    this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.valueTable = JdbcRunner.qualify(schema, VALUE_TABLE);
    this.taxTable = JdbcRunner.qualify(schema, TAX_TABLE);
  }

  @Override
  public void insertValue(MerchandiseValue value, String sourceTag) throws StoreException {
    Objects.requireNonNull(value, "value");
    String sql = "INSERT INTO " + valueTable + " (processo_referencia, numero_documento, tipo_documento, tipo_valor,"
        + " moeda, valor, data_valor, fonte_dados, criado_em, atualizado_em)"
        + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
    LocalDateTime now = clock.now();
    jdbc.run("financial.insertValue", connection -> {
      try (PreparedStatement statement = jdbc.prepare(connection, sql)) {
        statement.setString(1, value.processReference());
        statement.setString(2, value.declarationNumber());
        statement.setString(3, DOCUMENT_TYPE);
        statement.setString(4, value.type().name());
        statement.setString(5, value.currency().name());
        statement.setBigDecimal(6, value.amount());
        JdbcRunner.setTimestamp(statement, 7, now);
        statement.setString(8, sourceTag);
        JdbcRunner.setTimestamp(statement, 9, now);
        JdbcRunner.setTimestamp(statement, 10, now);
        return statement.executeUpdate();
      }
    });
  }

  @Override
  public void refreshValue(MerchandiseValue value, String sourceTag) throws StoreException {
    Objects.requireNonNull(value, "value");
    String sql = "UPDATE " + valueTable + " SET valor = ?, data_valor = ?, fonte_dados = ?, atualizado_em = ?"
        + " WHERE processo_referencia = ? AND numero_documento = ? AND tipo_documento = ?"
        + " AND tipo_valor = ? AND moeda = ?";
    LocalDateTime now = clock.now();
    jdbc.run("financial.refreshValue", connection -> {
      try (PreparedStatement statement = jdbc.prepare(connection, sql)) {
        statement.setBigDecimal(1, value.amount());
        JdbcRunner.setTimestamp(statement, 2, now);
        statement.setString(3, sourceTag);
        JdbcRunner.setTimestamp(statement, 4, now);
        statement.setString(5, value.processReference());
        statement.setString(6, value.declarationNumber());
        statement.setString(7, DOCUMENT_TYPE);
        statement.setString(8, value.type().name());
        statement.setString(9, value.currency().name());
        return statement.executeUpdate();
      }
    });
  }

  @Override
  public void insertTax(TaxPayment payment, String sourceTag, String rawPayload) throws StoreException {
    Objects.requireNonNull(payment, "payment");
    String sql = "INSERT INTO " + taxTable + " (processo_referencia, numero_documento, tipo_documento, tipo_imposto,"
        + " codigo_receita, descricao_imposto, valor_brl, data_pagamento, pago, numero_retificacao, fonte_dados,"
        + " json_dados_originais, criado_em, atualizado_em)"
        + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, 1, ?, ?, ?, ?, ?)";
    LocalDateTime now = clock.now();
    jdbc.run("financial.insertTax", connection -> {
      try (PreparedStatement statement = jdbc.prepare(connection, sql)) {
        statement.setString(1, payment.processReference());
        statement.setString(2, payment.declarationNumber());
        statement.setString(3, DOCUMENT_TYPE);
        statement.setString(4, payment.taxType().name());
        JdbcRunner.setString(statement, 5, payment.receiptCode());
        JdbcRunner.setString(statement, 6, payment.description());
        statement.setBigDecimal(7, payment.amountBrl());
        JdbcRunner.setTimestamp(statement, 8, payment.paidAt());
        setRetification(statement, 9, payment.retification());
        statement.setString(10, sourceTag);
        JdbcRunner.setString(statement, 11, rawPayload);
        JdbcRunner.setTimestamp(statement, 12, now);
        JdbcRunner.setTimestamp(statement, 13, now);
        return statement.executeUpdate();
      }
    });
  }

  @Override
  public void refreshTax(TaxPayment payment, String sourceTag, String rawPayload) throws StoreException {
    Objects.requireNonNull(payment, "payment");
    String retificationClause = payment.retification() == null
        ? "numero_retificacao IS NULL" : "numero_retificacao = ?";
    String sql = "UPDATE " + taxTable + " SET codigo_receita = COALESCE(?, codigo_receita),"
        + " descricao_imposto = COALESCE(?, descricao_imposto), valor_brl = ?,"
        + " data_pagamento = COALESCE(?, data_pagamento), fonte_dados = ?,"
        + " json_dados_originais = COALESCE(?, json_dados_originais), atualizado_em = ?"
        + " WHERE processo_referencia = ? AND numero_documento = ? AND tipo_documento = ? AND tipo_imposto = ?"
        + " AND " + retificationClause;
    LocalDateTime now = clock.now();
    jdbc.run("financial.refreshTax", connection -> {
      try (PreparedStatement statement = jdbc.prepare(connection, sql)) {
        JdbcRunner.setString(statement, 1, payment.receiptCode());
        JdbcRunner.setString(statement, 2, payment.description());
        statement.setBigDecimal(3, payment.amountBrl());
        JdbcRunner.setTimestamp(statement, 4, payment.paidAt());
        statement.setString(5, sourceTag);
        JdbcRunner.setString(statement, 6, rawPayload);
        JdbcRunner.setTimestamp(statement, 7, now);
        statement.setString(8, payment.processReference());
        statement.setString(9, payment.declarationNumber());
        statement.setString(10, DOCUMENT_TYPE);
        statement.setString(11, payment.taxType().name());
        if (payment.retification() != null) {
          statement.setInt(12, payment.retification());
        }
        return statement.executeUpdate();
      }
    });
  }

  private static void setRetification(PreparedStatement statement, int index, Integer retification)
      throws SQLException {
    if (retification == null) {
      statement.setNull(index, Types.INTEGER);
    } else {
      statement.setInt(index, retification);
    }
  }
}
