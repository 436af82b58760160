package br.com.maike.ledger.infrastructure.source;

import br.com.maike.ledger.application.port.DeclarationFinancialsSource;
import br.com.maike.ledger.application.port.StoreException;
import br.com.maike.ledger.domain.process.Currency;
import br.com.maike.ledger.domain.process.DeclarationFinancials;
import br.com.maike.ledger.domain.process.MerchandiseValue;
import br.com.maike.ledger.domain.process.TaxPayment;
import br.com.maike.ledger.domain.process.TaxType;
import br.com.maike.ledger.domain.process.ValueType;
import br.com.maike.ledger.infrastructure.persistence.jdbc.JdbcRunner;
import br.com.maike.ledger.validation.Strings;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Reads merchandise values, freight, insurance and duty payments of an import declaration
 * from the replicated declaration tables.
 * <p><strong>Contract:</strong> only positive amounts become {@link MerchandiseValue}s; payments keep their receipt
 * code and description and are classified with {@link TaxType#fromReceipt}. A declaration unknown to the
 * replicated tables yields empty financials.</p>
 * <p><strong>Thread-safety:</strong> Thread-safe; all reads happen on one borrowed connection per call.</p>
 *
 * @since 0.1.0
 */
public final class SerproFinancialsSource implements DeclarationFinancialsSource {
  private final JdbcRunner jdbc;
  private final String valuesSql;
  private final String freightSql;
  private final String insuranceSql;
  private final String paymentsSql;

  /**
   * Creates the source.
   *
   * @param jdbc connection runner reaching the replicated tables
   * @param serproSchema qualifier of the replicated tables
   */
  public SerproFinancialsSource(JdbcRunner jdbc, String serproSchema) {
    this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
    this.valuesSql = "SELECT dvmd.totalDolares AS vmld_usd, dvmd.totalReais AS vmld_brl,"
        + " dvme.totalDolares AS vmle_usd, dvme.totalReais AS vmle_brl, diRoot.dadosDiId"
        + " FROM " + JdbcRunner.qualify(serproSchema, "Di_Dados_Gerais") + " ddg"
        + " JOIN " + JdbcRunner.qualify(serproSchema, "Di_Root_Declaracao_Importacao") + " diRoot"
        + " ON ddg.dadosGeraisId = diRoot.dadosGeraisId"
        + " LEFT JOIN " + JdbcRunner.qualify(serproSchema, "Di_Valor_Mercadoria_Descarga") + " dvmd"
        + " ON diRoot.valorMercadoriaDescargaId = dvmd.valorMercadoriaDescargaId"
        + " LEFT JOIN " + JdbcRunner.qualify(serproSchema, "Di_Valor_Mercadoria_Embarque") + " dvme"
        + " ON diRoot.valorMercadoriaEmbarqueId = dvme.valorMercadoriaEmbarqueId"
        + " WHERE ddg.numeroDi = ? ORDER BY ddg.updatedAt DESC";
    this.freightSql = "SELECT valorTotalDolares AS usd, totalReais AS brl FROM "
        + JdbcRunner.qualify(serproSchema, "Di_Frete") + " WHERE freteId = ?";
    this.insuranceSql = "SELECT valorTotalDolares AS usd, valorTotalReais AS brl FROM "
        + JdbcRunner.qualify(serproSchema, "Di_Seguro") + " WHERE seguroId = ?";
    this.paymentsSql = "SELECT dp.codigoReceita, dp.numeroRetificacao, dp.valorTotal, dp.dataPagamento,"
        + " dpcr.descricao_receita"
        + " FROM " + JdbcRunner.qualify(serproSchema, "Di_Pagamento") + " dp"
        + " LEFT JOIN " + JdbcRunner.qualify(serproSchema, "Di_pagamentos_cod_receitas") + " dpcr"
        + " ON dpcr.cod_receita = dp.codigoReceita"
        + " WHERE dp.rootDiId = ?";
  }

  @Override
  public DeclarationFinancials fetch(String processReference, String declarationNumber) throws StoreException {
    String process = Strings.requireNonBlank("processReference", processReference);
    String number = Strings.requireNonBlank("declarationNumber", declarationNumber);
    return jdbc.run("serpro.financials.fetch", connection -> {
      List<MerchandiseValue> values = new ArrayList<>();
      Long rootId;
      try (PreparedStatement statement = jdbc.prepare(connection, valuesSql)) {
        statement.setMaxRows(1);
        statement.setString(1, number);
        try (ResultSet rs = statement.executeQuery()) {
          if (!rs.next()) {
            return new DeclarationFinancials(List.of(), List.of());
          }
          addValue(values, process, number, ValueType.VMLD, Currency.USD, rs.getBigDecimal("vmld_usd"));
          addValue(values, process, number, ValueType.VMLD, Currency.BRL, rs.getBigDecimal("vmld_brl"));
          addValue(values, process, number, ValueType.VMLE, Currency.USD, rs.getBigDecimal("vmle_usd"));
          addValue(values, process, number, ValueType.VMLE, Currency.BRL, rs.getBigDecimal("vmle_brl"));
          rootId = SourceRows.longValue(rs, "dadosDiId");
        }
      }
      if (rootId == null) {
        return new DeclarationFinancials(values, List.of());
      }
      readPair(connection, freightSql, rootId, values, process, number, ValueType.FRETE);
      readPair(connection, insuranceSql, rootId, values, process, number, ValueType.SEGURO);
      return new DeclarationFinancials(values, payments(connection, rootId, process, number));
    });
  }

  private void readPair(Connection connection, String sql, long rootId, List<MerchandiseValue> values,
      String process, String number, ValueType type) throws SQLException {
    try (PreparedStatement statement = jdbc.prepare(connection, sql)) {
      statement.setMaxRows(1);
      statement.setLong(1, rootId);
      try (ResultSet rs = statement.executeQuery()) {
        if (rs.next()) {
          addValue(values, process, number, type, Currency.USD, rs.getBigDecimal("usd"));
          addValue(values, process, number, type, Currency.BRL, rs.getBigDecimal("brl"));
        }
      }
    }
  }

  private List<TaxPayment> payments(Connection connection, long rootId, String process, String number)
      throws SQLException {
    List<TaxPayment> payments = new ArrayList<>();
    try (PreparedStatement statement = jdbc.prepare(connection, paymentsSql)) {
      statement.setLong(1, rootId);
      try (ResultSet rs = statement.executeQuery()) {
        while (rs.next()) {
          String code = SourceRows.text(rs, "codigoReceita");
          String description = SourceRows.text(rs, "descricao_receita");
          BigDecimal amount = rs.getBigDecimal("valorTotal");
          Long retification = SourceRows.longValue(rs, "numeroRetificacao");
          payments.add(new TaxPayment(
              process,
              number,
              TaxType.fromReceipt(code, description),
              code,
              description,
              amount,
              SourceRows.time(rs, "dataPagamento"),
              retification == null ? null : retification.intValue()));
        }
      }
    }
    return payments;
  }

  private static void addValue(List<MerchandiseValue> values, String process, String number, ValueType type,
      Currency currency, BigDecimal amount) {
    if (amount != null && amount.signum() > 0) {
      values.add(new MerchandiseValue(process, number, type, currency, amount));
    }
  }
}
