package br.com.maike.ledger.application.port;

import java.util.OptionalInt;

/**
 * Narrow schema inspection and widening of text columns owned by the ledger.
 *
 * @since 0.1.0
 */
public interface SchemaMaintenance {

  /**
   * Reads the declared character length of a column.
   *
   * @param table ledger table name
   * @param column column name
   * @return declared length; empty when the column is unknown or unbounded
   * @throws StoreException when the catalog cannot be read
   */
  OptionalInt columnLength(String table, String column) throws StoreException;

  /**
   * Widens a nullable text column.
   *
   * @param table ledger table name
   * @param column column name
   * @param length new length
   * @throws StoreException when the alteration fails
   */
  void widenColumn(String table, String column, int length) throws StoreException;
}
