/**
 * <strong>Purpose:</strong> JDBC adapters for the authoritative ledger store: snapshots, history, financials and
 * the narrow schema self-heal.
 * <p><strong>Errors:</strong> Driver failures are classified into {@link br.com.maike.ledger.application.port.StoreException}
 * kinds by {@link br.com.maike.ledger.infrastructure.persistence.jdbc.SqlErrors}.</p>
 * <p><strong>SQL:</strong> Every runtime value is bound as a parameter; only validated schema qualifiers and
 * constant identifiers reach the SQL text.</p>
 *
 * @since 0.1.0
 */
package br.com.maike.ledger.infrastructure.persistence.jdbc;
