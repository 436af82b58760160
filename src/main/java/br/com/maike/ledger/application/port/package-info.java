/**
 * <strong>Purpose:</strong> Ports separating the reconciliation engine from storage, sources, clocks and metrics.
 * <p><strong>Pipeline role:</strong> Driven-side interfaces implemented by JDBC, SQLite and OpenTelemetry adapters
 * and by in-memory fakes in tests.
 * <p><strong>Errors:</strong> Storage failures surface as the checked {@link br.com.maike.ledger.application.port.StoreException}.
 *
 * @since 0.1.0
 */
package br.com.maike.ledger.application.port;
