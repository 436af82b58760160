/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and shorten payloads before emission.
 * <p><strong>Pipeline role:</strong> Cross-cutting support for reconciliation, backfill and gap-fill diagnostics.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe.
 * <p><strong>Security:</strong> Provides redaction helpers so JDBC credentials never reach the log.
 *
 * @since 0.1.0
 */
package br.com.maike.ledger.logging;
