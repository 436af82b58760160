/**
 * <strong>Purpose:</strong> Read-only adapters over the replicated authoritative tables and the unified declaration
 * database.
 * <p><strong>Pipeline role:</strong> Bulk enumeration for backfill, number discovery and minimal payloads for
 * process reconciliation, and declaration financials.</p>
 * <p><strong>Mapping:</strong> Typed payloads are built column by column; the generic field extractor is not
 * involved.</p>
 *
 * @since 0.1.0
 */
package br.com.maike.ledger.infrastructure.source;
