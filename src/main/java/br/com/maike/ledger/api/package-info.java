/**
 * CLI entry points for ingest, backfill, gap-fill and process reconciliation runs.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, configures logging, and invokes use cases.</p>
 * <p><strong>Concurrency:</strong> Every command runs single-threaded from start to summary.</p>
 * <p><strong>Security:</strong> Validates user-supplied paths and qualifiers and redacts credentials in logs.</p>
 */
package br.com.maike.ledger.api;
