/**
 * <strong>Purpose:</strong> Orchestration use cases that drive the reconciliation engine at scale: historical
 * backfill, per-process reconciliation with declaration financials, and gap-fill of incomplete rows.
 * <p><strong>Pipeline role:</strong> Callers of {@link br.com.maike.ledger.application.reconcile.DocumentReconciler};
 * invoked by the CLI layer through the composition root.</p>
 * <p><strong>Errors:</strong> Store failures never escape a run; every use case returns a report with explicit
 * error counts and an unavailable flag.</p>
 *
 * @since 0.1.0
 */
package br.com.maike.ledger.application.pipeline;
