/**
 * <strong>Purpose:</strong> Document state and change-history reconciliation engine.
 * <p><strong>Pipeline role:</strong> raw payload, typed payload, change detection, then history append followed
 * by the snapshot upsert, all driven by {@link br.com.maike.ledger.application.reconcile.DocumentReconciler}.
 * <p><strong>Concurrency:</strong> Sequential per observation; no internal threads.
 *
 * @since 0.1.0
 */
package br.com.maike.ledger.application.reconcile;
