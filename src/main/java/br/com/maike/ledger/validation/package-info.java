/**
 * <strong>Purpose:</strong> Validation helpers used during CLI parsing and configuration bootstrap.
 * <p><strong>Pipeline role:</strong> Rejects invalid run limits, windows and database qualifiers before
 * connection pools are opened.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.
 * <p><strong>Security:</strong> Restricts configuration values that end up in SQL text to plain identifiers.
 *
 * @since 0.1.0
 */
package br.com.maike.ledger.validation;
