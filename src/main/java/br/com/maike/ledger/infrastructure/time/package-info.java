/**
 * Time-related infrastructure adapters implementing the clock and sleeper ports.
 * <p><strong>Role:</strong> Adapter layer providing concrete time sources and pauses for backoff.</p>
 * <p><strong>Concurrency:</strong> Implementations are thread-safe.</p>
 */
package br.com.maike.ledger.infrastructure.time;
