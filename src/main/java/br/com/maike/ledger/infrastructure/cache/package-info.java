/**
 * Adapters over the local SQLite cache: the process catalog, cached document numbers and legacy payloads.
 */
package br.com.maike.ledger.infrastructure.cache;
