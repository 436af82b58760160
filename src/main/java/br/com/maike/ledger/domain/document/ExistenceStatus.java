package br.com.maike.ledger.domain.document;

/**
 * Outcome of an existence check against the snapshot table.
 *
 * @since 0.1.0
 */
public enum ExistenceStatus {
  /** A snapshot row exists. */
  PRESENT,
  /** The store answered and no row exists. */
  ABSENT,
  /** The store did not answer within the retry budget. */
  UNKNOWN
}
