package br.com.maike.ledger.domain.process;

/**
 * Currencies in which declaration values are reported.
 *
 * @since 0.1.0
 */
public enum Currency {
  BRL,
  USD
}
