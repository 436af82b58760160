package br.com.maike.ledger.domain.process;

/**
 * Merchandise value categories read from an import declaration.
 *
 * @since 0.1.0
 */
public enum ValueType {
  /** Merchandise value at the place of unloading. */
  VMLD,
  /** Merchandise value at the place of shipment. */
  VMLE,
  FRETE,
  SEGURO
}
