package br.com.maike.ledger.domain.process;

import java.util.Locale;
import java.util.Map;

/**
 * Import duty categories derived from federal receipt codes.
 *
 * @since 0.1.0
 */
public enum TaxType {
  II,
  IPI,
  PIS,
  COFINS,
  ANTIDUMPING,
  TAXA_UTILIZACAO,
  OUTROS;

  private static final Map<String, TaxType> RECEIPT_CODES = Map.ofEntries(
      Map.entry("0086", II),
      Map.entry("86", II),
      Map.entry("1038", IPI),
      Map.entry("38", IPI),
      Map.entry("5602", PIS),
      Map.entry("602", PIS),
      Map.entry("5629", COFINS),
      Map.entry("629", COFINS),
      Map.entry("5529", ANTIDUMPING),
      Map.entry("529", ANTIDUMPING),
      Map.entry("7811", TAXA_UTILIZACAO),
      Map.entry("811", TAXA_UTILIZACAO));

  /**
   * Classifies a payment by receipt code, then by receipt description.
   *
   * @param receiptCode federal receipt code, may be {@code null}
   * @param description receipt description, may be {@code null}
   * @return matching tax type; {@link #OUTROS} when neither matches
   */
  public static TaxType fromReceipt(String receiptCode, String description) {
    if (receiptCode != null) {
      TaxType byCode = RECEIPT_CODES.get(receiptCode.trim());
      if (byCode != null) {
        return byCode;
      }
    }
    if (description == null || description.isBlank()) {
      return OUTROS;
    }
    String upper = description.toUpperCase(Locale.ROOT);
    if (upper.contains("IMPOSTO DE IMPORTA") || upper.matches(".*\\bII\\b.*")) {
      return II;
    }
    if (upper.contains("PRODUTOS INDUSTRIALIZADOS") || upper.matches(".*\\bIPI\\b.*")) {
      return IPI;
    }
    if (upper.contains("PIS") && upper.contains("PASEP")) {
      return PIS;
    }
    if (upper.contains("COFINS")) {
      return COFINS;
    }
    if (upper.contains("ANTIDUMPING")) {
      return ANTIDUMPING;
    }
    if (upper.contains("TAXA") && upper.contains("SISCOMEX")) {
      return TAXA_UTILIZACAO;
    }
    return OUTROS;
  }
}
