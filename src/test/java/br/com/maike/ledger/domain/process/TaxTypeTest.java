package br.com.maike.ledger.domain.process;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import br.com.maike.ledger.domain.document.DocumentKind;
import java.math.BigDecimal;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class TaxTypeTest {

  @Test
  void receiptCodeWins() {
    assertEquals(TaxType.II, TaxType.fromReceipt("0086", "COFINS"));
    assertEquals(TaxType.IPI, TaxType.fromReceipt(" 1038 ", null));
    assertEquals(TaxType.PIS, TaxType.fromReceipt("5602", null));
    assertEquals(TaxType.COFINS, TaxType.fromReceipt("5629", null));
    assertEquals(TaxType.ANTIDUMPING, TaxType.fromReceipt("5529", null));
    assertEquals(TaxType.TAXA_UTILIZACAO, TaxType.fromReceipt("7811", null));
  }

  @Test
  void descriptionIsMatchedForUnknownCodes() {
    assertEquals(TaxType.II, TaxType.fromReceipt("9999", "Imposto de Importacao"));
    assertEquals(TaxType.PIS, TaxType.fromReceipt(null, "PIS/PASEP - Importacao"));
    assertEquals(TaxType.TAXA_UTILIZACAO, TaxType.fromReceipt(null, "Taxa de utilizacao do Siscomex"));
  }

  @Test
  void anythingElseIsOther() {
    assertEquals(TaxType.OUTROS, TaxType.fromReceipt("1234", "Multa"));
    assertEquals(TaxType.OUTROS, TaxType.fromReceipt(null, null));
  }

  @Test
  void merchandiseValueMustBePositive() {
    assertThrows(IllegalArgumentException.class, () -> new MerchandiseValue(
        "ALH.0001/25", "2512345678", ValueType.VMLE, Currency.USD, BigDecimal.ZERO));
  }

  @Test
  void processReferenceIsUpperCased() {
    ProcessRecord record = new ProcessRecord(" alh.0001/25 ", null, "172505417636125", " ", null);

    assertEquals("ALH.0001/25", record.reference());
    assertEquals(Optional.of("172505417636125"), record.cachedNumber(DocumentKind.CARGO_MANIFEST));
    assertEquals(Optional.empty(), record.cachedNumber(DocumentKind.IMPORT_DECLARATION));
  }
}
