package br.com.maike.ledger.domain.document;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class DocumentKindTest {

  @Test
  void resolvesCodesAndNamesCaseInsensitively() {
    assertEquals(DocumentKind.CARGO_MANIFEST, DocumentKind.fromCode("ce"));
    assertEquals(DocumentKind.UNIFIED_IMPORT_DECLARATION, DocumentKind.fromCode(" DUIMP "));
    assertEquals(DocumentKind.TERMINAL_CONTROL, DocumentKind.fromCode("terminal_control"));
  }

  @Test
  void rejectsUnknownAndBlankCodes() {
    assertThrows(IllegalArgumentException.class, () -> DocumentKind.fromCode("LI"));
    assertThrows(IllegalArgumentException.class, () -> DocumentKind.fromCode(" "));
  }

  @Test
  void onlyImportDeclarationsCarryRevisions() {
    assertTrue(DocumentKind.IMPORT_DECLARATION.supportsRevisions());
    assertFalse(DocumentKind.UNIFIED_IMPORT_DECLARATION.supportsRevisions());
    assertFalse(DocumentKind.CARGO_MANIFEST.supportsRevisions());
  }

  @Test
  void identityNormalizesNumberAndBlankVersion() {
    DocumentIdentity identity = new DocumentIdentity(" 2512345678 ", DocumentKind.IMPORT_DECLARATION, " ");

    assertEquals("2512345678", identity.number());
    assertEquals(DocumentIdentity.of("2512345678", DocumentKind.IMPORT_DECLARATION), identity);
    assertEquals("DI:2512345678", identity.toString());
    assertThrows(IllegalArgumentException.class, () -> DocumentIdentity.of("  ", DocumentKind.CARGO_MANIFEST));
  }
}
