package br.com.maike.ledger.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeIsInclusive() {
    assertEquals(1L, Numbers.requireRange("limit", 1, 1, 10));
    assertEquals(10L, Numbers.requireRange("limit", 10, 1, 10));
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("limit", 11, 1, 10));
    assertEquals("limit must be between 1 and 10 (was 11)", ex.getMessage());
  }

  @Test
  void parseIntUsesDefaultForBlank() {
    assertEquals(7, Numbers.parseInt("limit", null, 7, 0, 10));
    assertEquals(7, Numbers.parseInt("limit", " ", 7, 0, 10));
    assertEquals(3, Numbers.parseInt("limit", " 3 ", 7, 0, 10));
  }

  @Test
  void parseIntRejectsTextAndOutOfRange() {
    IllegalArgumentException text =
        assertThrows(IllegalArgumentException.class, () -> Numbers.parseInt("limit", "ten", 7, 0, 10));
    assertTrue(text.getMessage().startsWith("limit must be an integer"));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseInt("", "99", 7, 0, 10));
  }
}
