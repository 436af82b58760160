package br.com.maike.ledger.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesFlagsFromKeyValues() {
    CliInput input = CliInput.parse(new String[] {"limit=5", "--DryRun", "-v", "", "process=ALH.0001/25"});

    assertArrayEquals(new String[] {"limit=5", "process=ALH.0001/25"}, input.keyValueArray());
    assertTrue(input.hasFlag("--dry-run"));
    assertTrue(input.hasFlag("--dryrun"));
    assertTrue(input.verbose());
    assertFalse(input.help());
  }

  @Test
  void helpAliasesCollapse() {
    assertTrue(CliInput.parse(new String[] {"help"}).help());
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"--debug"}).verbose());
  }

  @Test
  void dashedValueWithEqualsIsKeyValue() {
    CliInput input = CliInput.parse(new String[] {"--config=ledger.yaml"});

    assertArrayEquals(new String[] {"--config=ledger.yaml"}, input.keyValueArray());
    assertFalse(input.hasFlag(null));
    assertFalse(input.hasFlag(" "));
  }

  @Test
  void nullArgsAreEmpty() {
    CliInput input = CliInput.parse(null);

    assertTrue(input.keyValueArgs().isEmpty());
    assertTrue(input.flags().isEmpty());
  }
}
