package br.com.maike.ledger.testutil;

import br.com.maike.ledger.application.port.SchemaMaintenance;
import br.com.maike.ledger.application.port.StoreException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Column lengths held in a map; widening rewrites the entry and is recorded.
 */
public final class FakeSchemaMaintenance implements SchemaMaintenance {
  private final Map<String, Integer> lengths = new HashMap<>();
  private final List<String> widened = new ArrayList<>();
  private StoreException failure;

  public FakeSchemaMaintenance length(String table, String column, int length) {
    lengths.put(table + "." + column, length);
    return this;
  }

  public void failLookups(StoreException.Kind kind) {
    failure = new StoreException(kind, "scripted " + kind + " on schema lookup");
  }

  @Override
  public OptionalInt columnLength(String table, String column) throws StoreException {
    if (failure != null) {
      throw failure;
    }
    Integer length = lengths.get(table + "." + column);
    return length == null ? OptionalInt.empty() : OptionalInt.of(length);
  }

  @Override
  public void widenColumn(String table, String column, int length) {
    lengths.put(table + "." + column, length);
    widened.add(table + "." + column);
  }

  public List<String> widened() {
    return List.copyOf(widened);
  }
}
