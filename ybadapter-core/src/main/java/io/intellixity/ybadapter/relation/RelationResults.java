package io.intellixity.ybadapter.relation;

import io.intellixity.ybadapter.exec.ResultTable;

import java.util.Map;

/**
 * Named catalog query results describing one existing relation (e.g. {@code materialized_view}, {@code indexes}).
 */
public record RelationResults(Map<String, ResultTable> tables) {
  public RelationResults {
    tables = tables == null ? Map.of() : Map.copyOf(tables);
  }

  /** Result for {@code key}, or an empty table when the catalog query was not run. */
  public ResultTable table(String key) {
    ResultTable t = tables.get(key);
    return t == null ? ResultTable.empty() : t;
  }
}
