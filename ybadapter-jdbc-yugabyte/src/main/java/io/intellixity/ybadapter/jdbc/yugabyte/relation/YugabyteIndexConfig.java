package io.intellixity.ybadapter.jdbc.yugabyte.relation;

import io.intellixity.ybadapter.error.ConfigValidationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Shape of one index on a materialized view.\n
 *
 * Equality is structural over (columns, unique, method, predicate); the index name is informational
 * and ignored, so an existing index and a desired one compare equal when they have the same shape.\n
 *
 * @param name index name, if known (existing indexes)
 * @param columnNames indexed columns, in order
 * @param unique whether the index enforces uniqueness
 * @param method access method
 * @param predicate partial-index filter, or null
 */
public record YugabyteIndexConfig(String name, List<String> columnNames, boolean unique, IndexMethod method,
                                  String predicate) {
  public YugabyteIndexConfig {
    if (columnNames == null || columnNames.isEmpty()) {
      throw new ConfigValidationException("Indexes require at least one column, but none were provided");
    }
    for (String c : columnNames) {
      if (c == null || c.isBlank()) throw new ConfigValidationException("Index column name is blank: " + columnNames);
    }
    columnNames = List.copyOf(columnNames);
    method = (method == null) ? IndexMethod.defaultMethod() : method;
    predicate = (predicate == null || predicate.isBlank()) ? null : predicate.strip();
  }

  public static YugabyteIndexConfig of(List<String> columnNames, boolean unique) {
    return new YugabyteIndexConfig(null, columnNames, unique, null, null);
  }

  /**
   * Build from a config or catalog map with keys {@code name}, {@code columns} or {@code column_names}
   * (list or comma-separated string), {@code unique}, {@code type} or {@code method}, {@code where} or {@code predicate}.
   */
  public static YugabyteIndexConfig fromMap(Map<String, ?> m) {
    Objects.requireNonNull(m, "m");
    Object cols = m.containsKey("columns") ? m.get("columns") : m.get("column_names");
    Object method = m.containsKey("type") ? m.get("type") : m.get("method");
    Object predicate = m.containsKey("where") ? m.get("where") : m.get("predicate");
    return new YugabyteIndexConfig(
        m.get("name") == null ? null : String.valueOf(m.get("name")),
        columns(cols),
        toBoolean(m.get("unique")),
        IndexMethod.parse(method == null ? null : String.valueOf(method)),
        predicate == null ? null : String.valueOf(predicate));
  }

  private static List<String> columns(Object v) {
    List<String> out = new ArrayList<>();
    if (v instanceof Collection<?> c) {
      for (Object o : c) out.add(o == null ? null : String.valueOf(o).strip());
    } else if (v != null) {
      for (String s : String.valueOf(v).split(",")) {
        if (!s.isBlank()) out.add(s.strip());
      }
    }
    return out;
  }

  private static boolean toBoolean(Object v) {
    if (v == null) return false;
    if (v instanceof Boolean b) return b;
    String s = String.valueOf(v).trim();
    return "true".equalsIgnoreCase(s) || "t".equalsIgnoreCase(s) || "1".equals(s);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof YugabyteIndexConfig other)) return false;
    return unique == other.unique
        && columnNames.equals(other.columnNames)
        && method == other.method
        && Objects.equals(predicate, other.predicate);
  }

  @Override
  public int hashCode() {
    return Objects.hash(columnNames, unique, method, predicate);
  }
}
