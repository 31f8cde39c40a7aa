package io.intellixity.ybadapter.exec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Buffered rows returned by a statement. Column order is preserved. */
public record ResultTable(List<String> columnNames, List<List<Object>> rows) {
  private static final ResultTable EMPTY = new ResultTable(List.of(), List.of());

  public ResultTable {
    columnNames = columnNames == null ? List.of() : List.copyOf(columnNames);
    if (rows == null) {
      rows = List.of();
    } else {
      List<List<Object>> copy = new ArrayList<>(rows.size());
      // rows may legitimately hold SQL NULLs, so List.copyOf is not an option here
      for (List<Object> r : rows) copy.add(Collections.unmodifiableList(new ArrayList<>(r)));
      rows = Collections.unmodifiableList(copy);
    }
  }

  public static ResultTable empty() { return EMPTY; }

  public boolean isEmpty() { return rows.isEmpty(); }

  public int size() { return rows.size(); }

  public Optional<List<Object>> firstRow() {
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  /** First {@code limit} rows; a null or negative limit keeps everything. */
  public ResultTable limit(Integer limit) {
    if (limit == null || limit < 0 || limit >= rows.size()) return this;
    return new ResultTable(columnNames, rows.subList(0, limit));
  }

  /** Rows keyed by column name, for callers that parse catalog results. */
  public List<Map<String, Object>> asMaps() {
    List<Map<String, Object>> out = new ArrayList<>(rows.size());
    for (List<Object> r : rows) {
      Map<String, Object> m = new LinkedHashMap<>();
      for (int i = 0; i < columnNames.size() && i < r.size(); i++) m.put(columnNames.get(i), r.get(i));
      out.add(m);
    }
    return out;
  }
}
