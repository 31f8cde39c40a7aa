package io.intellixity.ybadapter.relation;

import java.util.Locale;

public enum RelationType {
  TABLE("table"),
  VIEW("view"),
  CTE("cte"),
  MATERIALIZED_VIEW("materialized_view"),
  EXTERNAL("external");

  private final String id;

  RelationType(String id) { this.id = id; }

  public String id() { return id; }

  public static RelationType fromId(String id) {
    if (id == null) throw new IllegalArgumentException("relation type is null");
    String k = id.trim().toLowerCase(Locale.ROOT);
    for (RelationType t : values()) {
      if (t.id.equals(k)) return t;
    }
    throw new IllegalArgumentException("Unknown relation type: " + id);
  }
}
