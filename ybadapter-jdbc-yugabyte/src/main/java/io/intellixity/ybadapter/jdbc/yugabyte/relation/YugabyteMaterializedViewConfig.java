package io.intellixity.ybadapter.jdbc.yugabyte.relation;

import io.intellixity.ybadapter.error.ConfigValidationException;
import io.intellixity.ybadapter.exec.ResultTable;
import io.intellixity.ybadapter.relation.RelationResults;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Snapshot of a materialized view's configuration, either read from the catalog or declared by a model.
 *
 * @param identifier view name
 * @param query defining query, if known
 * @param indexes index shapes, unique by structural equality
 */
public record YugabyteMaterializedViewConfig(String identifier, String query, Set<YugabyteIndexConfig> indexes) {
  public static final String MATERIALIZED_VIEW_RESULT = "materialized_view";
  public static final String INDEXES_RESULT = "indexes";

  public YugabyteMaterializedViewConfig {
    Objects.requireNonNull(identifier, "identifier");
    indexes = (indexes == null) ? Set.of() : Set.copyOf(indexes);
  }

  /**
   * Desired configuration from a model's config map: {@code indexes} is a list of maps
   * understood by {@link YugabyteIndexConfig#fromMap(Map)}. An absent {@code indexes} means none; any
   * other non-list value is a {@link ConfigValidationException}.
   */
  public static YugabyteMaterializedViewConfig fromModelConfig(String identifier, String query, Map<String, ?> config) {
    Set<YugabyteIndexConfig> indexes = new LinkedHashSet<>();
    Object raw = (config == null) ? null : config.get("indexes");
    if (raw != null && !(raw instanceof Collection<?>)) {
      throw new ConfigValidationException("indexes must be a list, got: " + raw);
    }
    if (raw instanceof Collection<?> list) {
      for (Object o : list) {
        if (!(o instanceof Map<?, ?> m)) {
          throw new ConfigValidationException("index config must be a map, got: " + o);
        }
        @SuppressWarnings("unchecked")
        Map<String, ?> im = (Map<String, ?>) m;
        indexes.add(YugabyteIndexConfig.fromMap(im));
      }
    }
    return new YugabyteMaterializedViewConfig(identifier, query, indexes);
  }

  /**
   * Existing configuration from catalog results: a {@code materialized_view} row ({@code table_name},
   * {@code query}) and one {@code indexes} row per index.
   */
  public static YugabyteMaterializedViewConfig fromRelationResults(RelationResults results) {
    Objects.requireNonNull(results, "results");
    List<Map<String, Object>> mv = results.table(MATERIALIZED_VIEW_RESULT).asMaps();
    if (mv.isEmpty()) throw new ConfigValidationException("relation results have no '" + MATERIALIZED_VIEW_RESULT + "' row");
    Map<String, Object> row = mv.get(0);
    Object name = row.get("table_name");
    Object query = row.get("query");

    Set<YugabyteIndexConfig> indexes = new LinkedHashSet<>();
    ResultTable idx = results.table(INDEXES_RESULT);
    for (Map<String, Object> r : idx.asMaps()) indexes.add(YugabyteIndexConfig.fromMap(r));

    return new YugabyteMaterializedViewConfig(
        String.valueOf(name), query == null ? null : String.valueOf(query), indexes);
  }
}
