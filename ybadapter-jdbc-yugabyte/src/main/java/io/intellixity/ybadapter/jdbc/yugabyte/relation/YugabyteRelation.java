package io.intellixity.ybadapter.jdbc.yugabyte.relation;

import io.intellixity.ybadapter.error.ConfigValidationException;
import io.intellixity.ybadapter.relation.RelationResults;
import io.intellixity.ybadapter.relation.RelationType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A YSQL relation ({@code database.schema.identifier}).
 *
 * @param type null for ad-hoc relations (e.g. test identifiers), which skip the name length check
 */
public record YugabyteRelation(String database, String schema, String identifier, RelationType type) {
  /** YSQL truncates identifiers beyond this many characters. */
  public static final int MAX_CHARACTERS_IN_IDENTIFIER = 63;

  public static final Set<RelationType> RENAMEABLE_RELATIONS =
      Set.of(RelationType.VIEW, RelationType.TABLE, RelationType.MATERIALIZED_VIEW);
  public static final Set<RelationType> REPLACEABLE_RELATIONS = Set.of(RelationType.VIEW, RelationType.TABLE);

  private static final RelationConfigDiffEngine DIFF = new RelationConfigDiffEngine();

  public YugabyteRelation {
    if (identifier != null && type != null && identifier.length() > MAX_CHARACTERS_IN_IDENTIFIER) {
      throw new ConfigValidationException("Relation name '" + identifier + "' is longer than "
          + MAX_CHARACTERS_IN_IDENTIFIER + " characters");
    }
  }

  public int relationMaxNameLength() { return MAX_CHARACTERS_IN_IDENTIFIER; }

  public boolean isRenameable() { return type != null && RENAMEABLE_RELATIONS.contains(type); }

  public boolean isReplaceable() { return type != null && REPLACEABLE_RELATIONS.contains(type); }

  /** Quoted, dot-separated name; null parts are left out. */
  public String render() {
    List<String> parts = new ArrayList<>(3);
    if (database != null) parts.add(quoteIdent(database));
    if (schema != null) parts.add(quoteIdent(schema));
    if (identifier != null) parts.add(quoteIdent(identifier));
    return String.join(".", parts);
  }

  static String quoteIdent(String ident) {
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  /**
   * Index changes needed to bring this materialized view in line with the model's config, or empty
   * when nothing has to change.
   */
  public Optional<YugabyteMaterializedViewConfigChangeCollection> getMaterializedViewConfigChangeCollection(
      RelationResults relationResults, String modelQuery, Map<String, ?> modelConfig) {
    YugabyteMaterializedViewConfig existing = YugabyteMaterializedViewConfig.fromRelationResults(relationResults);
    YugabyteMaterializedViewConfig desired =
        YugabyteMaterializedViewConfig.fromModelConfig(identifier, modelQuery, modelConfig);
    return DIFF.diff(existing, desired);
  }

  @Override
  public String toString() { return render(); }
}
