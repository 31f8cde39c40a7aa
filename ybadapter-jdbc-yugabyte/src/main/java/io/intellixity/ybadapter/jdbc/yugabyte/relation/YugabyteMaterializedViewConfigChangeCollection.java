package io.intellixity.ybadapter.jdbc.yugabyte.relation;

import io.intellixity.ybadapter.relation.RelationConfigChangeAction;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Index changes needed to move a materialized view to its desired configuration. Drops come before creates. */
public final class YugabyteMaterializedViewConfigChangeCollection {
  private final Set<YugabyteIndexConfigChange> indexes;

  public YugabyteMaterializedViewConfigChangeCollection(Set<YugabyteIndexConfigChange> indexes) {
    this.indexes = Collections.unmodifiableSet(new LinkedHashSet<>(indexes == null ? Set.of() : indexes));
  }

  public Set<YugabyteIndexConfigChange> indexes() { return indexes; }

  public boolean hasChanges() { return !indexes.isEmpty(); }

  public boolean requiresFullRefresh() {
    return indexes.stream().anyMatch(YugabyteIndexConfigChange::requiresFullRefresh);
  }

  public List<YugabyteIndexConfig> drops() { return contexts(RelationConfigChangeAction.DROP); }

  public List<YugabyteIndexConfig> creates() { return contexts(RelationConfigChangeAction.CREATE); }

  private List<YugabyteIndexConfig> contexts(RelationConfigChangeAction action) {
    return indexes.stream().filter(c -> c.action() == action).map(YugabyteIndexConfigChange::context).toList();
  }

  @Override
  public String toString() { return "YugabyteMaterializedViewConfigChangeCollection" + indexes; }
}
