package io.intellixity.ybadapter.jdbc.yugabyte.relation;

import io.intellixity.ybadapter.error.ConfigValidationException;
import io.intellixity.ybadapter.relation.RelationConfigChangeAction;

/** One index to create or drop. Index changes never require a full refresh of the view. */
public record YugabyteIndexConfigChange(RelationConfigChangeAction action, YugabyteIndexConfig context) {
  public YugabyteIndexConfigChange {
    if (action == null) throw new ConfigValidationException("Index change requires an action");
    if (context == null) throw new ConfigValidationException("Index change '" + action + "' requires an index");
    if (action == RelationConfigChangeAction.ALTER) {
      throw new ConfigValidationException("Indexes cannot be altered in place; drop and create instead");
    }
  }

  public static YugabyteIndexConfigChange create(YugabyteIndexConfig index) {
    return new YugabyteIndexConfigChange(RelationConfigChangeAction.CREATE, index);
  }

  public static YugabyteIndexConfigChange drop(YugabyteIndexConfig index) {
    return new YugabyteIndexConfigChange(RelationConfigChangeAction.DROP, index);
  }

  public boolean requiresFullRefresh() { return false; }
}
