package io.intellixity.ybadapter.jdbc.yugabyte.relation;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Plans the index changes between an existing and a desired materialized view.\n
 *
 * Four cases per index shape:\n
 * - present in both: nothing to do\n
 * - only desired: create\n
 * - only existing: drop\n
 * - properties changed: the shapes differ, so the old one is dropped and the new one created\n
 *
 * Stateless; safe to share.\n
 */
public final class RelationConfigDiffEngine {

  /** Changes to apply, or empty when the view already matches. */
  public Optional<YugabyteMaterializedViewConfigChangeCollection> diff(YugabyteMaterializedViewConfig existing,
                                                                      YugabyteMaterializedViewConfig desired) {
    Objects.requireNonNull(existing, "existing");
    Objects.requireNonNull(desired, "desired");
    var changes = new YugabyteMaterializedViewConfigChangeCollection(indexChanges(existing.indexes(), desired.indexes()));
    return changes.hasChanges() ? Optional.of(changes) : Optional.empty();
  }

  public Set<YugabyteIndexConfigChange> indexChanges(Set<YugabyteIndexConfig> existing, Set<YugabyteIndexConfig> desired) {
    Set<YugabyteIndexConfigChange> out = new LinkedHashSet<>();
    for (YugabyteIndexConfig idx : existing) {
      if (!desired.contains(idx)) out.add(YugabyteIndexConfigChange.drop(idx));
    }
    for (YugabyteIndexConfig idx : desired) {
      if (!existing.contains(idx)) out.add(YugabyteIndexConfigChange.create(idx));
    }
    return out;
  }
}
