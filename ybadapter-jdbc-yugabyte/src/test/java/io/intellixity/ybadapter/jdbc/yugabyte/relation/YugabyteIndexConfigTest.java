package io.intellixity.ybadapter.jdbc.yugabyte.relation;

import io.intellixity.ybadapter.error.ConfigValidationException;
import io.intellixity.ybadapter.relation.RelationConfigChangeAction;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class YugabyteIndexConfigTest {

  @Test
  void requiresAtLeastOneColumn() {
    ConfigValidationException ex = assertThrows(ConfigValidationException.class,
        () -> YugabyteIndexConfig.of(List.of(), false));
    assertEquals("Indexes require at least one column, but none were provided", ex.getMessage());

    assertThrows(ConfigValidationException.class, () -> YugabyteIndexConfig.of(List.of("id", " "), false));
  }

  @Test
  void equalityIgnoresName() {
    YugabyteIndexConfig a = new YugabyteIndexConfig("ix_a", List.of("id", "ts"), true, IndexMethod.LSM, "ts > now()");
    YugabyteIndexConfig b = new YugabyteIndexConfig("ix_b", List.of("id", "ts"), true, null, "  ts > now() ");

    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertNotEquals(a, new YugabyteIndexConfig("ix_a", List.of("ts", "id"), true, IndexMethod.LSM, "ts > now()"));
  }

  @Test
  void methodDefaultsToLsmAndParsesCaseInsensitively() {
    assertEquals(IndexMethod.LSM, YugabyteIndexConfig.of(List.of("id"), false).method());
    assertEquals(IndexMethod.GIN, IndexMethod.parse(" gin "));
    assertEquals(IndexMethod.LSM, IndexMethod.parse(""));
    assertEquals("ybgin", IndexMethod.YBGIN.id());

    ConfigValidationException ex = assertThrows(ConfigValidationException.class, () -> IndexMethod.parse("bitmap"));
    assertTrue(ex.getMessage().startsWith("Invalid index method"));
  }

  @Test
  void fromModelMap() {
    YugabyteIndexConfig idx = YugabyteIndexConfig.fromMap(Map.of(
        "columns", List.of("customer_id", "created_at"), "unique", true, "type", "hash"));

    assertEquals(List.of("customer_id", "created_at"), idx.columnNames());
    assertTrue(idx.unique());
    assertEquals(IndexMethod.HASH, idx.method());
    assertNull(idx.name());
    assertNull(idx.predicate());
  }

  @Test
  void fromCatalogRow() {
    YugabyteIndexConfig idx = YugabyteIndexConfig.fromMap(Map.of(
        "name", "orders_mv_ix", "column_names", "id, status", "unique", "t", "method", "lsm", "predicate", ""));

    assertEquals("orders_mv_ix", idx.name());
    assertEquals(List.of("id", "status"), idx.columnNames());
    assertTrue(idx.unique());
    assertEquals(IndexMethod.LSM, idx.method());
    assertNull(idx.predicate());
  }

  @Test
  void changesRejectAlter() {
    YugabyteIndexConfig idx = YugabyteIndexConfig.of(List.of("id"), false);
    assertThrows(ConfigValidationException.class,
        () -> new YugabyteIndexConfigChange(RelationConfigChangeAction.ALTER, idx));
    assertThrows(ConfigValidationException.class,
        () -> new YugabyteIndexConfigChange(RelationConfigChangeAction.CREATE, null));
    assertFalse(YugabyteIndexConfigChange.drop(idx).requiresFullRefresh());
  }
}
