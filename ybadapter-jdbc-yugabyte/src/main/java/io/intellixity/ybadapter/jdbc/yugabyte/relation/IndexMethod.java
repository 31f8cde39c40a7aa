package io.intellixity.ybadapter.jdbc.yugabyte.relation;

import io.intellixity.ybadapter.error.ConfigValidationException;

import java.util.Locale;

/** Index access methods accepted by YSQL. {@link #LSM} is what YugabyteDB builds when none is named. */
public enum IndexMethod {
  LSM,
  HASH,
  BTREE,
  GIN,
  YBGIN,
  GIST,
  SPGIST,
  BRIN;

  public static IndexMethod defaultMethod() { return LSM; }

  public String id() { return name().toLowerCase(Locale.ROOT); }

  /** Parse a catalog/config value; blank means {@link #defaultMethod()}. */
  public static IndexMethod parse(String value) {
    if (value == null || value.isBlank()) return defaultMethod();
    String k = value.trim().toUpperCase(Locale.ROOT);
    for (IndexMethod m : values()) {
      if (m.name().equals(k)) return m;
    }
    throw new ConfigValidationException("Invalid index method: '" + value + "'");
  }
}
