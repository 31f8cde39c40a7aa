package io.intellixity.ybadapter.jdbc;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * PostgreSQL-style command tags ({@code INSERT 0 3}, {@code CREATE INDEX}, ...).\n
 *
 * JDBC does not expose the server's command completion tag, so it is rebuilt from the
 * statement's leading keywords and the update/row count.\n
 */
public final class CommandTags {
  private CommandTags() {}

  private static final Set<String> COUNTED = Set.of("UPDATE", "DELETE", "MERGE", "COPY", "FETCH", "MOVE");
  private static final Set<String> QUERIES = Set.of("SELECT", "WITH", "VALUES", "TABLE");
  private static final Set<String> DDL = Set.of("CREATE", "ALTER", "DROP");
  private static final Set<String> DDL_MODIFIERS = Set.of(
      "OR", "REPLACE", "UNIQUE", "TEMP", "TEMPORARY", "UNLOGGED", "GLOBAL", "LOCAL", "CONCURRENTLY");

  public static String of(String sql, long count) {
    List<String> words = leadingWords(sql, 8);
    if (words.isEmpty()) return "EMPTY";
    String verb = words.get(0);
    long n = Math.max(count, 0);

    if ("INSERT".equals(verb)) return "INSERT 0 " + n;
    if (QUERIES.contains(verb)) return "SELECT " + n;
    if (COUNTED.contains(verb)) return verb + " " + n;
    if (DDL.contains(verb)) return ddlTag(verb, words, n);
    return switch (verb) {
      case "BEGIN", "START" -> "BEGIN";
      case "COMMIT", "END" -> "COMMIT";
      case "ROLLBACK", "ABORT" -> "ROLLBACK";
      case "REFRESH" -> "REFRESH MATERIALIZED VIEW";
      case "TRUNCATE" -> "TRUNCATE TABLE";
      default -> verb;
    };
  }

  private static String ddlTag(String verb, List<String> words, long n) {
    int i = 1;
    while (i < words.size() && DDL_MODIFIERS.contains(words.get(i))) i++;
    if (i >= words.size()) return verb;
    String object = words.get(i);
    if ("MATERIALIZED".equals(object)) object = "MATERIALIZED VIEW";
    // CREATE TABLE ... AS SELECT reports the rows it wrote
    if ("CREATE".equals(verb) && "TABLE".equals(object) && words.contains("AS")) return "SELECT " + n;
    return verb + " " + object;
  }

  private static List<String> leadingWords(String sql, int max) {
    List<String> out = new ArrayList<>();
    if (sql == null) return out;
    String s = stripLeadingComments(sql);
    StringBuilder cur = new StringBuilder();
    for (int i = 0; i < s.length() && out.size() < max; i++) {
      char c = s.charAt(i);
      if (Character.isLetter(c) || c == '_') {
        cur.append(c);
      } else {
        if (cur.length() > 0) out.add(cur.toString().toUpperCase(Locale.ROOT));
        cur.setLength(0);
      }
    }
    if (cur.length() > 0 && out.size() < max) out.add(cur.toString().toUpperCase(Locale.ROOT));
    return out;
  }

  private static String stripLeadingComments(String sql) {
    String s = sql.strip();
    while (true) {
      if (s.startsWith("--")) {
        int nl = s.indexOf('\n');
        s = (nl < 0) ? "" : s.substring(nl + 1).strip();
      } else if (s.startsWith("/*")) {
        int end = s.indexOf("*/");
        s = (end < 0) ? "" : s.substring(end + 2).strip();
      } else {
        return s;
      }
    }
  }
}
