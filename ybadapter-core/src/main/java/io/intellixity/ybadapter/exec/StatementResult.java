package io.intellixity.ybadapter.exec;

/**
 * Raw outcome of one statement on a {@link io.intellixity.ybadapter.exec.handle.ConnectionHandle}.
 *
 * @param statusMessage PostgreSQL-style command tag, e.g. {@code INSERT 0 3} or {@code SELECT 1}
 * @param rowCount affected (DML) or returned (query) rows; -1 when unknown
 * @param table buffered rows, empty for statements that return none
 */
public record StatementResult(String statusMessage, long rowCount, ResultTable table) {
  public StatementResult {
    table = table == null ? ResultTable.empty() : table;
  }

  public static StatementResult of(String statusMessage, long rowCount) {
    return new StatementResult(statusMessage, rowCount, ResultTable.empty());
  }
}
