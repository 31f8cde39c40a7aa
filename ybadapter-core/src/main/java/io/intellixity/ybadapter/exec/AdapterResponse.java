package io.intellixity.ybadapter.exec;

/**
 * Normalized response reported to the framework after a statement.
 *
 * @param message free-text status message
 * @param code terse status code (the message without numeric tokens)
 * @param rowsAffected affected-row count, -1 when unknown
 */
public record AdapterResponse(String message, String code, long rowsAffected) {
  @Override
  public String toString() { return message; }
}
