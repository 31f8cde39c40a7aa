package io.intellixity.ybadapter.error;

/** Raised when a connection could not be opened, including after the retry budget is exhausted. */
public final class ConnectionException extends DatabaseException {
  public ConnectionException(String message) {
    super(message);
  }

  public ConnectionException(String message, Throwable cause) {
    super(message, cause);
  }
}
