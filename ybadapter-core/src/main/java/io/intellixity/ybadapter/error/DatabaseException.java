package io.intellixity.ybadapter.error;

/** Server-reported failure while running a statement. The message is the server's, trimmed. */
public class DatabaseException extends AdapterRuntimeException {
  public DatabaseException(String message) {
    super(message);
  }

  public DatabaseException(String message, Throwable cause) {
    super(message, cause);
  }
}
