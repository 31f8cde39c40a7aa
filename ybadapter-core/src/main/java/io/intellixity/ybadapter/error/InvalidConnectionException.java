package io.intellixity.ybadapter.error;

/** The calling thread has no registered connection. */
public final class InvalidConnectionException extends AdapterRuntimeException {
  private final long threadId;

  public InvalidConnectionException(long threadId, Iterable<String> knownConnections) {
    super("connection never acquired for thread " + threadId + ", have " + String.join(", ", knownConnections));
    this.threadId = threadId;
  }

  public long threadId() { return threadId; }
}
