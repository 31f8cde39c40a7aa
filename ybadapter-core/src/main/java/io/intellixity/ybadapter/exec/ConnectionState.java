package io.intellixity.ybadapter.exec;

public enum ConnectionState {
  /** Registered for a thread but not opened yet. */
  INIT,
  OPEN,
  CLOSED,
  /** The last open attempt failed; the connection has no handle. */
  FAIL
}
