package io.intellixity.ybadapter.exec;

import io.intellixity.ybadapter.exec.handle.ConnectionHandle;

import java.util.Objects;

/**
 * Logical connection owned by one thread of execution.\n
 *
 * Invariants:\n
 * - {@link #transactionOpen()} is only ever true while {@link #state()} is {@link ConnectionState#OPEN}\n
 * - a handle is present exactly when the connection is open\n
 *
 * Not thread-safe: a connection is only touched by the thread it is registered for
 * (and, for cancellation, read by a coordinating thread).\n
 */
public final class Connection {
  private final String type;
  private final Credentials credentials;
  private volatile String name;
  private volatile ConnectionState state = ConnectionState.INIT;
  private volatile boolean transactionOpen;
  private volatile ConnectionHandle handle;

  public Connection(String type, String name, Credentials credentials) {
    this.type = Objects.requireNonNull(type, "type");
    this.name = name;
    this.credentials = Objects.requireNonNull(credentials, "credentials");
  }

  public String type() { return type; }
  public String name() { return name; }
  public Credentials credentials() { return credentials; }
  public ConnectionState state() { return state; }
  public boolean transactionOpen() { return transactionOpen; }
  public ConnectionHandle handle() { return handle; }

  public void rename(String name) { this.name = name; }

  public boolean isOpen() { return state == ConnectionState.OPEN; }

  /** Attach a freshly opened session. */
  public void opened(ConnectionHandle handle) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.state = ConnectionState.OPEN;
  }

  /** Record a failed open attempt; any previous handle is dropped. */
  public void failed() {
    this.handle = null;
    this.transactionOpen = false;
    this.state = ConnectionState.FAIL;
  }

  public void closed() {
    this.transactionOpen = false;
    this.state = ConnectionState.CLOSED;
  }

  public void transactionOpen(boolean open) {
    if (open && state != ConnectionState.OPEN) {
      throw new IllegalStateException("Connection '" + name + "' is " + state + "; cannot mark a transaction open");
    }
    this.transactionOpen = open;
  }

  @Override
  public String toString() {
    return "Connection{type=" + type + ", name=" + name + ", state=" + state + ", transactionOpen=" + transactionOpen + "}";
  }
}
