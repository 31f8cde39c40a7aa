package io.intellixity.ybadapter.error;

/**
 * Programming error inside the adapter or its caller (e.g. misuse of the transaction state machine).
 * <p>
 * Not an {@link AdapterRuntimeException}: execution wrappers wrap it like any foreign error.
 */
public final class InternalException extends RuntimeException {
  public InternalException(String message) {
    super(message);
  }
}
