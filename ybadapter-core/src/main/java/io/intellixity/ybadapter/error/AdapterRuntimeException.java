package io.intellixity.ybadapter.error;

/**
 * Base of the adapter's runtime error kinds.
 * <p>
 * Errors of this type already carry diagnostic context, so execution wrappers re-throw them
 * unmodified instead of wrapping them again.
 */
public class AdapterRuntimeException extends RuntimeException {
  public AdapterRuntimeException(String message) {
    super(message);
  }

  public AdapterRuntimeException(String message, Throwable cause) {
    super(message, cause);
  }
}
