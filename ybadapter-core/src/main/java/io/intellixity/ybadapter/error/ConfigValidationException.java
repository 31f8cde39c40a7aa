package io.intellixity.ybadapter.error;

/** A relation or credentials configuration value failed validation. */
public final class ConfigValidationException extends AdapterRuntimeException {
  public ConfigValidationException(String message) {
    super(message);
  }

  public ConfigValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
