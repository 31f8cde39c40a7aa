package io.intellixity.ybadapter.exec;

import java.util.List;

/**
 * Validated connection settings supplied by the profile layer.\n
 *
 * Implementations are immutable and trusted by the connection managers.\n
 */
public interface Credentials {
  /** Adapter type these credentials belong to (e.g. {@code yugabytedb}). */
  String type();

  /** Value that identifies the target for telemetry (usually the host). */
  String uniqueField();

  String database();

  String schema();

  /** Keys that are safe to display when describing the connection (never the password). */
  List<String> connectionKeys();
}
