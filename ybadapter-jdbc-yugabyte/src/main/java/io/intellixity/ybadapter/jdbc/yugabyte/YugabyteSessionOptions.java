package io.intellixity.ybadapter.jdbc.yugabyte;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Optional session settings derived from {@link YugabyteCredentials}, in libpq vocabulary.\n
 *
 * Only settings that are actually configured appear in {@link #options()}; the driver translation
 * happens in {@link #toJdbcProperties()}.\n
 */
public final class YugabyteSessionOptions {
  public static final String KEEPALIVES_IDLE = "keepalives_idle";
  public static final String OPTIONS = "options";
  public static final String SSLMODE = "sslmode";
  public static final String SSLCERT = "sslcert";
  public static final String SSLKEY = "sslkey";
  public static final String SSLROOTCERT = "sslrootcert";
  public static final String APPLICATION_NAME = "application_name";

  private final YugabyteCredentials credentials;
  private final Map<String, String> options;

  private YugabyteSessionOptions(YugabyteCredentials credentials, Map<String, String> options) {
    this.credentials = credentials;
    this.options = Collections.unmodifiableMap(options);
  }

  public static YugabyteSessionOptions from(YugabyteCredentials c) {
    Map<String, String> o = new LinkedHashMap<>();
    // a zero keepalives_idle makes the server attempt an invalid setsockopt(), so it is never passed
    if (c.keepalivesIdle() != 0) o.put(KEEPALIVES_IDLE, Integer.toString(c.keepalivesIdle()));

    String searchPath = c.searchPath();
    if (searchPath != null && !searchPath.isEmpty()) o.put(OPTIONS, searchPathOption(searchPath));

    if (c.sslmode() != null && !c.sslmode().isEmpty()) o.put(SSLMODE, c.sslmode());
    if (c.sslcert() != null) o.put(SSLCERT, c.sslcert());
    if (c.sslkey() != null) o.put(SSLKEY, c.sslkey());
    if (c.sslrootcert() != null) o.put(SSLROOTCERT, c.sslrootcert());
    if (c.applicationName() != null && !c.applicationName().isEmpty()) o.put(APPLICATION_NAME, c.applicationName());
    return new YugabyteSessionOptions(c, o);
  }

  /** Startup option that sets the search path; spaces are backslash-escaped as the startup packet requires. */
  public static String searchPathOption(String searchPath) {
    return "-c search_path=" + searchPath.replace(" ", "\\ ");
  }

  public Map<String, String> options() { return options; }

  public String jdbcUrl() {
    return "jdbc:postgresql://" + credentials.host() + ":" + credentials.port() + "/" + credentials.database();
  }

  /**
   * pgjdbc connection properties.\n
   *
   * pgjdbc has no keepalive idle tuning; a configured idle time turns on {@code tcpKeepAlive}.\n
   */
  public Properties toJdbcProperties() {
    Properties p = new Properties();
    p.setProperty("user", credentials.user());
    p.setProperty("password", credentials.password());
    p.setProperty("connectTimeout", Integer.toString(credentials.connectTimeout()));
    for (Map.Entry<String, String> e : options.entrySet()) {
      switch (e.getKey()) {
        case KEEPALIVES_IDLE -> p.setProperty("tcpKeepAlive", "true");
        case APPLICATION_NAME -> p.setProperty("ApplicationName", e.getValue());
        default -> p.setProperty(e.getKey(), e.getValue());
      }
    }
    return p;
  }
}
