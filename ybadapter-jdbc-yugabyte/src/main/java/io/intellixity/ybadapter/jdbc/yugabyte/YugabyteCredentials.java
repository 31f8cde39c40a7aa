package io.intellixity.ybadapter.jdbc.yugabyte;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.intellixity.ybadapter.exec.Credentials;

import java.util.List;
import java.util.Objects;

/**
 * Connection settings for a YugabyteDB (YSQL) target.\n
 *
 * Bound from a profile output with snake_case keys; {@code dbname} and {@code pass} are accepted as aliases.\n
 * The password is mandatory on YugabyteDB.\n
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class YugabyteCredentials implements Credentials {
  public static final String TYPE = "yugabytedb";
  public static final int DEFAULT_CONNECT_TIMEOUT = 10;
  public static final int DEFAULT_RETRIES = 1;
  public static final String DEFAULT_APPLICATION_NAME = "dbt";

  private static final List<String> CONNECTION_KEYS = List.of(
      "host", "port", "user", "database", "schema", "connect_timeout", "role", "search_path",
      "keepalives_idle", "sslmode", "sslcert", "sslkey", "sslrootcert", "application_name",
      "retries", "enable_transaction");

  private final String host;
  private final int port;
  private final String user;
  private final String password;
  private final String database;
  private final String schema;
  private final int connectTimeout;
  private final String role;
  private final String searchPath;
  private final int keepalivesIdle;
  private final String sslmode;
  private final String sslcert;
  private final String sslkey;
  private final String sslrootcert;
  private final String applicationName;
  private final int retries;
  private final boolean enableTransaction;

  @JsonCreator
  public YugabyteCredentials(@JsonProperty("host") String host,
                             @JsonProperty("port") Integer port,
                             @JsonProperty("user") String user,
                             @JsonProperty("password") @JsonAlias("pass") String password,
                             @JsonProperty("database") @JsonAlias("dbname") String database,
                             @JsonProperty("schema") String schema,
                             @JsonProperty("connect_timeout") Integer connectTimeout,
                             @JsonProperty("role") String role,
                             @JsonProperty("search_path") String searchPath,
                             @JsonProperty("keepalives_idle") Integer keepalivesIdle,
                             @JsonProperty("sslmode") String sslmode,
                             @JsonProperty("sslcert") String sslcert,
                             @JsonProperty("sslkey") String sslkey,
                             @JsonProperty("sslrootcert") String sslrootcert,
                             @JsonProperty("application_name") String applicationName,
                             @JsonProperty("retries") Integer retries,
                             @JsonProperty("enable_transaction") Boolean enableTransaction) {
    this.host = Objects.requireNonNull(host, "host");
    this.port = Objects.requireNonNull(port, "port");
    if (this.port < 0 || this.port > 65535) throw new IllegalArgumentException("port out of range: " + port);
    this.user = Objects.requireNonNull(user, "user");
    this.password = Objects.requireNonNull(password, "password");
    this.database = Objects.requireNonNull(database, "database");
    this.schema = schema;
    this.connectTimeout = (connectTimeout == null) ? DEFAULT_CONNECT_TIMEOUT : connectTimeout;
    this.role = role;
    this.searchPath = searchPath;
    this.keepalivesIdle = (keepalivesIdle == null) ? 0 : keepalivesIdle;
    this.sslmode = sslmode;
    this.sslcert = sslcert;
    this.sslkey = sslkey;
    this.sslrootcert = sslrootcert;
    this.applicationName = (applicationName == null) ? DEFAULT_APPLICATION_NAME : applicationName;
    this.retries = (retries == null) ? DEFAULT_RETRIES : retries;
    this.enableTransaction = (enableTransaction == null) || enableTransaction;
  }

  public static Builder builder() { return new Builder(); }

  @Override public String type() { return TYPE; }
  @Override public String uniqueField() { return host; }
  @Override public String database() { return database; }
  @Override public String schema() { return schema; }
  @Override public List<String> connectionKeys() { return CONNECTION_KEYS; }

  public String host() { return host; }
  public int port() { return port; }
  public String user() { return user; }
  public String password() { return password; }
  public int connectTimeout() { return connectTimeout; }
  public String role() { return role; }
  public String searchPath() { return searchPath; }
  /** 0 means "use the platform default". */
  public int keepalivesIdle() { return keepalivesIdle; }
  public String sslmode() { return sslmode; }
  public String sslcert() { return sslcert; }
  public String sslkey() { return sslkey; }
  public String sslrootcert() { return sslrootcert; }
  public String applicationName() { return applicationName; }
  public int retries() { return retries; }
  public boolean enableTransaction() { return enableTransaction; }

  @Override
  public String toString() {
    return "YugabyteCredentials{host=" + host + ", port=" + port + ", user=" + user + ", database=" + database
        + ", schema=" + schema + ", retries=" + retries + ", enableTransaction=" + enableTransaction + "}";
  }

  public static final class Builder {
    private String host = "localhost";
    private Integer port = 5433;
    private String user = "yugabyte";
    private String password;
    private String database = "yugabyte";
    private String schema;
    private Integer connectTimeout;
    private String role;
    private String searchPath;
    private Integer keepalivesIdle;
    private String sslmode;
    private String sslcert;
    private String sslkey;
    private String sslrootcert;
    private String applicationName = DEFAULT_APPLICATION_NAME;
    private Integer retries;
    private Boolean enableTransaction;

    private Builder() {}

    public Builder host(String v) { this.host = v; return this; }
    public Builder port(int v) { this.port = v; return this; }
    public Builder user(String v) { this.user = v; return this; }
    public Builder password(String v) { this.password = v; return this; }
    public Builder database(String v) { this.database = v; return this; }
    public Builder schema(String v) { this.schema = v; return this; }
    public Builder connectTimeout(int v) { this.connectTimeout = v; return this; }
    public Builder role(String v) { this.role = v; return this; }
    public Builder searchPath(String v) { this.searchPath = v; return this; }
    public Builder keepalivesIdle(int v) { this.keepalivesIdle = v; return this; }
    public Builder sslmode(String v) { this.sslmode = v; return this; }
    public Builder sslcert(String v) { this.sslcert = v; return this; }
    public Builder sslkey(String v) { this.sslkey = v; return this; }
    public Builder sslrootcert(String v) { this.sslrootcert = v; return this; }
    public Builder applicationName(String v) { this.applicationName = v; return this; }
    public Builder retries(int v) { this.retries = v; return this; }
    public Builder enableTransaction(boolean v) { this.enableTransaction = v; return this; }

    public YugabyteCredentials build() {
      return new YugabyteCredentials(host, port, user, password, database, schema, connectTimeout, role,
          searchPath, keepalivesIdle, sslmode, sslcert, sslkey, sslrootcert, applicationName, retries,
          enableTransaction);
    }
  }
}
