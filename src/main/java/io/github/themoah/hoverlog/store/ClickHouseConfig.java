package io.github.themoah.hoverlog.store;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration holder for the ClickHouse template store.
 */
public class ClickHouseConfig {

  private static final Logger log = LoggerFactory.getLogger(ClickHouseConfig.class);

  private static final String DEFAULT_CONFIG_FILE = "application.properties";
  private static final String PROP_URL = "clickhouse.url";
  private static final String PROP_DATABASE = "clickhouse.database";
  private static final String PROP_USER = "clickhouse.user";
  private static final String PROP_PASSWORD = "clickhouse.password";
  private static final String PROP_POOL_MAX_SIZE = "clickhouse.pool.max.size";
  private static final String PROP_REPRESENTATIVES_MAX = "clickhouse.representatives.max";

  private static final String DEFAULT_URL = "http://localhost:8123";
  private static final String DEFAULT_DATABASE = "default";
  private static final String DEFAULT_USER = "default";
  private static final int DEFAULT_POOL_MAX_SIZE = 10;
  private static final int DEFAULT_REPRESENTATIVES_MAX = 10;

  private final String url;
  private final String database;
  private final String user;
  private final String password;
  private final int poolMaxSize;
  private final int representativesMax;

  private ClickHouseConfig(Builder builder) {
    this.url = builder.url;
    this.database = builder.database;
    this.user = builder.user;
    this.password = builder.password;
    this.poolMaxSize = builder.poolMaxSize;
    this.representativesMax = builder.representativesMax;
  }

  public String getUrl() {
    return url;
  }

  public String getDatabase() {
    return database;
  }

  public String getUser() {
    return user;
  }

  public String getPassword() {
    return password;
  }

  public int getPoolMaxSize() {
    return poolMaxSize;
  }

  public int getRepresentativesMax() {
    return representativesMax;
  }

  /**
   * JDBC URL for the ClickHouse driver, e.g. {@code jdbc:clickhouse:http://localhost:8123/default}.
   */
  public String getJdbcUrl() {
    String base = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    String prefix = base.startsWith("jdbc:") ? "" : "jdbc:clickhouse:";
    return prefix + base + "/" + database;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static ClickHouseConfig fromEnvironment() {
    Builder builder = builder()
      .url(System.getenv().getOrDefault("CLICKHOUSE_URL", DEFAULT_URL))
      .database(System.getenv().getOrDefault("CLICKHOUSE_DATABASE", DEFAULT_DATABASE))
      .user(System.getenv().getOrDefault("CLICKHOUSE_USER", DEFAULT_USER))
      .password(System.getenv().getOrDefault("CLICKHOUSE_PASSWORD", ""));

    String poolSize = System.getenv("CLICKHOUSE_POOL_MAX_SIZE");
    if (poolSize != null && !poolSize.isBlank()) {
      builder.poolMaxSize(parsePositive("CLICKHOUSE_POOL_MAX_SIZE", poolSize, DEFAULT_POOL_MAX_SIZE));
    }
    String representativesMax = System.getenv("CLICKHOUSE_REPRESENTATIVES_MAX");
    if (representativesMax != null && !representativesMax.isBlank()) {
      builder.representativesMax(
        parsePositive("CLICKHOUSE_REPRESENTATIVES_MAX", representativesMax, DEFAULT_REPRESENTATIVES_MAX));
    }
    return builder.build();
  }

  /**
   * Loads configuration from the default application.properties file on the classpath.
   *
   * @return ClickHouseConfig loaded from classpath
   * @throws IOException if the config file cannot be read
   */
  public static ClickHouseConfig fromClasspath() throws IOException {
    return fromClasspath(DEFAULT_CONFIG_FILE);
  }

  /**
   * Loads configuration from a properties file on the classpath.
   *
   * @param resourceName the name of the properties file on the classpath
   * @return ClickHouseConfig loaded from the resource
   * @throws IOException if the config file cannot be read
   */
  public static ClickHouseConfig fromClasspath(String resourceName) throws IOException {
    log.info("Loading configuration from classpath: {}", resourceName);
    try (InputStream is = ClickHouseConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
      if (is == null) {
        throw new IOException("Resource not found on classpath: " + resourceName);
      }
      Properties props = new Properties();
      props.load(is);
      return fromProperties(props);
    }
  }

  /**
   * Loads configuration from a properties file at the given path.
   *
   * @param path the path to the properties file
   * @return ClickHouseConfig loaded from the file
   * @throws IOException if the file cannot be read
   */
  public static ClickHouseConfig fromFile(Path path) throws IOException {
    log.info("Loading configuration from file: {}", path);
    try (InputStream is = Files.newInputStream(path)) {
      Properties props = new Properties();
      props.load(is);
      return fromProperties(props);
    }
  }

  /**
   * Creates configuration from a Properties object. Missing keys keep their defaults.
   *
   * @param props the properties containing clickhouse.* configuration
   * @return ClickHouseConfig built from the properties
   */
  public static ClickHouseConfig fromProperties(Properties props) {
    Builder builder = builder();

    String url = props.getProperty(PROP_URL);
    if (url != null && !url.isBlank()) {
      builder.url(url.trim());
    }
    String database = props.getProperty(PROP_DATABASE);
    if (database != null && !database.isBlank()) {
      builder.database(database.trim());
    }
    String user = props.getProperty(PROP_USER);
    if (user != null && !user.isBlank()) {
      builder.user(user.trim());
    }
    String password = props.getProperty(PROP_PASSWORD);
    if (password != null) {
      builder.password(password);
    }
    String poolSize = props.getProperty(PROP_POOL_MAX_SIZE);
    if (poolSize != null && !poolSize.isBlank()) {
      builder.poolMaxSize(parsePositive(PROP_POOL_MAX_SIZE, poolSize, DEFAULT_POOL_MAX_SIZE));
    }
    String representativesMax = props.getProperty(PROP_REPRESENTATIVES_MAX);
    if (representativesMax != null && !representativesMax.isBlank()) {
      builder.representativesMax(
        parsePositive(PROP_REPRESENTATIVES_MAX, representativesMax, DEFAULT_REPRESENTATIVES_MAX));
    }

    log.info("Configuration loaded: url={}, database={}, user={}", builder.url, builder.database, builder.user);
    return builder.build();
  }

  private static int parsePositive(String name, String value, int defaultValue) {
    try {
      int parsed = Integer.parseInt(value.trim());
      if (parsed > 0) {
        return parsed;
      }
      log.warn("{} must be positive, got {}; using default: {}", name, parsed, defaultValue);
    } catch (NumberFormatException e) {
      log.warn("Invalid value for {}: '{}', using default: {}", name, value, defaultValue);
    }
    return defaultValue;
  }

  public static class Builder {

    private String url = DEFAULT_URL;
    private String database = DEFAULT_DATABASE;
    private String user = DEFAULT_USER;
    private String password = "";
    private int poolMaxSize = DEFAULT_POOL_MAX_SIZE;
    private int representativesMax = DEFAULT_REPRESENTATIVES_MAX;

    public Builder url(String url) {
      this.url = Objects.requireNonNull(url, "url cannot be null");
      return this;
    }

    public Builder database(String database) {
      this.database = Objects.requireNonNull(database, "database cannot be null");
      return this;
    }

    public Builder user(String user) {
      this.user = Objects.requireNonNull(user, "user cannot be null");
      return this;
    }

    public Builder password(String password) {
      this.password = password == null ? "" : password;
      return this;
    }

    public Builder poolMaxSize(int poolMaxSize) {
      this.poolMaxSize = poolMaxSize;
      return this;
    }

    public Builder representativesMax(int representativesMax) {
      this.representativesMax = representativesMax;
      return this;
    }

    public ClickHouseConfig build() {
      return new ClickHouseConfig(this);
    }
  }
}
