package io.spectro.persistence.jdbc.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Connection settings for a PostgreSQL pool.
 * <p>
 * {@link #load(Path, Map, Map)} layers sources, later wins:
 * <ol>
 *   <li>classpath {@code spectro.properties} ({@code spectro.db.host}, {@code spectro.db.port}, ...)</li>
 *   <li>a {@code .env} file ({@code DB_HOST}, {@code DB_PORT}, {@code DB_USER}, {@code DB_PASSWORD}, {@code DB_NAME}, ...)</li>
 *   <li>environment variables, same names as {@code .env}</li>
 *   <li>explicit overrides keyed by {@link #KEYS}</li>
 * </ol>
 */
public record DatabaseConfig(String host,
                             int port,
                             String database,
                             String username,
                             String password,
                             String schema,
                             int maximumPoolSize,
                             Duration connectionTimeout,
                             Duration statementTimeout) {
  private static final Logger log = LoggerFactory.getLogger(DatabaseConfig.class);

  public static final String PROPERTIES_RESOURCE = "spectro.properties";
  public static final String PROPERTY_PREFIX = "spectro.db.";

  /** Canonical keys, used as property suffixes and override keys. */
  public static final List<String> KEYS = List.of(
      "host", "port", "database", "username", "password", "schema",
      "maximumPoolSize", "connectionTimeoutMs", "statementTimeoutMs");

  private static final Map<String, String> ENV_NAMES = Map.of(
      "DB_HOST", "host",
      "DB_PORT", "port",
      "DB_NAME", "database",
      "DB_USER", "username",
      "DB_PASSWORD", "password",
      "DB_SCHEMA", "schema",
      "DB_POOL_SIZE", "maximumPoolSize",
      "DB_CONNECTION_TIMEOUT_MS", "connectionTimeoutMs",
      "DB_STATEMENT_TIMEOUT_MS", "statementTimeoutMs");

  public DatabaseConfig {
    Objects.requireNonNull(host, "host");
    Objects.requireNonNull(database, "database");
    Objects.requireNonNull(username, "username");
    Objects.requireNonNull(connectionTimeout, "connectionTimeout");
    if (host.isBlank()) throw new IllegalArgumentException("host must not be blank");
    if (port < 1 || port > 65535) throw new IllegalArgumentException("port out of range: " + port);
    if (maximumPoolSize < 1) throw new IllegalArgumentException("maximumPoolSize must be >= 1");
    if (statementTimeout != null && statementTimeout.isNegative()) {
      throw new IllegalArgumentException("statementTimeout must not be negative");
    }
  }

  public static DatabaseConfig defaults() {
    return new DatabaseConfig("localhost", 5432, "spectro", "postgres", "postgres", null, 10,
        Duration.ofSeconds(30), null);
  }

  /** Loads from the classpath, {@code ./.env} and the process environment. */
  public static DatabaseConfig load() {
    return load(Path.of(".env"), System.getenv(), Map.of());
  }

  public static DatabaseConfig load(Path dotEnv, Map<String, String> env, Map<String, String> overrides) {
    Map<String, String> dotEnvValues = Map.of();
    if (dotEnv != null && Files.isRegularFile(dotEnv)) {
      try {
        dotEnvValues = parseDotEnv(Files.readAllLines(dotEnv, StandardCharsets.UTF_8));
      } catch (IOException e) {
        throw new UncheckedIOException("Cannot read " + dotEnv, e);
      }
    } else if (log.isDebugEnabled()) {
      log.debug("spectro.config dotenv_missing path={}", dotEnv);
    }
    return resolve(classpathProperties(), dotEnvValues, env, overrides);
  }

  static DatabaseConfig resolve(Properties props,
                                Map<String, String> dotEnv,
                                Map<String, String> env,
                                Map<String, String> overrides) {
    Map<String, String> values = new LinkedHashMap<>();
    for (String k : KEYS) {
      String v = props.getProperty(PROPERTY_PREFIX + k);
      if (v != null) values.put(k, v.trim());
    }
    putEnv(values, dotEnv);
    putEnv(values, env);
    for (var e : overrides.entrySet()) {
      if (!KEYS.contains(e.getKey())) throw new IllegalArgumentException("Unknown config key: " + e.getKey());
      if (e.getValue() != null) values.put(e.getKey(), e.getValue());
    }
    if (log.isDebugEnabled()) log.debug("spectro.config keys={}", values.keySet());

    DatabaseConfig d = defaults();
    return new DatabaseConfig(
        values.getOrDefault("host", d.host()),
        intValue(values, "port", d.port()),
        values.getOrDefault("database", d.database()),
        values.getOrDefault("username", d.username()),
        values.getOrDefault("password", d.password()),
        blankToNull(values.getOrDefault("schema", d.schema())),
        intValue(values, "maximumPoolSize", d.maximumPoolSize()),
        millis(values, "connectionTimeoutMs", d.connectionTimeout()),
        millis(values, "statementTimeoutMs", d.statementTimeout()));
  }

  /**
   * Parses {@code KEY=VALUE} lines. Blank lines and {@code #} comments are skipped, an {@code export}
   * prefix is dropped, the value is split on the first {@code =} and surrounding quotes are removed.
   */
  public static Map<String, String> parseDotEnv(List<String> lines) {
    Map<String, String> out = new LinkedHashMap<>();
    for (String raw : lines) {
      String line = raw.trim();
      if (line.isEmpty() || line.startsWith("#")) continue;
      if (line.startsWith("export ")) line = line.substring("export ".length()).trim();
      int eq = line.indexOf('=');
      if (eq <= 0) continue;
      String key = line.substring(0, eq).trim();
      String value = unquote(line.substring(eq + 1).trim());
      out.put(key, value);
    }
    return out;
  }

  public String jdbcUrl() {
    return "jdbc:postgresql://" + host + ":" + port + "/" + database;
  }

  @Override
  public String toString() {
    return "DatabaseConfig{url=" + jdbcUrl() + ", username=" + username + ", password=****"
        + ", schema=" + schema + ", maximumPoolSize=" + maximumPoolSize
        + ", connectionTimeout=" + connectionTimeout + ", statementTimeout=" + statementTimeout + "}";
  }

  private static Properties classpathProperties() {
    Properties p = new Properties();
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) cl = DatabaseConfig.class.getClassLoader();
    try (InputStream in = cl.getResourceAsStream(PROPERTIES_RESOURCE)) {
      if (in != null) p.load(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot read classpath " + PROPERTIES_RESOURCE, e);
    }
    return p;
  }

  private static void putEnv(Map<String, String> values, Map<String, String> source) {
    for (var e : ENV_NAMES.entrySet()) {
      String v = source.get(e.getKey());
      if (v != null) values.put(e.getValue(), v);
    }
  }

  private static int intValue(Map<String, String> values, String key, int fallback) {
    String v = values.get(key);
    if (v == null || v.isBlank()) return fallback;
    try {
      return Integer.parseInt(v.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Config '" + key + "' is not an integer: " + v, e);
    }
  }

  private static Duration millis(Map<String, String> values, String key, Duration fallback) {
    String v = values.get(key);
    if (v == null || v.isBlank()) return fallback;
    try {
      return Duration.ofMillis(Long.parseLong(v.trim()));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Config '" + key + "' is not a number of milliseconds: " + v, e);
    }
  }

  private static String blankToNull(String s) {
    return (s == null || s.isBlank()) ? null : s;
  }

  private static String unquote(String v) {
    if (v.length() >= 2) {
      char first = v.charAt(0);
      char last = v.charAt(v.length() - 1);
      if ((first == '"' || first == '\'') && first == last) return v.substring(1, v.length() - 1);
    }
    return v;
  }
}
