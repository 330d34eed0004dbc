package io.spectro.persistence.jdbc.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Builds HikariCP pools from a {@link DatabaseConfig}. */
public final class HikariDataSources {
  private static final Logger log = LoggerFactory.getLogger(HikariDataSources.class);

  public static final String POOL_NAME = "spectro";

  private HikariDataSources() {}

  public static HikariConfig toHikariConfig(DatabaseConfig config) {
    HikariConfig hc = new HikariConfig();
    hc.setPoolName(POOL_NAME);
    hc.setJdbcUrl(config.jdbcUrl());
    hc.setUsername(config.username());
    hc.setPassword(config.password());
    hc.setMaximumPoolSize(config.maximumPoolSize());
    hc.setConnectionTimeout(config.connectionTimeout().toMillis());
    hc.setAutoCommit(true);
    if (config.schema() != null) hc.setSchema(config.schema());
    if (config.statementTimeout() != null) {
      hc.addDataSourceProperty("options", "-c statement_timeout=" + config.statementTimeout().toMillis());
    }
    return hc;
  }

  /** Opens a pool; the caller closes it. */
  public static HikariDataSource create(DatabaseConfig config) {
    log.info("spectro.pool create config={}", config);
    return new HikariDataSource(toHikariConfig(config));
  }
}
