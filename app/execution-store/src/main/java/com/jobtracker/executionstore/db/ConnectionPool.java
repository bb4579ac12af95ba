/*
 * どこで: Execution store の DB 接続
 * 何を: 上限付きの HikariCP プールと、操作単位で接続を貸し出すテンプレートを保持する
 * なぜ: プールの生成と破棄を所有者が明示的に管理し、全経路で接続を返却するため
 */
package com.jobtracker.executionstore.db;

import com.jobtracker.executionstore.config.DatabaseProperties;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.pool.HikariPool;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Bounded pool of MySQL connections.
 *
 * <p>Every call through {@link #jdbcTemplate()} borrows one connection for the duration of the
 * statement; every callback run by {@link #transactionTemplate()} borrows one connection for the
 * whole transaction. Both return it on every exit path.
 */
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "テンプレートはスレッドセーフな共有オブジェクトとして貸し出す")
public final class ConnectionPool implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(ConnectionPool.class);
  private static final String DRIVER_CLASS_NAME = "com.mysql.cj.jdbc.Driver";
  private static final String POOL_NAME = "tracker-db";

  private final HikariDataSource dataSource;
  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final TransactionTemplate transactionTemplate;

  private ConnectionPool(HikariDataSource dataSource, DatabaseProperties.Pool pool) {
    this.dataSource = dataSource;
    final JdbcTemplate template = new JdbcTemplate(dataSource);
    // JdbcTemplate のタイムアウトは秒単位。1 秒未満の設定は 1 秒に切り上げる
    template.setQueryTimeout((int) Math.max(1L, pool.queryTimeout().toSeconds()));
    this.jdbcTemplate = new NamedParameterJdbcTemplate(template);
    this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
  }

  /**
   * Opens the physical connections of the pool.
   *
   * @throws DataAccessResourceFailureException if the backend cannot be reached
   */
  public static ConnectionPool open(DatabaseProperties properties) {
    if (!properties.hasValidPort()) {
      logger.warn(
          "invalid port, using default port={} fallback={}",
          properties.port(),
          properties.resolvedPort());
    }
    final HikariConfig config = new HikariConfig();
    config.setPoolName(POOL_NAME);
    config.setDriverClassName(DRIVER_CLASS_NAME);
    config.setJdbcUrl(properties.jdbcUrl());
    config.setUsername(properties.user());
    config.setPassword(properties.password());
    config.setMaximumPoolSize(properties.pool().maximumPoolSize());
    config.setMinimumIdle(Math.min(properties.pool().minimumIdle(), properties.pool().maximumPoolSize()));
    config.setConnectionTimeout(properties.pool().connectionTimeout().toMillis());
    final HikariDataSource dataSource;
    try {
      dataSource = new HikariDataSource(config);
    } catch (HikariPool.PoolInitializationException ex) {
      throw new DataAccessResourceFailureException(
          "failed to open connection pool host=" + properties.host()
              + " port=" + properties.resolvedPort()
              + " database=" + properties.database(),
          ex);
    }
    logger.info(
        "connection pool opened host={} port={} database={} maximumPoolSize={}",
        properties.host(),
        properties.resolvedPort(),
        properties.database(),
        properties.pool().maximumPoolSize());
    return new ConnectionPool(dataSource, properties.pool());
  }

  public DataSource dataSource() {
    return dataSource;
  }

  public NamedParameterJdbcTemplate jdbcTemplate() {
    return jdbcTemplate;
  }

  public TransactionTemplate transactionTemplate() {
    return transactionTemplate;
  }

  public boolean isClosed() {
    return dataSource.isClosed();
  }

  @Override
  public void close() {
    if (!dataSource.isClosed()) {
      dataSource.close();
      logger.info("connection pool closed pool={}", POOL_NAME);
    }
  }
}
