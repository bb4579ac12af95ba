/*
 * どこで: Execution store の DB 接続
 * 何を: 接続プールを開き、スキーマ移行を完了させたハンドルを返す
 * なぜ: 移行が終わるまでストアにテンプレートを渡さず、未移行のスキーマへのクエリを防ぐため
 */
package com.jobtracker.executionstore.db;

import com.jobtracker.executionstore.config.DatabaseProperties;
import com.jobtracker.executionstore.migration.SchemaEvolution;
import com.jobtracker.executionstore.migration.SchemaEvolutions;
import com.jobtracker.executionstore.migration.SchemaMigrator;
import com.jobtracker.executionstore.model.SchemaVersion;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * A connection pool whose database has been migrated to the latest schema.
 *
 * <p>Obtained through {@link #connect}; the owner closes it on shutdown.
 */
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "テンプレートはスレッドセーフな共有オブジェクトとして貸し出す")
public final class TrackerDatabase implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(TrackerDatabase.class);

  private final ConnectionPool pool;
  private final SchemaMigrator migrator;
  private final int schemaVersion;

  private TrackerDatabase(ConnectionPool pool, SchemaMigrator migrator, int schemaVersion) {
    this.pool = pool;
    this.migrator = migrator;
    this.schemaVersion = schemaVersion;
  }

  public static TrackerDatabase connect(DatabaseProperties properties) {
    return connect(properties, SchemaEvolutions.all(), Clock.systemUTC());
  }

  /**
   * Opens the pool and migrates the database before returning.
   *
   * @throws org.springframework.dao.DataAccessResourceFailureException if the backend is unreachable
   * @throws com.jobtracker.executionstore.migration.SchemaMigrationException if migration fails;
   *     the pool is closed before the exception propagates
   */
  public static TrackerDatabase connect(
      DatabaseProperties properties, List<SchemaEvolution> evolutions, Clock clock) {
    final ConnectionPool pool = ConnectionPool.open(properties);
    try {
      final SchemaMigrator migrator =
          SchemaMigrator.create(
              pool.dataSource(), clock, properties.pool().migrationLockTimeout());
      final int version = migrator.migrate(evolutions);
      logger.info("tracker database ready database={} schemaVersion={}", properties.database(), version);
      return new TrackerDatabase(pool, migrator, version);
    } catch (RuntimeException ex) {
      pool.close();
      throw ex;
    }
  }

  public int schemaVersion() {
    return schemaVersion;
  }

  public List<SchemaVersion> appliedVersions() {
    return migrator.appliedVersions();
  }

  public NamedParameterJdbcTemplate jdbcTemplate() {
    return pool.jdbcTemplate();
  }

  public TransactionTemplate transactionTemplate() {
    return pool.transactionTemplate();
  }

  @Override
  public void close() {
    pool.close();
  }
}
