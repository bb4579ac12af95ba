/*
 * どこで: Execution store スキーマ移行
 * 何を: 未適用のスキーマ進化を昇順に 1 度だけ適用し、schema_evolutions に記録する
 * なぜ: 空または途中まで移行済みの DB を、クエリ受付前に最新構造へ揃えるため
 */
package com.jobtracker.executionstore.migration;

import com.jobtracker.common.codec.TimestampCodec;
import com.jobtracker.executionstore.model.SchemaVersion;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Objects;
import javax.sql.DataSource;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Applies {@link SchemaEvolution}s in order inside a single transaction.
 *
 * <p>The whole run, commit or rollback included, holds a {@link MigrationLock}, so concurrently
 * starting instances migrate one after the other. A database that is already current is only
 * read.
 */
@RequiredArgsConstructor
public class SchemaMigrator {

  private static final Logger logger = LoggerFactory.getLogger(SchemaMigrator.class);

  static final String CREATE_BOOKKEEPING_SQL =
      """
      CREATE TABLE IF NOT EXISTS schema_evolutions (
        schema_version  SMALLINT NOT NULL,
        schema_update   DATETIME NOT NULL,
        PRIMARY KEY     (schema_version)
      ) ENGINE = INNODB
      """;

  static final String CURRENT_VERSION_SQL = "SELECT MAX(schema_version) FROM schema_evolutions";

  static final String RECORD_VERSION_SQL =
      """
      INSERT INTO schema_evolutions (schema_version, schema_update)
      VALUES (:version, :appliedAt)
      """;

  private static final String APPLIED_VERSIONS_SQL =
      """
      SELECT schema_version, schema_update
      FROM schema_evolutions
      ORDER BY schema_version
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final TransactionTemplate transactionTemplate;
  private final MigrationLock lock;
  private final Clock clock;

  /**
   * Builds a migrator with its own templates over {@code dataSource}.
   *
   * <p>The templates carry no query timeout: lock waits are bounded by {@code lockTimeout} and
   * DDL on large tables runs to completion.
   */
  public static SchemaMigrator create(DataSource dataSource, Clock clock, Duration lockTimeout) {
    final JdbcTemplate template = new JdbcTemplate(dataSource);
    return new SchemaMigrator(
        new NamedParameterJdbcTemplate(template),
        new TransactionTemplate(new DataSourceTransactionManager(dataSource)),
        new MigrationLock(template, lockTimeout),
        clock);
  }

  /**
   * Brings the database up to {@code evolutions.size()}.
   *
   * @return the schema version after the run
   * @throws SchemaMigrationException if any step fails; the transaction is rolled back
   */
  public int migrate(List<SchemaEvolution> evolutions) {
    Objects.requireNonNull(evolutions, "evolutions");
    final Integer version;
    try {
      // ロックはトランザクションの確定後に解放される
      version =
          lock.runExclusively(
              () -> transactionTemplate.execute(status -> applyPending(evolutions)));
    } catch (DataAccessException | TransactionException ex) {
      throw new SchemaMigrationException("schema migration failed", ex);
    }
    if (version == null) {
      throw new SchemaMigrationException("schema migration returned no version");
    }
    return version;
  }

  public List<SchemaVersion> appliedVersions() {
    return jdbcTemplate.query(
        APPLIED_VERSIONS_SQL,
        new MapSqlParameterSource(),
        (rs, rowNum) ->
            new SchemaVersion(
                rs.getInt("schema_version"),
                TimestampCodec.UTC.decode(rs.getTimestamp("schema_update"))));
  }

  private int applyPending(List<SchemaEvolution> evolutions) {
    jdbcTemplate.getJdbcOperations().execute(CREATE_BOOKKEEPING_SQL);
    final int current = currentVersion();
    if (current > evolutions.size()) {
      throw new SchemaMigrationException(
          "database schema version " + current
              + " is newer than the latest known version " + evolutions.size());
    }
    if (current == evolutions.size()) {
      logger.info("schema is up to date version={}", current);
      return current;
    }
    for (int version = current + 1; version <= evolutions.size(); version++) {
      apply(version, evolutions.get(version - 1));
    }
    logger.info("schema migration finished from={} to={}", current, evolutions.size());
    return evolutions.size();
  }

  private void apply(int version, SchemaEvolution evolution) {
    try {
      for (String statement : evolution.statements()) {
        jdbcTemplate.getJdbcOperations().execute(statement);
      }
      final LocalDateTime appliedAt = LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC);
      final MapSqlParameterSource params =
          new MapSqlParameterSource()
              .addValue("version", version)
              .addValue("appliedAt", TimestampCodec.UTC.encode(appliedAt));
      jdbcTemplate.update(RECORD_VERSION_SQL, params);
    } catch (DataAccessException ex) {
      throw new SchemaMigrationException(
          "schema evolution failed version=" + version + " description=" + evolution.description(),
          ex);
    }
    logger.info(
        "schema evolution applied version={} description={}", version, evolution.description());
  }

  private int currentVersion() {
    final Integer version =
        jdbcTemplate.queryForObject(CURRENT_VERSION_SQL, new MapSqlParameterSource(), Integer.class);
    return version == null ? 0 : version;
  }
}
