/*
 * どこで: Execution store スキーマ移行
 * 何を: MySQL の名前付きロックを専用の接続で保持したまま処理を実行する
 * なぜ: 移行トランザクションのコミット後までロックを持ち続け、後続インスタンスに確定済みのバージョンを読ませるため
 */
package com.jobtracker.executionstore.migration;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcOperations;

/**
 * Session-scoped {@code GET_LOCK} held on a connection of its own.
 *
 * <p>The work runs on other connections, so its transaction is committed or rolled back before
 * {@code RELEASE_LOCK} is issued. Must be called outside of any transaction.
 */
@RequiredArgsConstructor
class MigrationLock {

  private static final Logger logger = LoggerFactory.getLogger(MigrationLock.class);

  static final String NAME = "schema_evolutions";

  static final String ACQUIRE_SQL = "SELECT GET_LOCK(?, ?)";

  static final String RELEASE_SQL = "SELECT RELEASE_LOCK(?)";

  private final JdbcOperations jdbcOperations;
  private final Duration timeout;

  /**
   * Runs {@code work} while holding the lock.
   *
   * @throws SchemaMigrationException if the lock is not obtained within the timeout
   */
  <T> T runExclusively(Supplier<T> work) {
    return jdbcOperations.execute((ConnectionCallback<T>) connection -> runHolding(connection, work));
  }

  private <T> T runHolding(Connection connection, Supplier<T> work) throws SQLException {
    acquire(connection);
    final T result;
    try {
      result = work.get();
    } catch (RuntimeException ex) {
      try {
        release(connection);
      } catch (SQLException releaseFailure) {
        ex.addSuppressed(releaseFailure);
      }
      throw ex;
    }
    release(connection);
    return result;
  }

  private void acquire(Connection connection) throws SQLException {
    try (PreparedStatement statement = connection.prepareStatement(ACQUIRE_SQL)) {
      statement.setString(1, NAME);
      statement.setLong(2, timeout.toSeconds());
      try (ResultSet rs = statement.executeQuery()) {
        // 1=取得、0=タイムアウト、NULL=エラー
        if (!rs.next() || rs.getInt(1) != 1) {
          throw new SchemaMigrationException(
              "could not acquire schema migration lock within " + timeout);
        }
      }
    }
    logger.debug("schema migration lock acquired name={}", NAME);
  }

  private void release(Connection connection) throws SQLException {
    try (PreparedStatement statement = connection.prepareStatement(RELEASE_SQL)) {
      statement.setString(1, NAME);
      try (ResultSet rs = statement.executeQuery()) {
        if (!rs.next() || rs.getInt(1) != 1) {
          logger.warn("schema migration lock was not held at release name={}", NAME);
        }
      }
    }
  }
}
