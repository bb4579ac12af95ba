/*
 * どこで: Execution store データアクセス
 * 何を: paused_jobs による一時停止ジョブの登録/解除/参照を行う
 * なぜ: 管理操作で止めたジョブをスケジューラと API が同じ集合として参照するため
 */
package com.jobtracker.executionstore.repository;

import com.jobtracker.executionstore.model.JobIds;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

@Repository
@RequiredArgsConstructor
public class JobPauseStore {

  private static final String DELETE_SQL = "DELETE FROM paused_jobs WHERE id = :id";

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final TransactionTemplate transactionTemplate;

  /**
   * Marks the job as paused; pausing an already paused job keeps a single marker.
   *
   * @throws IllegalArgumentException if the id cannot be stored, see {@link JobIds}
   */
  public void pauseJob(String jobId) {
    JobIds.requireStorable(jobId, "jobId");
    final String sql = "INSERT INTO paused_jobs (id) VALUES (:id)";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", jobId);
    // 削除と再登録を同一トランザクションにし、途中の「未停止」状態を他から見せない
    transactionTemplate.executeWithoutResult(
        status -> {
          jdbcTemplate.update(DELETE_SQL, params);
          jdbcTemplate.update(sql, params);
        });
  }

  /** Removes the marker; unpausing a job that is not paused does nothing. */
  public void unpauseJob(String jobId) {
    // 格納できない ID は停止登録もされていない
    if (!JobIds.isStorable(jobId)) {
      return;
    }
    jdbcTemplate.update(DELETE_SQL, new MapSqlParameterSource().addValue("id", jobId));
  }

  public Set<String> getPausedJobIds() {
    final String sql = "SELECT id FROM paused_jobs";
    return Set.copyOf(jdbcTemplate.queryForList(sql, new MapSqlParameterSource(), String.class));
  }

  public boolean isPaused(String jobId) {
    if (!JobIds.isStorable(jobId)) {
      return false;
    }
    final String sql = "SELECT COUNT(*) FROM paused_jobs WHERE id = :id";
    final Integer count =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource().addValue("id", jobId), Integer.class);
    return count != null && count > 0;
  }
}
