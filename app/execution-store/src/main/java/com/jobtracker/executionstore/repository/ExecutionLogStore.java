/*
 * どこで: Execution store データアクセス
 * 何を: executions への実行記録の追加と履歴照会を行う
 * なぜ: スケジューラの書き込みとダッシュボードの集計で同じ型付き記録を扱うため
 */
package com.jobtracker.executionstore.repository;

import com.jobtracker.common.codec.JsonDocumentCodec;
import com.jobtracker.common.codec.TimestampCodec;
import com.jobtracker.executionstore.model.ExecutionRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ExecutionLogStore {

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final JsonDocumentCodec documentCodec;
  private final TimestampCodec timestampCodec = TimestampCodec.UTC;

  /**
   * Appends one finished execution.
   *
   * @throws DuplicateExecutionException if a record with the same id is already stored
   */
  public void logExecution(ExecutionRecord record) {
    final String sql =
        """
        INSERT INTO executions (id, job, start_time, end_time, context, success)
        VALUES (:id, :job, :startTime, :endTime, :context, :success)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", record.id())
            .addValue("job", record.job())
            .addValue("startTime", timestampCodec.encode(record.startTime()))
            .addValue("endTime", timestampCodec.encode(record.endTime()))
            .addValue("context", documentCodec.encode(record.context()))
            .addValue("success", record.success());
    try {
      jdbcTemplate.update(sql, params);
    } catch (DuplicateKeyException ex) {
      throw new DuplicateExecutionException(record.id(), ex);
    }
  }

  /** All executions with the given outcome, oldest end time first. */
  public List<ExecutionRecord> getExecutionLog(boolean success) {
    final String sql =
        """
        SELECT id, job, start_time, end_time, context, success
        FROM executions
        WHERE success = :success
        ORDER BY end_time, id
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("success", success);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<ExecutionRecord> getJobExecutions(String job, LocalDateTime since) {
    final String sql =
        """
        SELECT id, job, start_time, end_time, context, success
        FROM executions
        WHERE job = :job
          AND start_time >= :since
        ORDER BY start_time, id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("job", job)
            .addValue("since", timestampCodec.encode(since));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public Optional<ExecutionRecord> findExecution(String id) {
    final String sql =
        """
        SELECT id, job, start_time, end_time, context, success
        FROM executions
        WHERE id = :id
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", id);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  private ExecutionRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    // context の解析失敗は CorruptDocumentException としてそのまま伝播させる
    return new ExecutionRecord(
        rs.getString("id"),
        rs.getString("job"),
        timestampCodec.decode(rs.getTimestamp("start_time")),
        timestampCodec.decode(rs.getTimestamp("end_time")),
        documentCodec.decode(rs.getString("context")),
        rs.getBoolean("success"));
  }
}
