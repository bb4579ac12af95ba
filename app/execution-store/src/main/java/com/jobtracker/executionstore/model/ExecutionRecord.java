/*
 * どこで: Execution store ドメインモデル
 * 何を: 完了したジョブ実行 1 件(executions テーブルの 1 行)を表す
 * なぜ: スケジューラからの書き込みと履歴照会で同じ不変な値を扱うため
 */
package com.jobtracker.executionstore.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * One finished job run. Times are UTC wall-clock values.
 */
public record ExecutionRecord(
    String id,
    String job,
    LocalDateTime startTime,
    LocalDateTime endTime,
    JsonNode context,
    boolean success) {

  public static final int MAX_JOB_LENGTH = JobIds.MAX_LENGTH;

  public ExecutionRecord {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(job, "job");
    Objects.requireNonNull(startTime, "startTime");
    Objects.requireNonNull(endTime, "endTime");
    Objects.requireNonNull(context, "context");
    JobIds.requireStorable(job, "job");
    if (startTime.isAfter(endTime)) {
      throw new IllegalArgumentException(
          "startTime must not be after endTime: " + startTime + " > " + endTime);
    }
    // 呼び出し側が元のノードを書き換えても記録が変わらないよう複製して保持する
    context = context.deepCopy();
  }

  /** A copy of the context document; changing it does not affect this record. */
  @Override
  public JsonNode context() {
    return context.deepCopy();
  }
}
