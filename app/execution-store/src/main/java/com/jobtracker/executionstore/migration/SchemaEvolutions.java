/*
 * どこで: Execution store スキーマ移行
 * 何を: リリース済みのスキーマ進化を適用順に列挙する
 * なぜ: 添字がそのままバージョン番号になるため
 */
package com.jobtracker.executionstore.migration;

import java.util.List;

public final class SchemaEvolutions {

  // 既存エントリの編集・並べ替えは禁止。末尾への追加のみ行う
  // MySQL の DDL は文ごとに暗黙コミットされるため、各文は途中で失敗した後の再実行でも成功する形で書く
  // ジョブ ID 列は 3 byte 文字セットにして、1000 文字でも InnoDB のキー長上限(3072 byte)に収める
  private static final List<SchemaEvolution> ALL =
      List.of(
          SchemaEvolution.of(
              "create executions and paused_jobs",
              """
              CREATE TABLE IF NOT EXISTS executions (
                id          CHAR(36) NOT NULL,
                job         VARCHAR(1000) CHARACTER SET utf8mb3 COLLATE utf8mb3_bin NOT NULL,
                start_time  DATETIME NOT NULL,
                end_time    DATETIME NOT NULL,
                context     JSON NOT NULL,
                success     BOOLEAN NOT NULL,
                PRIMARY KEY (id),
                INDEX execution_by_job (job),
                INDEX execution_by_start_time (start_time)
              ) ENGINE = INNODB
              """,
              """
              CREATE TABLE IF NOT EXISTS paused_jobs (
                id          VARCHAR(1000) CHARACTER SET utf8mb3 COLLATE utf8mb3_bin NOT NULL,
                PRIMARY KEY (id)
              ) ENGINE = INNODB
              """),
          SchemaEvolution.of(
              "store execution times with millisecond precision",
              """
              ALTER TABLE executions
                MODIFY start_time DATETIME(3) NOT NULL,
                MODIFY end_time   DATETIME(3) NOT NULL
              """));

  private SchemaEvolutions() {}

  public static List<SchemaEvolution> all() {
    return ALL;
  }

  public static int latestVersion() {
    return ALL.size();
  }
}
