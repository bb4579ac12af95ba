/*
 * どこで: Execution store スキーマ移行
 * 何を: スキーマ移行の失敗を表す例外を定義する
 * なぜ: 状態不明のスキーマでクエリを受け付けないよう、起動を中断させるため
 */
package com.jobtracker.executionstore.migration;

public class SchemaMigrationException extends RuntimeException {

  public SchemaMigrationException(String message) {
    super(message);
  }

  public SchemaMigrationException(String message, Throwable cause) {
    super(message, cause);
  }
}
