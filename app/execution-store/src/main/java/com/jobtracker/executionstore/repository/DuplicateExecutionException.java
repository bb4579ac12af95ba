/*
 * どこで: Execution store データアクセス
 * 何を: 同一 id の実行記録が既に存在することを表す例外を定義する
 * なぜ: 一般的な I/O 失敗と区別し、呼び出し側が重複送信として扱えるようにするため
 */
package com.jobtracker.executionstore.repository;

public class DuplicateExecutionException extends RuntimeException {

  private final String executionId;

  public DuplicateExecutionException(String executionId, Throwable cause) {
    super("execution already logged id=" + executionId, cause);
    this.executionId = executionId;
  }

  public String getExecutionId() {
    return executionId;
  }
}
