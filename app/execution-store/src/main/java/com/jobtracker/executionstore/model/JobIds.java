/*
 * どこで: Execution store ドメインモデル
 * 何を: ジョブ ID が executions.job / paused_jobs.id に格納できるかを判定する
 * なぜ: 列が utf8mb3 のため、絵文字などの補助文字を含む ID を DB エラーではなく入力エラーとして弾くため
 */
package com.jobtracker.executionstore.model;

public final class JobIds {

  /** Column width of the job id columns, in characters. */
  public static final int MAX_LENGTH = 1000;

  private JobIds() {}

  public static boolean isStorable(String jobId) {
    return jobId.length() <= MAX_LENGTH
        && jobId.codePoints().noneMatch(Character::isSupplementaryCodePoint);
  }

  /**
   * Returns {@code jobId} when the job id columns can hold it.
   *
   * @throws IllegalArgumentException if it is longer than {@value #MAX_LENGTH} characters or
   *     contains characters outside the Basic Multilingual Plane
   */
  public static String requireStorable(String jobId, String name) {
    if (jobId.length() > MAX_LENGTH) {
      throw new IllegalArgumentException(name + " must be at most " + MAX_LENGTH + " characters");
    }
    if (jobId.codePoints().anyMatch(Character::isSupplementaryCodePoint)) {
      throw new IllegalArgumentException(
          name + " must not contain characters outside the Basic Multilingual Plane");
    }
    return jobId;
  }
}
