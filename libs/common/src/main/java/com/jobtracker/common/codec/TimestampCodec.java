/*
 * どこで: Common 型変換
 * 何を: LocalDateTime(UTC) と JDBC Timestamp を相互変換する
 * なぜ: JVM や DB のタイムゾーン設定に依存せず、常に UTC の epoch millis で受け渡すため
 */
package com.jobtracker.common.codec;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

public final class TimestampCodec implements Codec<LocalDateTime, Timestamp> {

  public static final TimestampCodec UTC = new TimestampCodec();

  private TimestampCodec() {}

  // 前提: LocalDateTime は UTC の壁時計として解釈する。ミリ秒未満は切り捨てる
  @Override
  public Timestamp encode(LocalDateTime value) {
    return value == null ? null : new Timestamp(value.toInstant(ZoneOffset.UTC).toEpochMilli());
  }

  @Override
  public LocalDateTime decode(Timestamp stored) {
    return stored == null
        ? null
        : LocalDateTime.ofInstant(Instant.ofEpochMilli(stored.getTime()), ZoneOffset.UTC);
  }
}
