/*
 * どこで: 共通ユーティリティ
 * 何を: Instant と JDBC Timestamp を相互変換する
 * なぜ: TIMESTAMPTZ 列を常に明示型で読み書きし、ドライバの型推論に依存しないため
 */
package com.example.common;

import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // Instant は UTC のまま渡す。DB のタイムゾーン設定には依存しない
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
