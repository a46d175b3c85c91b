/*
 * どこで: 共通ユーティリティ
 * 何を: JDBC の timestamptz と Instant を相互変換する
 * なぜ: PostgreSQL JDBC の型推論に頼らず、常に UTC で読み書きするため
 */
package com.seatgate.common;

import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // 前提: Instant は UTC を表現するため Timestamp.from で UTC のまま渡す
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  // NULL 許容カラムでも呼べるようにする
  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
