/*
 * どこで: 共通ユーティリティ
 * 何を: JDBC で扱う Instant と Timestamp を相互に明示変換する
 * なぜ: PostgreSQL JDBC が Instant の型推論に失敗するケースを回避するため
 */
package com.example.common;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // 前提: Instant は UTC を表現するため Timestamp.from で UTC のまま渡す
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }

  // NULL 許容カラム (deleted_at 等) をそのまま Optional 無しで読むための補助
  public static Instant readInstant(ResultSet rs, String column) throws SQLException {
    return toInstant(rs.getTimestamp(column));
  }
}
