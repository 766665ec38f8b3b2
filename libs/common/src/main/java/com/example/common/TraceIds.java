package com.example.common;

import java.util.UUID;

public final class TraceIds {
  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  /** 呼び出し元から受け取った ID が空なら新規採番する。 */
  public static String resolve(String candidate) {
    if (candidate == null || candidate.isBlank()) {
      return newTraceId();
    }
    return candidate.trim();
  }
}
