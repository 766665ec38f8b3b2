/*
 * どこで: Identity API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ 4xx/5xx でも再試行可否などを呼び出し側が区別できるようにするため
 */
package com.example.identity.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  CONCURRENT_UPDATE,
  STORE_UNAVAILABLE,
  INTERNAL_ERROR
}
