/*
 * どこで: Identity API
 * 何を: merge 中に対象 primary が別リクエストで変更されていたことを表す例外
 * なぜ: 再試行可能な競合 (409) として呼び出し側へ返すため
 */
package com.example.identity.api;

public class ConcurrentContactUpdateException extends RuntimeException {

  public ConcurrentContactUpdateException(String message) {
    super(message);
  }
}
