/*
 * どこで: Identity API
 * 何を: email / phoneNumber がどちらも無い等、解決前に弾く入力エラー
 * なぜ: ストアへ触れる前に 400 として確定させるため
 */
package com.example.identity.api;

public class InvalidObservationException extends IllegalArgumentException {

  public InvalidObservationException(String message) {
    super(message);
  }
}
