/*
 * どこで: app/identity/src/main/java/com/example/identity/api/IdentifyController.java
 * 何を: 連絡先の同一人物解決 API を提供するコントローラー
 * なぜ: email / phoneNumber の観測を受け付ける入口を明確化するため
 */
package com.example.identity.api;

import com.example.identity.api.request.IdentifyRequest;
import com.example.identity.api.response.IdentifyResponse;
import com.example.identity.service.IdentifyService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class IdentifyController {

  private final IdentifyService identifyService;

  /**
   * 役割:
   * - email / phoneNumber の少なくとも一方を受け取り、所属する同一人物グループを解決する。
   *
   * 期待動作:
   * - 未知の連絡先なら新しい primary を作り、既知なら既存グループへ紐付ける。
   * - 別々の primary に属する email と phoneNumber が揃った場合は古い primary へ統合する。
   * - Service の集約結果をそのまま返却する。
   */
  @PostMapping("/identify")
  public ResponseEntity<IdentifyResponse> identify(@RequestBody IdentifyRequest request) {
    return ResponseEntity.ok(identifyService.identify(request));
  }
}
