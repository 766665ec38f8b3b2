/*
 * どこで: Identity API
 * 何を: ルートと /health の簡易ヘルスレスポンスを返す
 * なぜ: 既存クライアントの死活確認エンドポイントを維持するため
 */
package com.example.identity.api;

import com.example.identity.api.response.HealthResponse;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class StatusController {

  private final Clock clock;

  @GetMapping("/")
  public String home() {
    return "identity: ok";
  }

  @GetMapping("/health")
  public HealthResponse health() {
    return new HealthResponse("OK", Instant.now(clock));
  }
}
