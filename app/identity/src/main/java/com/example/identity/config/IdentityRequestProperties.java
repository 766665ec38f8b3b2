/*
 * どこで: Identity 設定
 * 何を: /identify 入力の正規化と長さ上限を保持する
 * なぜ: カラム長と入力検証の上限を環境ごとに揃えて調整できるようにするため
 */
package com.example.identity.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "identity.request")
public record IdentityRequestProperties(
    Integer emailMaxLength, Integer phoneNumberMaxLength, Boolean trimInput) {

  public IdentityRequestProperties {
    emailMaxLength = emailMaxLength == null || emailMaxLength <= 0 ? 320 : emailMaxLength;
    phoneNumberMaxLength =
        phoneNumberMaxLength == null || phoneNumberMaxLength <= 0 ? 32 : phoneNumberMaxLength;
    trimInput = trimInput == null || trimInput;
  }

  public static IdentityRequestProperties defaults() {
    return new IdentityRequestProperties(null, null, null);
  }
}
