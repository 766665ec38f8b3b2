/*
 * どこで: Identity アプリのエントリポイント
 * 何を: Spring Boot の起動と設定スキャンを行う
 * なぜ: 設定クラスと共通の Clock 設定をまとめて有効化するため
 */
package com.example.identity;

import com.example.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class IdentityApplication {

  public static void main(String[] args) {
    SpringApplication.run(IdentityApplication.class, args);
  }
}
