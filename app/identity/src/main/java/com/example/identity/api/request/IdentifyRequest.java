/*
 * どこで: app/identity/src/main/java/com/example/identity/api/request/IdentifyRequest.java
 * 何を: POST /identify の入力 DTO
 * なぜ: 解決対象の連絡先情報を API 境界で明示するため
 */
package com.example.identity.api.request;

public record IdentifyRequest(String email, String phoneNumber) {}
