package com.example.identity.model;

/**
 * 解決対象として受け取った email / phoneNumber の組。
 *
 * <p>少なくとも一方は非 null。空文字は入力検証の段階で null に正規化済み。
 */
public record ContactObservation(String email, String phoneNumber) {

  public ContactObservation {
    if (email == null && phoneNumber == null) {
      throw new IllegalArgumentException("email or phoneNumber is required");
    }
  }

  public boolean hasEmail() {
    return email != null;
  }

  public boolean hasPhoneNumber() {
    return phoneNumber != null;
  }

  public boolean hasBoth() {
    return hasEmail() && hasPhoneNumber();
  }
}
