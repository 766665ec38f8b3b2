/*
 * どこで: app/identity/src/main/java/com/example/identity/model/LinkPrecedence.java
 * 何を: contacts.link_precedence の値を表す列挙
 * なぜ: DB 上の小文字表現とドメイン上の型を境界で変換するため
 */
package com.example.identity.model;

public enum LinkPrecedence {
  PRIMARY("primary"),
  SECONDARY("secondary");

  private final String dbValue;

  LinkPrecedence(String dbValue) {
    this.dbValue = dbValue;
  }

  public String dbValue() {
    return dbValue;
  }

  public static LinkPrecedence fromDbValue(String value) {
    for (LinkPrecedence precedence : values()) {
      if (precedence.dbValue.equals(value)) {
        return precedence;
      }
    }
    throw new IllegalStateException("unknown link_precedence: " + value);
  }
}
