/*
 * どこで: app/identity/src/main/java/com/example/identity/model/ContactRecord.java
 * 何を: contacts テーブル相当のドメインレコード
 * なぜ: 同一人物グループの判定に必要な全項目を型付きで受け渡すため
 */
package com.example.identity.model;

import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

public record ContactRecord(
    long id,
    String email,
    String phoneNumber,
    Long linkedId,
    LinkPrecedence linkPrecedence,
    Instant createdAt,
    Instant updatedAt,
    Instant deletedAt) {

  /** 作成順。createdAt が同値なら採番順の id で決める。 */
  public static final Comparator<ContactRecord> CREATION_ORDER =
      Comparator.comparing(ContactRecord::createdAt).thenComparingLong(ContactRecord::id);

  public ContactRecord {
    Objects.requireNonNull(linkPrecedence, "linkPrecedence");
    Objects.requireNonNull(createdAt, "createdAt");
    if (email == null && phoneNumber == null) {
      throw new IllegalStateException(
          "contact " + id + " has neither email nor phoneNumber");
    }
  }

  public boolean isPrimary() {
    return linkPrecedence == LinkPrecedence.PRIMARY;
  }

  /** このレコードが属するグループの primary id。 */
  public long groupId() {
    return linkedId != null ? linkedId : id;
  }

  public boolean hasSameContactData(ContactObservation observation) {
    return Objects.equals(email, observation.email())
        && Objects.equals(phoneNumber, observation.phoneNumber());
  }

  public boolean isOlderThan(ContactRecord other) {
    return CREATION_ORDER.compare(this, other) < 0;
  }
}
