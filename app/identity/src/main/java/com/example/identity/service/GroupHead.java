package com.example.identity.service;

import com.example.identity.model.ContactRecord;
import java.util.Objects;

/**
 * グループの代表。
 *
 * <p>groupId は secondary が linkedId で指す id。primary は代表として扱うレコードで、本来の primary が不可視の場合は
 * グループ内の最古レコードが入る。
 */
public record GroupHead(long groupId, ContactRecord primary) {

  public GroupHead {
    Objects.requireNonNull(primary, "primary");
  }

  public static GroupHead of(ContactRecord primary) {
    return new GroupHead(primary.groupId(), primary);
  }

  /** 本来の primary が見えず、最古レコードを代用しているか。 */
  public boolean isFallback() {
    return !primary.isPrimary() || primary.id() != groupId;
  }
}
