package com.example.identity.service;

import com.example.identity.model.ContactObservation;
import com.example.identity.model.ContactRecord;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 観測に一致したレコードが属するグループ全体 (最大 2 グループ想定)。
 *
 * <p>レコードは id で重複排除され、作成順に並ぶ。空なら一致なし。
 */
public record CandidateGroups(List<ContactRecord> records) {

  public CandidateGroups {
    final Map<Long, ContactRecord> byId = new LinkedHashMap<>();
    for (ContactRecord record : records) {
      byId.putIfAbsent(record.id(), record);
    }
    final List<ContactRecord> sorted = new ArrayList<>(byId.values());
    sorted.sort(ContactRecord.CREATION_ORDER);
    records = List.copyOf(sorted);
  }

  public static CandidateGroups noMatch() {
    return new CandidateGroups(List.of());
  }

  public boolean isNoMatch() {
    return records.isEmpty();
  }

  /** 含まれるグループの primary id を作成順で返す。 */
  public Set<Long> groupIds() {
    final Set<Long> ids = new LinkedHashSet<>();
    for (ContactRecord record : records) {
      ids.add(record.groupId());
    }
    return ids;
  }

  /** primaryId 自身と、primaryId へリンクしているレコード。 */
  public List<ContactRecord> membersOf(long primaryId) {
    return records.stream()
        .filter(r -> r.id() == primaryId || Objects.equals(r.linkedId(), primaryId))
        .toList();
  }

  public Optional<ContactRecord> findById(long id) {
    return records.stream().filter(r -> r.id() == id).findFirst();
  }

  public Optional<ContactRecord> findExactDuplicate(ContactObservation observation) {
    return records.stream().filter(r -> r.hasSameContactData(observation)).findFirst();
  }

  public Optional<ContactRecord> firstWithEmail(String email) {
    if (email == null) {
      return Optional.empty();
    }
    return records.stream().filter(r -> email.equals(r.email())).findFirst();
  }

  public Optional<ContactRecord> firstWithPhoneNumber(String phoneNumber) {
    if (phoneNumber == null) {
      return Optional.empty();
    }
    return records.stream().filter(r -> phoneNumber.equals(r.phoneNumber())).findFirst();
  }

  public Optional<ContactRecord> firstPrimary() {
    return records.stream().filter(ContactRecord::isPrimary).findFirst();
  }

  public ContactRecord earliest() {
    if (records.isEmpty()) {
      throw new IllegalStateException("no candidate contacts");
    }
    return records.get(0);
  }
}
