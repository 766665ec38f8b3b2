package com.example.identity.repository;

import com.example.identity.model.ContactRecord;
import com.example.identity.model.LinkPrecedence;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;

/** テスト用の ContactRepository。JDBC 実装と同じ可視性・並び順で返す。 */
public class InMemoryContactRepository implements ContactRepository {

  private final Map<Long, ContactRecord> contacts = new TreeMap<>();
  private final AtomicInteger writeCount = new AtomicInteger();
  private long nextId = 1;

  /** 任意の id / createdAt を持つレコードを直接登録する。 */
  public synchronized ContactRecord seed(
      long id,
      String email,
      String phoneNumber,
      Long linkedId,
      LinkPrecedence linkPrecedence,
      Instant createdAt) {
    final ContactRecord record =
        new ContactRecord(
            id, email, phoneNumber, linkedId, linkPrecedence, createdAt, createdAt, null);
    contacts.put(id, record);
    nextId = Math.max(nextId, id + 1);
    return record;
  }

  public synchronized void markDeleted(long id, Instant deletedAt) {
    final ContactRecord current = contacts.get(id);
    contacts.put(
        id,
        new ContactRecord(
            current.id(),
            current.email(),
            current.phoneNumber(),
            current.linkedId(),
            current.linkPrecedence(),
            current.createdAt(),
            current.updatedAt(),
            deletedAt));
  }

  public synchronized ContactRecord get(long id) {
    return contacts.get(id);
  }

  public synchronized List<ContactRecord> all() {
    return contacts.values().stream().sorted(ContactRecord.CREATION_ORDER).toList();
  }

  public int writeCount() {
    return writeCount.get();
  }

  @Override
  public synchronized List<ContactRecord> findByMatch(String email, String phoneNumber) {
    if (email == null && phoneNumber == null) {
      return List.of();
    }
    return visible().stream()
        .filter(
            r ->
                (email != null && email.equals(r.email()))
                    || (phoneNumber != null && phoneNumber.equals(r.phoneNumber())))
        .toList();
  }

  @Override
  public synchronized List<ContactRecord> findByGroupIds(Collection<Long> primaryIds) {
    return visible().stream()
        .filter(
            r ->
                primaryIds.contains(r.id())
                    || (r.linkedId() != null && primaryIds.contains(r.linkedId())))
        .toList();
  }

  @Override
  public synchronized List<ContactRecord> lockByIds(Collection<Long> ids) {
    return visible().stream()
        .filter(r -> ids.contains(r.id()))
        .sorted((a, b) -> Long.compare(a.id(), b.id()))
        .toList();
  }

  @Override
  public synchronized ContactRecord insert(
      String email,
      String phoneNumber,
      Long linkedId,
      LinkPrecedence linkPrecedence,
      Instant createdAt) {
    writeCount.incrementAndGet();
    final long id = nextId++;
    final ContactRecord record =
        new ContactRecord(
            id, email, phoneNumber, linkedId, linkPrecedence, createdAt, createdAt, null);
    contacts.put(id, record);
    return record;
  }

  @Override
  public synchronized int demoteToSecondary(long contactId, long primaryId, Instant updatedAt) {
    final ContactRecord current = contacts.get(contactId);
    if (current == null || current.deletedAt() != null || !current.isPrimary()) {
      return 0;
    }
    writeCount.incrementAndGet();
    contacts.put(
        contactId,
        new ContactRecord(
            current.id(),
            current.email(),
            current.phoneNumber(),
            primaryId,
            LinkPrecedence.SECONDARY,
            current.createdAt(),
            updatedAt,
            null));
    return 1;
  }

  @Override
  public synchronized int relinkSecondaries(
      long fromPrimaryId, long toPrimaryId, Instant updatedAt) {
    int updated = 0;
    for (ContactRecord current : List.copyOf(contacts.values())) {
      if (current.deletedAt() == null && Objects.equals(current.linkedId(), fromPrimaryId)) {
        contacts.put(
            current.id(),
            new ContactRecord(
                current.id(),
                current.email(),
                current.phoneNumber(),
                toPrimaryId,
                current.linkPrecedence(),
                current.createdAt(),
                updatedAt,
                null));
        updated++;
      }
    }
    if (updated > 0) {
      writeCount.incrementAndGet();
    }
    return updated;
  }

  private List<ContactRecord> visible() {
    return contacts.values().stream()
        .filter(r -> r.deletedAt() == null)
        .sorted(ContactRecord.CREATION_ORDER)
        .toList();
  }
}
