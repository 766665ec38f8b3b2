package com.example.identity.service;

import com.example.identity.api.response.ContactSummary;
import com.example.identity.model.ContactRecord;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** 1 グループ分のメンバーを外部公開用の集約ビューへ変換する。 */
@Component
@RequiredArgsConstructor
public class ContactViewConsolidator {

  private final PrimaryContactSelector primarySelector;

  public ContactSummary consolidate(List<ContactRecord> members) {
    final List<ContactRecord> ordered = new ArrayList<>(members);
    ordered.sort(ContactRecord.CREATION_ORDER);
    final ContactRecord primary = primarySelector.selectPrimary(ordered);

    final List<Long> secondaryIds =
        ordered.stream().map(ContactRecord::id).filter(id -> id != primary.id()).toList();
    return new ContactSummary(
        primary.id(),
        primaryFirst(primary, ordered, ContactRecord::email),
        primaryFirst(primary, ordered, ContactRecord::phoneNumber),
        secondaryIds);
  }

  private List<String> primaryFirst(
      ContactRecord primary, List<ContactRecord> ordered, Function<ContactRecord, String> field) {
    final Set<String> values = new LinkedHashSet<>();
    final String primaryValue = field.apply(primary);
    if (primaryValue != null) {
      values.add(primaryValue);
    }
    for (ContactRecord member : ordered) {
      final String value = field.apply(member);
      if (value != null) {
        values.add(value);
      }
    }
    return List.copyOf(values);
  }
}
