package com.example.identity.api.response;

import java.util.List;

/** 同一人物グループの集約ビュー。emails / phoneNumbers は primary の値が先頭。 */
public record ContactSummary(
    long primaryContactId,
    List<String> emails,
    List<String> phoneNumbers,
    List<Long> secondaryContactIds) {

  public ContactSummary {
    emails = emails == null ? List.of() : List.copyOf(emails);
    phoneNumbers = phoneNumbers == null ? List.of() : List.copyOf(phoneNumbers);
    secondaryContactIds =
        secondaryContactIds == null ? List.of() : List.copyOf(secondaryContactIds);
  }
}
