package com.example.identity.service;

import com.example.identity.model.ContactRecord;
import java.util.List;
import java.util.Objects;

public record LinkOutcome(LinkAction action, List<ContactRecord> members) {

  public LinkOutcome {
    Objects.requireNonNull(action, "action");
    members = List.copyOf(members);
    if (members.isEmpty()) {
      throw new IllegalStateException("link outcome must contain at least one contact");
    }
  }
}
