package com.example.identity.api.response;

import java.util.Objects;

public record IdentifyResponse(ContactSummary contact) {

  public IdentifyResponse {
    Objects.requireNonNull(contact, "contact");
  }
}
