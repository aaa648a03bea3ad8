package io.insurancepro.site.contact.dto;

import io.insurancepro.site.contact.ContactMessage;
import java.time.Instant;
import java.util.UUID;

public record ContactMessageResponse(
    UUID id,
    String name,
    String email,
    String phone,
    String subject,
    String message,
    Instant createdAt,
    boolean read) {

  public static ContactMessageResponse from(ContactMessage message) {
    return new ContactMessageResponse(
        message.getId(),
        message.getName(),
        message.getEmail(),
        message.getPhone(),
        message.getSubject(),
        message.getMessage(),
        message.getCreatedAt(),
        message.isRead());
  }
}
