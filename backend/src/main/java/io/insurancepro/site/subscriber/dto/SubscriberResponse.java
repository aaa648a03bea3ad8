package io.insurancepro.site.subscriber.dto;

import io.insurancepro.site.subscriber.Subscriber;
import io.insurancepro.site.subscriber.SubscriberStatus;
import java.time.Instant;
import java.util.UUID;

public record SubscriberResponse(
    UUID id,
    String email,
    String name,
    String phone,
    String insuranceType,
    SubscriberStatus status,
    Instant subscribedAt,
    Instant lastCampaignSentAt) {

  public static SubscriberResponse from(Subscriber subscriber) {
    return new SubscriberResponse(
        subscriber.getId(),
        subscriber.getEmail(),
        subscriber.getName(),
        subscriber.getPhone(),
        subscriber.getInsuranceType(),
        subscriber.getStatus(),
        subscriber.getSubscribedAt(),
        subscriber.getLastCampaignSentAt());
  }
}
