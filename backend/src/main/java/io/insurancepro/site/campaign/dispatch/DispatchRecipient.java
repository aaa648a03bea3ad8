package io.insurancepro.site.campaign.dispatch;

import io.insurancepro.site.subscriber.Subscriber;
import java.util.UUID;

/** Snapshot of one recipient taken when the dispatch starts. */
public record DispatchRecipient(UUID subscriberId, String email) {

  public static DispatchRecipient from(Subscriber subscriber) {
    return new DispatchRecipient(subscriber.getId(), subscriber.getEmail());
  }
}
