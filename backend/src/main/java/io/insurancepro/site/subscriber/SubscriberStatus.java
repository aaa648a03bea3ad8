package io.insurancepro.site.subscriber;

/** Mailing state of a subscriber. Only ACTIVE subscribers receive campaigns. */
public enum SubscriberStatus {
  ACTIVE,

  /** Opted out through an unsubscribe link. Re-subscribing reactivates the same record. */
  UNSUBSCRIBED,

  /** Address rejected by the receiving side. Excluded from every segment. */
  BOUNCED
}
