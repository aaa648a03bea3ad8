package io.insurancepro.site.subscriber;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Audience of a campaign, expressed as the subscriber statuses it selects. Both segments select
 * ACTIVE only: a subscriber that unsubscribed or bounced is never mailed.
 */
public enum TargetSegment {
  ALL(EnumSet.of(SubscriberStatus.ACTIVE)),
  ACTIVE(EnumSet.of(SubscriberStatus.ACTIVE));

  private final Set<SubscriberStatus> statuses;

  TargetSegment(Set<SubscriberStatus> statuses) {
    this.statuses = statuses;
  }

  public Set<SubscriberStatus> statuses() {
    return statuses;
  }

  /** Case-insensitive lookup; null or unknown values select ALL. */
  public static TargetSegment fromValue(String value) {
    if (value == null || value.isBlank()) {
      return ALL;
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      return ALL;
    }
  }
}
