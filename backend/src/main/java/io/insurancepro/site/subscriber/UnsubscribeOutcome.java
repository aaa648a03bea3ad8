package io.insurancepro.site.subscriber;

public enum UnsubscribeOutcome {
  UNSUBSCRIBED,
  NOT_FOUND
}
