package io.insurancepro.site.email;

import java.time.Duration;

public class ExpiredUnsubscribeTokenException extends UnsubscribeTokenException {

  public ExpiredUnsubscribeTokenException(Duration age, Duration maxAge) {
    super("Unsubscribe token is " + age.toDays() + " days old (max " + maxAge.toDays() + ")");
  }
}
