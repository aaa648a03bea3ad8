package io.insurancepro.site.subscriber;

public enum SubscribeOutcome {
  SUBSCRIBED("Thank you for subscribing! You will receive our latest updates."),
  REACTIVATED("Welcome back! Your subscription has been reactivated."),
  ALREADY_SUBSCRIBED("You are already subscribed!");

  private final String message;

  SubscribeOutcome(String message) {
    this.message = message;
  }

  public String message() {
    return message;
  }

  /** True when the call changed state. */
  public boolean isChange() {
    return this != ALREADY_SUBSCRIBED;
  }
}
