package io.insurancepro.site.email;

/** Outcome of a single delivery attempt. */
public record SendResult(boolean success, String messageId, String errorMessage) {

  public static SendResult delivered(String messageId) {
    return new SendResult(true, messageId, null);
  }

  public static SendResult failed(String errorMessage) {
    return new SendResult(false, null, errorMessage);
  }
}
