package io.insurancepro.site.email;

/** Malformed token, wrong purpose, or a signature that does not match. */
public class InvalidUnsubscribeTokenException extends UnsubscribeTokenException {

  public InvalidUnsubscribeTokenException(String message) {
    super(message);
  }
}
