package io.insurancepro.site.email;

/**
 * An unsubscribe link that cannot be honoured. Public callers see a single "invalid or expired"
 * outcome; the subclasses say which.
 */
public abstract class UnsubscribeTokenException extends RuntimeException {

  protected UnsubscribeTokenException(String message) {
    super(message);
  }
}
