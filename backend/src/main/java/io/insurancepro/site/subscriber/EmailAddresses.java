package io.insurancepro.site.subscriber;

import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import java.util.Locale;

/** Syntax checks and canonical form for subscriber addresses. */
public final class EmailAddresses {

  private static final int MAX_LENGTH = 120;

  private EmailAddresses() {}

  /** Trimmed, lower-cased form used as the subscriber identity. */
  public static String normalize(String email) {
    return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
  }

  /**
   * Accepts a bare {@code local@domain.tld} address: no display name, no route, and a domain with
   * at least one dot that neither starts nor ends with one.
   */
  public static boolean isValid(String email) {
    if (email == null || email.isBlank() || email.length() > MAX_LENGTH) {
      return false;
    }
    String candidate = email.trim();
    try {
      var address = new InternetAddress(candidate, true);
      address.validate();
      if (!candidate.equals(address.getAddress())) {
        return false;
      }
    } catch (AddressException e) {
      return false;
    }

    int at = candidate.lastIndexOf('@');
    if (at <= 0) {
      return false;
    }
    String domain = candidate.substring(at + 1);
    return domain.indexOf('.') > 0 && !domain.endsWith(".") && !domain.contains("..");
  }
}
