package io.insurancepro.site.email;

import java.util.Map;
import java.util.Objects;

/**
 * One outbound email for one recipient. The HTML body is mandatory; the plain-text body is an
 * optional alternative part. {@code headers} carries extra MIME headers such as List-Unsubscribe.
 */
public record EmailMessage(
    String to, String subject, String htmlBody, String plainTextBody, Map<String, String> headers) {

  public EmailMessage {
    Objects.requireNonNull(to, "to");
    Objects.requireNonNull(subject, "subject");
    Objects.requireNonNull(htmlBody, "htmlBody");
    headers = headers == null ? Map.of() : Map.copyOf(headers);
  }

  /**
   * Campaign message with RFC 8058 one-click unsubscribe headers pointing at {@code
   * unsubscribeUrl}.
   */
  public static EmailMessage withUnsubscribe(
      String to, String subject, String htmlBody, String plainTextBody, String unsubscribeUrl) {
    Objects.requireNonNull(unsubscribeUrl, "unsubscribeUrl");
    return new EmailMessage(
        to,
        subject,
        htmlBody,
        plainTextBody,
        Map.of(
            "List-Unsubscribe", "<" + unsubscribeUrl + ">",
            "List-Unsubscribe-Post", "List-Unsubscribe=One-Click"));
  }
}
