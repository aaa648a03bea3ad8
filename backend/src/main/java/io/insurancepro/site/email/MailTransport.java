package io.insurancepro.site.email;

/**
 * Port for handing a rendered email to the outbound relay. Implementations make exactly one attempt
 * per call and report failures through {@link SendResult} instead of throwing.
 */
public interface MailTransport {

  SendResult deliver(EmailMessage message);
}
