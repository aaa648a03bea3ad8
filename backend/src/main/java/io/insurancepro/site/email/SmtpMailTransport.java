package io.insurancepro.site.email;

import io.insurancepro.site.config.MailConfig.MailTransportProperties;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

/**
 * SMTP transport backed by {@link JavaMailSender}. Each call opens a connection, upgrades it with
 * STARTTLS when configured, authenticates, sends one multipart/alternative message and closes.
 *
 * <p>Without a username and password the transport refuses to connect at all and every delivery
 * fails immediately.
 */
@Component
public class SmtpMailTransport implements MailTransport {

  private static final Logger log = LoggerFactory.getLogger(SmtpMailTransport.class);

  private final JavaMailSender mailSender;
  private final MailTransportProperties properties;

  public SmtpMailTransport(JavaMailSender mailSender, MailTransportProperties properties) {
    this.mailSender = mailSender;
    this.properties = properties;
  }

  @Override
  public SendResult deliver(EmailMessage message) {
    if (!properties.hasCredentials()) {
      log.warn("SMTP credentials not configured, not sending to {}", message.to());
      return SendResult.failed("SMTP credentials not configured");
    }

    try {
      MimeMessage mimeMessage = mailSender.createMimeMessage();
      populateMessage(new MimeMessageHelper(mimeMessage, true, "UTF-8"), message);
      mailSender.send(mimeMessage);
      String messageId = mimeMessage.getMessageID();
      log.debug("SMTP email sent to {} with Message-ID: {}", message.to(), messageId);
      return SendResult.delivered(messageId);
    } catch (MailException | MessagingException e) {
      log.error("Failed to send SMTP email to {}: {}", message.to(), e.getMessage());
      return SendResult.failed(e.getMessage());
    }
  }

  private void populateMessage(MimeMessageHelper helper, EmailMessage message)
      throws MessagingException {
    helper.setFrom(properties.fromAddress());
    helper.setTo(message.to());
    helper.setSubject(message.subject());
    if (message.plainTextBody() != null && !message.plainTextBody().isBlank()) {
      helper.setText(message.plainTextBody(), message.htmlBody());
    } else {
      helper.setText(message.htmlBody(), true);
    }

    MimeMessage mimeMessage = helper.getMimeMessage();
    for (Map.Entry<String, String> header : message.headers().entrySet()) {
      mimeMessage.setHeader(header.getKey(), header.getValue());
    }
  }
}
