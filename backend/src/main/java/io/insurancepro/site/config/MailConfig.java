package io.insurancepro.site.config;

import java.time.Duration;
import java.util.Properties;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;

/**
 * Outbound mail relay wiring. Credentials live in {@link MailTransportProperties} and are handed to
 * the transport at construction; nothing reads them from ambient state.
 */
@Configuration
@EnableConfigurationProperties({MailConfig.MailTransportProperties.class, EmailProperties.class})
public class MailConfig {

  /**
   * Relay settings, bound from {@code insurancepro.mail.*}.
   *
   * @param host relay host name
   * @param port relay port (587 for submission with STARTTLS)
   * @param username SMTP AUTH user; blank disables delivery
   * @param password SMTP AUTH password; blank disables delivery
   * @param fromAddress envelope and header sender
   * @param starttls upgrade the connection before authenticating, and refuse to continue without it
   * @param connectionTimeout socket connect timeout
   * @param readTimeout socket read timeout
   */
  @ConfigurationProperties("insurancepro.mail")
  public record MailTransportProperties(
      @DefaultValue("smtp.gmail.com") String host,
      @DefaultValue("587") int port,
      String username,
      String password,
      @DefaultValue("noreply@insurancepro.com") String fromAddress,
      @DefaultValue("true") boolean starttls,
      @DefaultValue("10s") Duration connectionTimeout,
      @DefaultValue("30s") Duration readTimeout) {

    public boolean hasCredentials() {
      return username != null && !username.isBlank() && password != null && !password.isBlank();
    }
  }

  @Bean
  JavaMailSender campaignMailSender(MailTransportProperties props) {
    var sender = new JavaMailSenderImpl();
    sender.setHost(props.host());
    sender.setPort(props.port());
    sender.setUsername(props.username());
    sender.setPassword(props.password());
    sender.setDefaultEncoding("UTF-8");

    Properties javaMail = sender.getJavaMailProperties();
    javaMail.put("mail.transport.protocol", "smtp");
    javaMail.put("mail.smtp.auth", String.valueOf(props.hasCredentials()));
    javaMail.put("mail.smtp.starttls.enable", String.valueOf(props.starttls()));
    javaMail.put("mail.smtp.starttls.required", String.valueOf(props.starttls()));
    javaMail.put(
        "mail.smtp.connectiontimeout", String.valueOf(props.connectionTimeout().toMillis()));
    javaMail.put("mail.smtp.timeout", String.valueOf(props.readTimeout().toMillis()));
    javaMail.put("mail.smtp.writetimeout", String.valueOf(props.readTimeout().toMillis()));
    return sender;
  }
}
