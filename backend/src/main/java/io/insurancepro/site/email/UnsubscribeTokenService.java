package io.insurancepro.site.email;

import io.insurancepro.site.config.EmailProperties;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Issues and verifies the signed tokens embedded in campaign unsubscribe links.
 *
 * <p>Token layout: {@code base64url(payload) + "." + base64url(hmacSha256(payload))} where the
 * payload is {@code unsubscribe|<issuedAtEpochSeconds>|<email>}. Both segments use the URL-safe
 * alphabet without padding, so a token can sit directly in a path segment.
 */
@Service
public class UnsubscribeTokenService {

  private static final Logger log = LoggerFactory.getLogger(UnsubscribeTokenService.class);
  private static final String HMAC_ALGORITHM = "HmacSHA256";
  static final String PURPOSE = "unsubscribe";

  private final byte[] secret;
  private final Duration maxAge;
  private final Clock clock;
  private final String appBaseUrl;

  @Autowired
  public UnsubscribeTokenService(
      EmailProperties emailProperties,
      Clock clock,
      @Value("${insurancepro.app.base-url:http://localhost:8080}") String appBaseUrl) {
    this(
        resolveSecret(emailProperties.unsubscribeSecret()),
        emailProperties.unsubscribeTokenMaxAge(),
        clock,
        appBaseUrl);
  }

  UnsubscribeTokenService(byte[] secret, Duration maxAge, Clock clock, String appBaseUrl) {
    this.secret = secret.clone();
    this.maxAge = maxAge;
    this.clock = clock;
    this.appBaseUrl = stripTrailingSlash(appBaseUrl);
  }

  public String issue(String email) {
    var encoder = Base64.getUrlEncoder().withoutPadding();
    long issuedAt = clock.instant().getEpochSecond();
    byte[] payload = (PURPOSE + "|" + issuedAt + "|" + email).getBytes(StandardCharsets.UTF_8);
    return encoder.encodeToString(payload) + "." + encoder.encodeToString(computeHmac(payload));
  }

  /**
   * Returns the email bound into {@code token}.
   *
   * @throws InvalidUnsubscribeTokenException malformed, tampered or issued for another purpose
   * @throws ExpiredUnsubscribeTokenException signature valid but older than the maximum age
   */
  public String verify(String token) {
    if (token == null || token.isBlank()) {
      throw new InvalidUnsubscribeTokenException("Empty unsubscribe token");
    }
    int separator = token.lastIndexOf('.');
    if (separator <= 0 || separator == token.length() - 1) {
      throw new InvalidUnsubscribeTokenException("Malformed unsubscribe token");
    }

    byte[] payload;
    byte[] providedHmac;
    try {
      var decoder = Base64.getUrlDecoder();
      payload = decoder.decode(token.substring(0, separator));
      providedHmac = decoder.decode(token.substring(separator + 1));
    } catch (IllegalArgumentException e) {
      throw new InvalidUnsubscribeTokenException("Malformed unsubscribe token");
    }

    if (!MessageDigest.isEqual(computeHmac(payload), providedHmac)) {
      throw new InvalidUnsubscribeTokenException("Invalid unsubscribe token signature");
    }

    String[] parts = new String(payload, StandardCharsets.UTF_8).split("\\|", 3);
    if (parts.length != 3 || !PURPOSE.equals(parts[0]) || parts[2].isBlank()) {
      throw new InvalidUnsubscribeTokenException("Malformed unsubscribe token payload");
    }

    Instant issuedAt;
    try {
      issuedAt = Instant.ofEpochSecond(Long.parseLong(parts[1]));
    } catch (NumberFormatException e) {
      throw new InvalidUnsubscribeTokenException("Malformed unsubscribe token timestamp");
    }

    Duration age = Duration.between(issuedAt, clock.instant());
    if (age.compareTo(maxAge) > 0) {
      throw new ExpiredUnsubscribeTokenException(age, maxAge);
    }
    return parts[2];
  }

  /** Absolute unsubscribe link carrying a fresh token for {@code email}. */
  public String buildUnsubscribeUrl(String email) {
    return appBaseUrl + "/unsubscribe/" + issue(email);
  }

  private byte[] computeHmac(byte[] data) {
    try {
      Mac mac = Mac.getInstance(HMAC_ALGORITHM);
      mac.init(new SecretKeySpec(secret, HMAC_ALGORITHM));
      return mac.doFinal(data);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Failed to compute unsubscribe token HMAC", e);
    }
  }

  private static byte[] resolveSecret(String configured) {
    if (configured != null && !configured.isBlank()) {
      return configured.getBytes(StandardCharsets.UTF_8);
    }
    byte[] generated = new byte[32];
    new SecureRandom().nextBytes(generated);
    log.warn(
        "insurancepro.email.unsubscribe-secret is not set; using a random per-process key. "
            + "Unsubscribe links issued before the next restart will stop verifying.");
    return generated;
  }

  private static String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
