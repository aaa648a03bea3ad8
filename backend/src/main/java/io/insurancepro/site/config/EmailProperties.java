package io.insurancepro.site.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Campaign email settings.
 *
 * @param unsubscribeSecret HMAC key for unsubscribe tokens; generated per process when blank
 * @param unsubscribeTokenMaxAge how long an issued unsubscribe link keeps working
 * @param brandName name printed in email headers and footers
 */
@ConfigurationProperties(prefix = "insurancepro.email")
public record EmailProperties(
    String unsubscribeSecret,
    @DefaultValue("365d") Duration unsubscribeTokenMaxAge,
    @DefaultValue("InsurancePro") String brandName) {}
