package io.insurancepro.site.admin;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Default admin account created at startup when no account with {@code username} exists. Nothing is
 * seeded while {@code password} is blank.
 */
@ConfigurationProperties("insurancepro.admin")
public record AdminProperties(
    @DefaultValue("admin") String username,
    @DefaultValue("admin@insurancepro.com") String email,
    String password) {}
