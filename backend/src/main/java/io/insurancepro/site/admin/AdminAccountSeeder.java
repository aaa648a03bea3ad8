package io.insurancepro.site.admin;

import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
@EnableConfigurationProperties(AdminProperties.class)
public class AdminAccountSeeder implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(AdminAccountSeeder.class);

  private final AdminUserRepository repository;
  private final PasswordEncoder passwordEncoder;
  private final AdminProperties properties;
  private final Clock clock;

  public AdminAccountSeeder(
      AdminUserRepository repository,
      PasswordEncoder passwordEncoder,
      AdminProperties properties,
      Clock clock) {
    this.repository = repository;
    this.passwordEncoder = passwordEncoder;
    this.properties = properties;
    this.clock = clock;
  }

  @Override
  @Transactional
  public void run(ApplicationArguments args) {
    if (repository.existsByUsername(properties.username())) {
      return;
    }
    if (properties.password() == null || properties.password().isBlank()) {
      log.warn(
          "No admin account '{}' and insurancepro.admin.password is not set; skipping seed",
          properties.username());
      return;
    }

    var admin =
        repository.save(
            new AdminUser(
                properties.username(),
                properties.email(),
                passwordEncoder.encode(properties.password()),
                clock.instant()));
    log.info(
        "Seeded default admin account: id={}, username={}", admin.getId(), admin.getUsername());
  }
}
