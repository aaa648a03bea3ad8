package io.insurancepro.site.admin;

import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Admin accounts as seen by Spring Security, plus last-login bookkeeping. */
@Service
public class AdminUserService implements UserDetailsService {

  private static final Logger log = LoggerFactory.getLogger(AdminUserService.class);

  public static final String ROLE = "ADMIN";

  private final AdminUserRepository repository;
  private final Clock clock;

  public AdminUserService(AdminUserRepository repository, Clock clock) {
    this.repository = repository;
    this.clock = clock;
  }

  @Override
  @Transactional(readOnly = true)
  public UserDetails loadUserByUsername(String username) {
    var admin =
        repository
            .findByUsername(username)
            .orElseThrow(() -> new UsernameNotFoundException("Unknown admin: " + username));
    return User.withUsername(admin.getUsername())
        .password(admin.getPasswordHash())
        .roles(ROLE)
        .disabled(!admin.isActive())
        .build();
  }

  @Transactional
  public void recordLogin(String username) {
    repository
        .findByUsername(username)
        .ifPresent(
            admin -> {
              admin.recordLogin(clock.instant());
              log.info("Admin logged in: id={}", admin.getId());
            });
  }
}
