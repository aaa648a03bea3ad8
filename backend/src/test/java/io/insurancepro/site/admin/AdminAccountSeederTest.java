package io.insurancepro.site.admin;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.security.crypto.password.PasswordEncoder;

@ExtendWith(MockitoExtension.class)
class AdminAccountSeederTest {

  @Mock private AdminUserRepository repository;
  @Mock private PasswordEncoder passwordEncoder;

  private final Clock clock = Clock.fixed(Instant.parse("2026-04-01T07:30:00Z"), ZoneOffset.UTC);

  private void run(AdminProperties properties) {
    new AdminAccountSeeder(repository, passwordEncoder, properties, clock)
        .run(new DefaultApplicationArguments());
  }

  @Test
  void seeds_admin_with_hashed_password_when_missing() {
    when(repository.existsByUsername("admin")).thenReturn(false);
    when(passwordEncoder.encode("s3cret")).thenReturn("$2a$hash");
    when(repository.save(any(AdminUser.class))).thenAnswer(invocation -> invocation.getArgument(0));

    run(new AdminProperties("admin", "admin@insurancepro.com", "s3cret"));

    var captor = ArgumentCaptor.forClass(AdminUser.class);
    verify(repository).save(captor.capture());
    assertThat(captor.getValue().getUsername()).isEqualTo("admin");
    assertThat(captor.getValue().getPasswordHash()).isEqualTo("$2a$hash");
    assertThat(captor.getValue().isActive()).isTrue();
    assertThat(captor.getValue().getCreatedAt()).isEqualTo(clock.instant());
  }

  @Test
  void leaves_existing_admin_untouched() {
    when(repository.existsByUsername("admin")).thenReturn(true);

    run(new AdminProperties("admin", "admin@insurancepro.com", "s3cret"));

    verify(repository, never()).save(any());
  }

  @Test
  void skips_seeding_without_configured_password() {
    when(repository.existsByUsername("admin")).thenReturn(false);

    run(new AdminProperties("admin", "admin@insurancepro.com", " "));

    verify(repository, never()).save(any());
  }
}
