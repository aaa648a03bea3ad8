package io.insurancepro.site.subscriber;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class EmailAddressesTest {

  @Test
  void accepts_ordinary_addresses() {
    assertThat(EmailAddresses.isValid("jane@example.com")).isTrue();
    assertThat(EmailAddresses.isValid("jane.doe+news@mail.example.co.uk")).isTrue();
    assertThat(EmailAddresses.isValid("  jane@example.com  ")).isTrue();
  }

  @Test
  void rejects_missing_or_malformed_addresses() {
    assertThat(EmailAddresses.isValid(null)).isFalse();
    assertThat(EmailAddresses.isValid("")).isFalse();
    assertThat(EmailAddresses.isValid("not-an-email")).isFalse();
    assertThat(EmailAddresses.isValid("jane@localhost")).isFalse();
    assertThat(EmailAddresses.isValid("jane@example.")).isFalse();
    assertThat(EmailAddresses.isValid("jane@@example.com")).isFalse();
    assertThat(EmailAddresses.isValid("Jane <jane@example.com>")).isFalse();
  }

  @Test
  void rejects_overlong_address() {
    String local = "a".repeat(115);
    assertThat(EmailAddresses.isValid(local + "@example.com")).isFalse();
  }

  @Test
  void normalize_trims_and_lower_cases() {
    assertThat(EmailAddresses.normalize("  Jane@Example.COM ")).isEqualTo("jane@example.com");
    assertThat(EmailAddresses.normalize(null)).isNull();
  }
}
