package io.insurancepro.site.security;

import io.insurancepro.site.admin.AdminUserService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.authentication.DisabledException;
import org.springframework.security.authentication.LockedException;
import org.springframework.security.authentication.dao.DaoAuthenticationProvider;
import org.springframework.security.config.annotation.method.configuration.EnableMethodSecurity;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.logout.HttpStatusReturningLogoutSuccessHandler;
import org.springframework.security.web.csrf.CookieCsrfTokenRepository;
import org.springframework.security.web.csrf.CsrfTokenRequestAttributeHandler;

/**
 * Session-based login for the admin area. Everything under {@code /admin/**} requires ROLE_ADMIN;
 * the public endpoints are open. CSRF tokens travel in the {@code XSRF-TOKEN} cookie and must be
 * echoed in the {@code X-XSRF-TOKEN} header. Subscribe, contact and unsubscribe are exempt: they
 * are anonymous and unsubscribe links are followed from mail clients.
 */
@Configuration
@EnableWebSecurity
@EnableMethodSecurity
public class SecurityConfig {

  static final String LOGIN_URL = "/admin/login";

  private final AdminLoginSuccessHandler loginSuccessHandler;
  private final AdminLoginFailureHandler loginFailureHandler;
  private final AdminAuthenticationEntryPoint authenticationEntryPoint;

  public SecurityConfig(
      AdminLoginSuccessHandler loginSuccessHandler,
      AdminLoginFailureHandler loginFailureHandler,
      AdminAuthenticationEntryPoint authenticationEntryPoint) {
    this.loginSuccessHandler = loginSuccessHandler;
    this.loginFailureHandler = loginFailureHandler;
    this.authenticationEntryPoint = authenticationEntryPoint;
  }

  @Bean
  public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
    http.csrf(
            csrf ->
                csrf.csrfTokenRepository(CookieCsrfTokenRepository.withHttpOnlyFalse())
                    .csrfTokenRequestHandler(new CsrfTokenRequestAttributeHandler())
                    .ignoringRequestMatchers("/subscribe", "/contact", "/unsubscribe/**"))
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers(LOGIN_URL, "/admin/csrf")
                    .permitAll()
                    .requestMatchers("/admin/**")
                    .hasRole(AdminUserService.ROLE)
                    .anyRequest()
                    .permitAll())
        .formLogin(
            form ->
                form.loginPage(LOGIN_URL)
                    .loginProcessingUrl(LOGIN_URL)
                    .successHandler(loginSuccessHandler)
                    .failureHandler(loginFailureHandler)
                    .permitAll())
        .logout(
            logout ->
                logout
                    .logoutUrl("/admin/logout")
                    .logoutSuccessHandler(new HttpStatusReturningLogoutSuccessHandler()))
        .exceptionHandling(ex -> ex.authenticationEntryPoint(authenticationEntryPoint));

    return http.build();
  }

  /**
   * Checks the password before the account state, so a deactivated account is only reported as
   * such to someone who knows its password.
   */
  @Bean
  DaoAuthenticationProvider adminAuthenticationProvider(
      AdminUserService adminUserService, PasswordEncoder passwordEncoder) {
    var provider = new DaoAuthenticationProvider(adminUserService);
    provider.setPasswordEncoder(passwordEncoder);
    provider.setPreAuthenticationChecks(
        user -> {
          if (!user.isAccountNonLocked()) {
            throw new LockedException("Account is locked.");
          }
        });
    provider.setPostAuthenticationChecks(
        user -> {
          if (!user.isEnabled()) {
            throw new DisabledException(AdminLoginFailureHandler.DEACTIVATED_MESSAGE);
          }
        });
    return provider;
  }

  @Bean
  PasswordEncoder passwordEncoder() {
    return new BCryptPasswordEncoder();
  }
}
