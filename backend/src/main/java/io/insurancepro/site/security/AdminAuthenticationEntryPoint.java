package io.insurancepro.site.security;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;
import org.springframework.stereotype.Component;

/** Logs unauthenticated admin requests and answers 401 instead of redirecting to a login page. */
@Component
public class AdminAuthenticationEntryPoint implements AuthenticationEntryPoint {

  private static final Logger log = LoggerFactory.getLogger(AdminAuthenticationEntryPoint.class);

  private final HttpStatusEntryPoint delegate = new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED);

  @Override
  public void commence(
      HttpServletRequest request,
      HttpServletResponse response,
      AuthenticationException authException) {
    log.warn(
        "security.auth_required: path={}, method={}, remote_addr={}",
        request.getRequestURI(),
        request.getMethod(),
        ClientIpResolver.resolve(request));

    delegate.commence(request, response, authException);
  }
}
