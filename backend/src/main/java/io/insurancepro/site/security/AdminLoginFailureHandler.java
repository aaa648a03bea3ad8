package io.insurancepro.site.security;

import io.insurancepro.site.api.ActionResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.DisabledException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.authentication.AuthenticationFailureHandler;
import org.springframework.stereotype.Component;
import tools.jackson.databind.ObjectMapper;

@Component
public class AdminLoginFailureHandler implements AuthenticationFailureHandler {

  private static final Logger log = LoggerFactory.getLogger(AdminLoginFailureHandler.class);

  static final String DEACTIVATED_MESSAGE = "Account is deactivated.";
  static final String BAD_CREDENTIALS_MESSAGE = "Invalid username or password.";

  private final ObjectMapper objectMapper;

  public AdminLoginFailureHandler(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  @Override
  public void onAuthenticationFailure(
      HttpServletRequest request, HttpServletResponse response, AuthenticationException exception)
      throws IOException {
    String message =
        exception instanceof DisabledException ? DEACTIVATED_MESSAGE : BAD_CREDENTIALS_MESSAGE;
    log.warn(
        "security.login_failed: remote_addr={}, reason={}",
        ClientIpResolver.resolve(request),
        exception.getClass().getSimpleName());

    response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    response.setCharacterEncoding("UTF-8");
    response.getWriter().write(objectMapper.writeValueAsString(ActionResponse.rejected(message)));
  }
}
