package io.insurancepro.site.security;

import io.insurancepro.site.admin.AdminUserService;
import io.insurancepro.site.api.ActionResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.springframework.http.MediaType;
import org.springframework.security.core.Authentication;
import org.springframework.security.web.authentication.AuthenticationSuccessHandler;
import org.springframework.stereotype.Component;
import tools.jackson.databind.ObjectMapper;

@Component
public class AdminLoginSuccessHandler implements AuthenticationSuccessHandler {

  static final String LOGIN_MESSAGE = "Login successful.";

  private final AdminUserService adminUserService;
  private final ObjectMapper objectMapper;

  public AdminLoginSuccessHandler(AdminUserService adminUserService, ObjectMapper objectMapper) {
    this.adminUserService = adminUserService;
    this.objectMapper = objectMapper;
  }

  @Override
  public void onAuthenticationSuccess(
      HttpServletRequest request, HttpServletResponse response, Authentication authentication)
      throws IOException {
    adminUserService.recordLogin(authentication.getName());

    response.setStatus(HttpServletResponse.SC_OK);
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    response.setCharacterEncoding("UTF-8");
    response.getWriter().write(objectMapper.writeValueAsString(ActionResponse.ok(LOGIN_MESSAGE)));
  }
}
