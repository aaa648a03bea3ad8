package io.insurancepro.site.security;

import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.security.web.csrf.CsrfToken;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Hands the admin client a CSRF token. Reading the token also writes the {@code XSRF-TOKEN} cookie,
 * which is otherwise deferred until a protected request arrives.
 */
@RestController
public class CsrfController {

  @GetMapping("/admin/csrf")
  public ResponseEntity<Map<String, String>> csrf(CsrfToken token) {
    return ResponseEntity.ok(
        Map.of("headerName", token.getHeaderName(), "token", token.getToken()));
  }
}
