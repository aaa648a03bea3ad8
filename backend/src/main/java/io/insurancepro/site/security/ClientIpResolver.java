package io.insurancepro.site.security;

import jakarta.servlet.http.HttpServletRequest;

/** Client address for log lines, honouring reverse proxy headers. */
final class ClientIpResolver {

  private ClientIpResolver() {}

  static String resolve(HttpServletRequest request) {
    String forwardedFor = request.getHeader("X-Forwarded-For");
    if (forwardedFor != null && !forwardedFor.isBlank()) {
      return forwardedFor.split(",")[0].trim();
    }
    String realIp = request.getHeader("X-Real-IP");
    if (realIp != null && !realIp.isBlank()) {
      return realIp.trim();
    }
    return request.getRemoteAddr();
  }
}
