package io.insurancepro.site.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;

/** Builds RFC 7807 bodies for the application's {@code ErrorResponseException}s. */
public final class Problems {

  private Problems() {}

  public static ProblemDetail of(HttpStatus status, String title, String detail) {
    var problem = ProblemDetail.forStatus(status);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
