package io.insurancepro.site.subscriber;

import io.insurancepro.site.exception.Problems;
import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

public class InvalidEmailException extends ErrorResponseException {

  public static final String MESSAGE = "Please provide a valid email address.";

  public InvalidEmailException() {
    super(
        HttpStatus.BAD_REQUEST,
        Problems.of(HttpStatus.BAD_REQUEST, "Invalid email", MESSAGE),
        null);
  }
}
