package io.insurancepro.site.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

/** Rejected status transition or otherwise unusable input. Maps to 400. */
public class InvalidStateException extends ErrorResponseException {

  public InvalidStateException(String title, String detail) {
    super(HttpStatus.BAD_REQUEST, Problems.of(HttpStatus.BAD_REQUEST, title, detail), null);
  }
}
