package io.realtycrm.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

public class InvalidStateException extends ErrorResponseException {

  public InvalidStateException(String title, String detail) {
    super(HttpStatus.BAD_REQUEST, ProblemDetails.of(HttpStatus.BAD_REQUEST, title, detail), null);
  }
}
