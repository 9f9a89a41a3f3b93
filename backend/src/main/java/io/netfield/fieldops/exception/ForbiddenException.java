package io.netfield.fieldops.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Caller is authenticated but may not act on this resource, e.g. a technician moving a ticket
 * they are not assigned to.
 */
public class ForbiddenException extends ErrorResponseException {

  public ForbiddenException(String title, String detail) {
    super(HttpStatus.FORBIDDEN, forbidden(title, detail), null);
  }

  private static ProblemDetail forbidden(String title, String detail) {
    var problem = ProblemDetail.forStatusAndDetail(HttpStatus.FORBIDDEN, detail);
    problem.setTitle(title);
    return problem;
  }
}
