package io.netfield.fieldops.exception;

import java.time.Duration;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class RateLimitExceededException extends ErrorResponseException {

  public RateLimitExceededException(String detail, Duration window) {
    super(HttpStatus.TOO_MANY_REQUESTS, createProblem(detail, window), null);
  }

  private static ProblemDetail createProblem(String detail, Duration window) {
    var problem = ProblemDetail.forStatus(HttpStatus.TOO_MANY_REQUESTS);
    problem.setTitle("Too many requests");
    problem.setDetail(detail);
    problem.setProperty("windowSeconds", window.toSeconds());
    return problem;
  }
}
