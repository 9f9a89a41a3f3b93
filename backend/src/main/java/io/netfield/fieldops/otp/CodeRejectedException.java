package io.netfield.fieldops.otp;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** HTTP form of a rejected verification, thrown by the controller after the service committed. */
public class CodeRejectedException extends ErrorResponseException {

  private final VerificationOutcome.Rejection rejection;

  public CodeRejectedException(VerificationOutcome outcome) {
    super(statusFor(outcome.rejection()), createProblem(outcome), null);
    this.rejection = outcome.rejection();
  }

  public VerificationOutcome.Rejection getRejection() {
    return rejection;
  }

  private static HttpStatus statusFor(VerificationOutcome.Rejection rejection) {
    return rejection == VerificationOutcome.Rejection.TOO_MANY_ATTEMPTS
        ? HttpStatus.TOO_MANY_REQUESTS
        : HttpStatus.BAD_REQUEST;
  }

  private static ProblemDetail createProblem(VerificationOutcome outcome) {
    var problem = ProblemDetail.forStatus(statusFor(outcome.rejection()));
    problem.setTitle("Code rejected");
    problem.setDetail(detailFor(outcome.rejection()));
    problem.setProperty("reason", outcome.rejection().name());
    return problem;
  }

  private static String detailFor(VerificationOutcome.Rejection rejection) {
    return switch (rejection) {
      case NOT_FOUND -> "No code has been issued for this number";
      case ALREADY_CONSUMED -> "This code has already been used";
      case EXPIRED -> "This code has expired, request a new one";
      case TOO_MANY_ATTEMPTS -> "Too many attempts, request a new code";
      case MISMATCH -> "The code is incorrect";
    };
  }
}
