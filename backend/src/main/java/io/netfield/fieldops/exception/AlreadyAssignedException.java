package io.netfield.fieldops.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Another technician committed a claim on the ticket first. */
public class AlreadyAssignedException extends ErrorResponseException {

  public AlreadyAssignedException(UUID ticketId) {
    super(HttpStatus.CONFLICT, createProblem(ticketId), null);
  }

  private static ProblemDetail createProblem(UUID ticketId) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Ticket already assigned");
    problem.setDetail("Ticket " + ticketId + " already has a technician");
    problem.setProperty("ticketId", ticketId);
    return problem;
  }
}
