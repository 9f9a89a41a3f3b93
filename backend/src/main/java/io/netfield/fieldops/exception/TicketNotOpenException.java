package io.netfield.fieldops.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** The ticket was not open for assignment when the assignment tried to commit. */
public class TicketNotOpenException extends ErrorResponseException {

  public TicketNotOpenException(UUID ticketId, String currentState) {
    super(HttpStatus.CONFLICT, createProblem(ticketId, currentState), null);
  }

  private static ProblemDetail createProblem(UUID ticketId, String currentState) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Ticket not open");
    problem.setDetail("Ticket " + ticketId + " is not open for assignment (" + currentState + ")");
    problem.setProperty("ticketId", ticketId);
    return problem;
  }
}
