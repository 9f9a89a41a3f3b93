package io.netfield.fieldops.assignment;

import io.netfield.fieldops.exception.ValidationException;
import io.netfield.fieldops.security.CallerContext;
import io.netfield.fieldops.security.Roles;
import io.netfield.fieldops.technician.TechnicianService;
import io.netfield.fieldops.ticket.TicketController.TicketResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AssignmentController {

  private final AssignmentService assignmentService;
  private final TechnicianService technicianService;

  public AssignmentController(
      AssignmentService assignmentService, TechnicianService technicianService) {
    this.assignmentService = assignmentService;
    this.technicianService = technicianService;
  }

  @PostMapping("/api/tickets/{id}/assign")
  @PreAuthorize("hasAnyRole('ADMIN', 'SUPERADMIN')")
  public ResponseEntity<AssignmentResponse> assignTicket(
      @PathVariable UUID id, @Valid @RequestBody AssignTicketRequest request) {
    var assignment =
        assignmentService.adminAssign(
            id, request.technicianIds(), request.scheduledAt(), CallerContext.requireCallerId());
    return ResponseEntity.ok(AssignmentResponse.from(assignment));
  }

  /** The claiming technician is whoever is linked to the caller identity. */
  @PostMapping("/api/tickets/{id}/self-assign")
  @PreAuthorize("hasRole('TECHNICIAN')")
  public ResponseEntity<AssignmentResponse> selfAssign(@PathVariable UUID id) {
    var technician = technicianService.requireByUserId(CallerContext.requireCallerId());
    var assignment = assignmentService.selfAssign(id, technician.getId());
    return ResponseEntity.ok(AssignmentResponse.from(assignment));
  }

  /**
   * Technicians confirm their own assignment and may omit {@code technicianId}; staff must name the
   * technician they act for.
   */
  @PostMapping("/api/tickets/{id}/confirm")
  @PreAuthorize("hasAnyRole('ADMIN', 'SUPERADMIN', 'TECHNICIAN')")
  public ResponseEntity<TicketResponse> confirmAssignment(
      @PathVariable UUID id, @Valid @RequestBody ConfirmRequest request) {
    UUID callerId = CallerContext.requireCallerId();
    String callerRole = CallerContext.getCallerRole();
    UUID technicianId = request.technicianId();
    if (technicianId == null) {
      if (Roles.isStaff(callerRole)) {
        throw new ValidationException(
            "Missing technician", "Staff must name the technician they confirm for");
      }
      technicianId = technicianService.requireByUserId(callerId).getId();
    }
    var ticket =
        assignmentService.confirm(id, technicianId, request.action(), callerId, callerRole);
    return ResponseEntity.ok(TicketResponse.from(ticket));
  }

  @GetMapping("/api/tickets/{id}/assignments")
  @PreAuthorize("hasAnyRole('ADMIN', 'SUPERADMIN', 'TECHNICIAN')")
  public ResponseEntity<List<AssignmentResponse>> listAssignments(@PathVariable UUID id) {
    return ResponseEntity.ok(
        assignmentService.listAssignments(id).stream().map(AssignmentResponse::from).toList());
  }

  public record AssignTicketRequest(
      @NotEmpty(message = "technicianIds is required") List<UUID> technicianIds,
      Instant scheduledAt) {}

  public record ConfirmRequest(
      @NotNull(message = "action is required") ConfirmAction action, UUID technicianId) {}

  public record AssignmentResponse(
      UUID id,
      UUID ticketId,
      UUID technicianId,
      AssignmentRole role,
      Instant acceptedAt,
      UUID assignedBy,
      Instant createdAt) {

    public static AssignmentResponse from(Assignment assignment) {
      return new AssignmentResponse(
          assignment.getId(),
          assignment.getTicketId(),
          assignment.getTechnicianId(),
          assignment.getRole(),
          assignment.getAcceptedAt(),
          assignment.getAssignedBy(),
          assignment.getCreatedAt());
    }
  }
}
