package io.netfield.fieldops.ticket;

import io.netfield.fieldops.exception.ValidationException;
import io.netfield.fieldops.security.CallerContext;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.io.IOException;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
public class TicketController {

  private final TicketService ticketService;

  public TicketController(TicketService ticketService) {
    this.ticketService = ticketService;
  }

  @PostMapping("/api/tickets")
  @PreAuthorize("hasAnyRole('ADMIN', 'SUPERADMIN', 'SYSTEM')")
  public ResponseEntity<TicketResponse> createTicket(
      @Valid @RequestBody CreateTicketRequest request) {
    var ticket =
        ticketService.create(
            request.category(),
            request.customerId(),
            request.address(),
            request.details(),
            request.scheduledAt(),
            CallerContext.requireCallerId(),
            CallerContext.getCallerRole());
    return ResponseEntity.created(URI.create("/api/tickets/" + ticket.getId()))
        .body(TicketResponse.from(ticket));
  }

  @GetMapping("/api/tickets/{id}")
  @PreAuthorize("hasAnyRole('ADMIN', 'SUPERADMIN', 'TECHNICIAN')")
  public ResponseEntity<TicketResponse> getTicket(@PathVariable UUID id) {
    return ResponseEntity.ok(TicketResponse.from(ticketService.get(id)));
  }

  @GetMapping("/api/tickets")
  @PreAuthorize("hasAnyRole('ADMIN', 'SUPERADMIN', 'TECHNICIAN')")
  public ResponseEntity<Page<TicketResponse>> listTickets(
      @RequestParam(required = false) TicketStatus status,
      @RequestParam(required = false) ApprovalStatus approval,
      @RequestParam(required = false) TicketCategory category,
      Pageable pageable) {
    return ResponseEntity.ok(
        ticketService.list(status, approval, category, pageable).map(TicketResponse::from));
  }

  @GetMapping("/api/tickets/pending-approval")
  @PreAuthorize("hasAnyRole('ADMIN', 'SUPERADMIN')")
  public ResponseEntity<List<TicketResponse>> listPendingApproval() {
    return ResponseEntity.ok(
        ticketService.listPendingApproval().stream().map(TicketResponse::from).toList());
  }

  @PostMapping("/api/tickets/{id}/approve")
  @PreAuthorize("hasAnyRole('ADMIN', 'SUPERADMIN')")
  public ResponseEntity<TicketResponse> approveTicket(@PathVariable UUID id) {
    return ResponseEntity.ok(
        TicketResponse.from(ticketService.approve(id, CallerContext.requireCallerId())));
  }

  @PostMapping("/api/tickets/{id}/reject")
  @PreAuthorize("hasAnyRole('ADMIN', 'SUPERADMIN')")
  public ResponseEntity<TicketResponse> rejectTicket(
      @PathVariable UUID id, @Valid @RequestBody RejectTicketRequest request) {
    return ResponseEntity.ok(
        TicketResponse.from(
            ticketService.reject(id, CallerContext.requireCallerId(), request.reason())));
  }

  @PutMapping("/api/tickets/{id}/status")
  @PreAuthorize("hasAnyRole('ADMIN', 'SUPERADMIN', 'TECHNICIAN')")
  public ResponseEntity<TicketResponse> updateStatus(
      @PathVariable UUID id, @Valid @RequestBody UpdateStatusRequest request) {
    var ticket =
        ticketService.updateStatus(
            id,
            request.status(),
            request.notes(),
            request.evidenceRef(),
            CallerContext.requireCallerId(),
            CallerContext.getCallerRole());
    return ResponseEntity.ok(TicketResponse.from(ticket));
  }

  @PostMapping(value = "/api/tickets/{id}/complete", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  @PreAuthorize("hasAnyRole('ADMIN', 'SUPERADMIN', 'TECHNICIAN')")
  public ResponseEntity<TicketResponse> completeTicket(
      @PathVariable UUID id,
      @RequestPart("evidence") MultipartFile evidence,
      @RequestParam(required = false) String notes) {
    if (evidence.isEmpty()) {
      throw new ValidationException("Evidence required", "The evidence file is empty");
    }
    try (var content = evidence.getInputStream()) {
      var ticket =
          ticketService.complete(
              id,
              evidence.getOriginalFilename(),
              evidence.getContentType(),
              content,
              evidence.getSize(),
              notes,
              CallerContext.requireCallerId(),
              CallerContext.getCallerRole());
      return ResponseEntity.ok(TicketResponse.from(ticket));
    } catch (IOException e) {
      throw new ValidationException("Unreadable upload", "Could not read evidence upload");
    }
  }

  @DeleteMapping("/api/tickets/{id}")
  @PreAuthorize("hasAnyRole('ADMIN', 'SUPERADMIN')")
  public ResponseEntity<Void> deleteTicket(@PathVariable UUID id) {
    ticketService.delete(id, CallerContext.requireCallerId());
    return ResponseEntity.noContent().build();
  }

  public record CreateTicketRequest(
      @NotNull(message = "category is required") TicketCategory category,
      @NotNull(message = "customerId is required") UUID customerId,
      @NotBlank(message = "address is required") String address,
      @Size(max = 2000, message = "details must be at most 2000 characters") String details,
      Instant scheduledAt) {}

  public record RejectTicketRequest(
      @NotBlank(message = "reason is required")
          @Size(max = 1000, message = "reason must be at most 1000 characters")
          String reason) {}

  public record UpdateStatusRequest(
      @NotNull(message = "status is required") TicketStatus status,
      @Size(max = 2000, message = "notes must be at most 2000 characters") String notes,
      @Size(max = 500, message = "evidenceRef must be at most 500 characters")
          String evidenceRef) {}

  public record TicketResponse(
      UUID id,
      String ticketNumber,
      TicketCategory category,
      TicketStatus status,
      ApprovalStatus approval,
      UUID customerId,
      UUID createdBy,
      String address,
      String details,
      Instant scheduledAt,
      UUID approvedBy,
      Instant approvedAt,
      UUID rejectedBy,
      Instant rejectedAt,
      String rejectionReason,
      Instant completedAt,
      UUID completedBy,
      String evidenceRef,
      String completionNotes,
      int version,
      Instant createdAt,
      Instant updatedAt) {

    public static TicketResponse from(Ticket ticket) {
      return new TicketResponse(
          ticket.getId(),
          ticket.getTicketNumber(),
          ticket.getCategory(),
          ticket.getStatus(),
          ticket.getApproval(),
          ticket.getCustomerId(),
          ticket.getCreatedBy(),
          ticket.getAddress(),
          ticket.getDetails(),
          ticket.getScheduledAt(),
          ticket.getApprovedBy(),
          ticket.getApprovedAt(),
          ticket.getRejectedBy(),
          ticket.getRejectedAt(),
          ticket.getRejectionReason(),
          ticket.getCompletedAt(),
          ticket.getCompletedBy(),
          ticket.getEvidenceRef(),
          ticket.getCompletionNotes(),
          ticket.getVersion(),
          ticket.getCreatedAt(),
          ticket.getUpdatedAt());
    }
  }
}
