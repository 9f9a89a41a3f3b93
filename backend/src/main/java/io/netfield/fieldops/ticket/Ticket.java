package io.netfield.fieldops.ticket;

import io.netfield.fieldops.exception.InvalidTransitionException;
import io.netfield.fieldops.exception.StateConflictException;
import io.netfield.fieldops.exception.TicketNotOpenException;
import io.netfield.fieldops.exception.ValidationException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "tickets")
public class Ticket {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "ticket_number", nullable = false, unique = true, length = 40)
  private String ticketNumber;

  @Enumerated(EnumType.STRING)
  @Column(name = "category", nullable = false, length = 20)
  private TicketCategory category;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private TicketStatus status;

  @Enumerated(EnumType.STRING)
  @Column(name = "approval", nullable = false, length = 20)
  private ApprovalStatus approval;

  @Column(name = "customer_id", nullable = false)
  private UUID customerId;

  @Column(name = "created_by", nullable = false)
  private UUID createdBy;

  @Column(name = "address", nullable = false, columnDefinition = "TEXT")
  private String address;

  @Column(name = "details", columnDefinition = "TEXT")
  private String details;

  @Column(name = "scheduled_at")
  private Instant scheduledAt;

  @Column(name = "approved_by")
  private UUID approvedBy;

  @Column(name = "approved_at")
  private Instant approvedAt;

  @Column(name = "rejected_by")
  private UUID rejectedBy;

  @Column(name = "rejected_at")
  private Instant rejectedAt;

  @Column(name = "rejection_reason", columnDefinition = "TEXT")
  private String rejectionReason;

  @Column(name = "completed_at")
  private Instant completedAt;

  @Column(name = "completed_by")
  private UUID completedBy;

  @Column(name = "evidence_ref", length = 500)
  private String evidenceRef;

  @Column(name = "completion_notes", columnDefinition = "TEXT")
  private String completionNotes;

  @Column(name = "cancelled_at")
  private Instant cancelledAt;

  @Column(name = "cancelled_by")
  private UUID cancelledBy;

  @Version
  @Column(name = "version", nullable = false)
  private int version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Ticket() {}

  /** New tickets wait for approval. Their status is OPEN but nothing may act on them yet. */
  public Ticket(
      String ticketNumber,
      TicketCategory category,
      UUID customerId,
      UUID createdBy,
      String address,
      String details,
      Instant scheduledAt,
      Instant now) {
    this.ticketNumber = ticketNumber;
    this.category = category;
    this.customerId = customerId;
    this.createdBy = createdBy;
    this.address = address;
    this.details = details;
    this.scheduledAt = scheduledAt;
    this.status = TicketStatus.OPEN;
    this.approval = ApprovalStatus.PENDING;
    this.createdAt = now;
    this.updatedAt = now;
  }

  // --- Approval gate ---

  public void approve(UUID approverId, Instant now) {
    requirePendingApproval("approve");
    this.approval = ApprovalStatus.APPROVED;
    this.status = TicketStatus.OPEN;
    this.approvedBy = approverId;
    this.approvedAt = now;
    this.updatedAt = now;
  }

  public void reject(UUID rejecterId, String reason, Instant now) {
    requirePendingApproval("reject");
    this.approval = ApprovalStatus.REJECTED;
    this.status = TicketStatus.CANCELLED;
    this.rejectedBy = rejecterId;
    this.rejectedAt = now;
    this.rejectionReason = reason;
    this.updatedAt = now;
  }

  public boolean isApproved() {
    return approval == ApprovalStatus.APPROVED;
  }

  /** Status updates on a ticket still waiting for approval are a conflict, not a bad edge. */
  public void requireApproved(String action) {
    if (approval == ApprovalStatus.PENDING) {
      throw new StateConflictException(
          "Ticket awaiting approval",
          "Cannot " + action + " ticket " + ticketNumber + " before it is approved");
    }
  }

  // --- Lifecycle transitions ---

  /** OPEN to ASSIGNED through an admin assignment. Fails with NotOpen unless approved and OPEN. */
  public void assign(Instant scheduledAt, Instant now) {
    if (!isApproved() || status != TicketStatus.OPEN) {
      throw new TicketNotOpenException(id, describeState());
    }
    this.status = TicketStatus.ASSIGNED;
    if (scheduledAt != null) {
      this.scheduledAt = scheduledAt;
    }
    this.updatedAt = now;
  }

  /** ASSIGNED back to OPEN once the last assignee declined. */
  public void revertToOpen(Instant now) {
    requireTransition(TicketStatus.OPEN, "reopen");
    this.status = TicketStatus.OPEN;
    this.updatedAt = now;
  }

  public void start(Instant now) {
    requireTransition(TicketStatus.IN_PROGRESS, "start");
    this.status = TicketStatus.IN_PROGRESS;
    this.updatedAt = now;
  }

  /** IN_PROGRESS to COMPLETED. Completion without an evidence reference is rejected. */
  public void complete(UUID actorId, String evidenceRef, String notes, Instant now) {
    requireTransition(TicketStatus.COMPLETED, "complete");
    if (evidenceRef == null || evidenceRef.isBlank()) {
      throw new ValidationException(
          "Evidence required",
          "Completing ticket " + ticketNumber + " requires an evidence reference");
    }
    this.status = TicketStatus.COMPLETED;
    this.completedAt = now;
    this.completedBy = actorId;
    this.evidenceRef = evidenceRef;
    this.completionNotes = notes;
    this.updatedAt = now;
  }

  public void cancel(UUID actorId, String notes, Instant now) {
    requireTransition(TicketStatus.CANCELLED, "cancel");
    this.status = TicketStatus.CANCELLED;
    this.cancelledAt = now;
    this.cancelledBy = actorId;
    if (notes != null && !notes.isBlank()) {
      this.completionNotes = notes;
    }
    this.updatedAt = now;
  }

  /** Status as callers see it: a ticket waiting for approval reports PENDING_APPROVAL. */
  public String describeState() {
    return approval == ApprovalStatus.PENDING ? "PENDING_APPROVAL" : status.name();
  }

  // --- Private helpers ---

  private void requirePendingApproval(String action) {
    if (approval != ApprovalStatus.PENDING) {
      throw new StateConflictException(
          "Ticket not pending approval",
          "Cannot " + action + " ticket " + ticketNumber + " with approval " + approval);
    }
  }

  private void requireTransition(TicketStatus target, String action) {
    if (!this.status.canTransitionTo(target)) {
      throw new InvalidTransitionException(
          "Invalid ticket transition",
          "Cannot " + action + " ticket " + ticketNumber + " in status " + this.status);
    }
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public String getTicketNumber() {
    return ticketNumber;
  }

  public TicketCategory getCategory() {
    return category;
  }

  public TicketStatus getStatus() {
    return status;
  }

  public ApprovalStatus getApproval() {
    return approval;
  }

  public UUID getCustomerId() {
    return customerId;
  }

  public UUID getCreatedBy() {
    return createdBy;
  }

  public String getAddress() {
    return address;
  }

  public String getDetails() {
    return details;
  }

  public Instant getScheduledAt() {
    return scheduledAt;
  }

  public UUID getApprovedBy() {
    return approvedBy;
  }

  public Instant getApprovedAt() {
    return approvedAt;
  }

  public UUID getRejectedBy() {
    return rejectedBy;
  }

  public Instant getRejectedAt() {
    return rejectedAt;
  }

  public String getRejectionReason() {
    return rejectionReason;
  }

  public Instant getCompletedAt() {
    return completedAt;
  }

  public UUID getCompletedBy() {
    return completedBy;
  }

  public String getEvidenceRef() {
    return evidenceRef;
  }

  public String getCompletionNotes() {
    return completionNotes;
  }

  public Instant getCancelledAt() {
    return cancelledAt;
  }

  public UUID getCancelledBy() {
    return cancelledBy;
  }

  public int getVersion() {
    return version;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
