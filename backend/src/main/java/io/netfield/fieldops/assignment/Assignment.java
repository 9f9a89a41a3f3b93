package io.netfield.fieldops.assignment;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.UUID;

/**
 * Binding of one technician to one ticket. Rows only exist while the ticket is ASSIGNED or
 * IN_PROGRESS; the database allows a single PRIMARY row per ticket.
 */
@Entity
@Table(
    name = "assignments",
    uniqueConstraints = @UniqueConstraint(columnNames = {"ticket_id", "technician_id"}))
public class Assignment {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "ticket_id", nullable = false)
  private UUID ticketId;

  @Column(name = "technician_id", nullable = false)
  private UUID technicianId;

  @Enumerated(EnumType.STRING)
  @Column(name = "role", nullable = false, length = 20)
  private AssignmentRole role;

  @Column(name = "accepted_at")
  private Instant acceptedAt;

  @Column(name = "assigned_by", nullable = false)
  private UUID assignedBy;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Assignment() {}

  public Assignment(
      UUID ticketId, UUID technicianId, AssignmentRole role, UUID assignedBy, Instant now) {
    this.ticketId = ticketId;
    this.technicianId = technicianId;
    this.role = role;
    this.assignedBy = assignedBy;
    this.createdAt = now;
  }

  /** Stamps the acceptance time. Accepting twice keeps the first timestamp. */
  public void accept(Instant now) {
    if (acceptedAt == null) {
      this.acceptedAt = now;
    }
  }

  public boolean isAccepted() {
    return acceptedAt != null;
  }

  public UUID getId() {
    return id;
  }

  public UUID getTicketId() {
    return ticketId;
  }

  public UUID getTechnicianId() {
    return technicianId;
  }

  public AssignmentRole getRole() {
    return role;
  }

  public Instant getAcceptedAt() {
    return acceptedAt;
  }

  public UUID getAssignedBy() {
    return assignedBy;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
