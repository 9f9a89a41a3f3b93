package io.netfield.fieldops.ticket;

import io.netfield.fieldops.assignment.AssignmentRepository;
import io.netfield.fieldops.customer.Customer;
import io.netfield.fieldops.customer.CustomerRepository;
import io.netfield.fieldops.envelope.EnvelopeService;
import io.netfield.fieldops.evidence.EvidenceStore;
import io.netfield.fieldops.exception.ForbiddenException;
import io.netfield.fieldops.exception.InvalidTransitionException;
import io.netfield.fieldops.exception.ResourceNotFoundException;
import io.netfield.fieldops.exception.ValidationException;
import io.netfield.fieldops.security.Roles;
import io.netfield.fieldops.technician.TechnicianService;
import java.io.InputStream;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Ticket lifecycle: creation behind the approval gate, approval and rejection, and status updates
 * after assignment. Every change commits together with the envelopes that announce it.
 */
@Service
public class TicketService {

  private static final Logger log = LoggerFactory.getLogger(TicketService.class);

  private final TicketRepository ticketRepository;
  private final AssignmentRepository assignmentRepository;
  private final CustomerRepository customerRepository;
  private final TechnicianService technicianService;
  private final EnvelopeService envelopeService;
  private final EvidenceStore evidenceStore;
  private final TicketMessages messages;
  private final TicketNumberGenerator numberGenerator;
  private final TicketProperties properties;
  private final ApplicationEventPublisher eventPublisher;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;

  public TicketService(
      TicketRepository ticketRepository,
      AssignmentRepository assignmentRepository,
      CustomerRepository customerRepository,
      TechnicianService technicianService,
      EnvelopeService envelopeService,
      EvidenceStore evidenceStore,
      TicketMessages messages,
      TicketNumberGenerator numberGenerator,
      TicketProperties properties,
      ApplicationEventPublisher eventPublisher,
      TransactionTemplate transactionTemplate,
      Clock clock) {
    this.ticketRepository = ticketRepository;
    this.assignmentRepository = assignmentRepository;
    this.customerRepository = customerRepository;
    this.technicianService = technicianService;
    this.envelopeService = envelopeService;
    this.evidenceStore = evidenceStore;
    this.messages = messages;
    this.numberGenerator = numberGenerator;
    this.properties = properties;
    this.eventPublisher = eventPublisher;
    this.transactionTemplate = transactionTemplate;
    this.clock = clock;
  }

  /**
   * Creates a ticket waiting for approval, or an approved one when the caller's role is trusted.
   * Nothing is announced until the ticket is approved.
   */
  @Transactional
  public Ticket create(
      TicketCategory category,
      UUID customerId,
      String address,
      String details,
      Instant scheduledAt,
      UUID callerId,
      String callerRole) {
    if (category == null) {
      throw new ValidationException("Missing category", "Ticket category is required");
    }
    if (customerId == null) {
      throw new ValidationException("Missing customer", "Ticket customer is required");
    }
    if (address == null || address.isBlank()) {
      throw new ValidationException("Missing address", "Ticket address is required");
    }
    var customer =
        customerRepository
            .findById(customerId)
            .orElseThrow(
                () ->
                    new ValidationException(
                        "Unknown customer", "No customer found with id " + customerId));

    var now = clock.instant();

    var ticket =
        new Ticket(
            numberGenerator.next(category),
            category,
            customerId,
            callerId,
            address.trim(),
            details,
            scheduledAt,
            now);
    boolean autoApproved = properties.isAutoApproved(callerRole);
    if (autoApproved) {
      ticket.approve(callerId, now);
    }
    ticket = ticketRepository.save(ticket);
    log.info(
        "Ticket {} ({}) created by {}, approval={}",
        ticket.getTicketNumber(),
        category,
        callerId,
        ticket.getApproval());

    if (autoApproved) {
      announceApproved(ticket, customer, callerId);
    }
    return ticket;
  }

  @Transactional
  public Ticket approve(UUID ticketId, UUID approverId) {
    var ticket = lockTicket(ticketId);
    ticket.approve(approverId, clock.instant());
    log.info("Ticket {} approved by {}", ticket.getTicketNumber(), approverId);
    announceApproved(ticket, findCustomer(ticket), approverId);
    return ticket;
  }

  @Transactional
  public Ticket reject(UUID ticketId, UUID rejecterId, String reason) {
    if (reason == null || reason.isBlank()) {
      throw new ValidationException("Missing reason", "A rejection reason is required");
    }
    var ticket = lockTicket(ticketId);
    ticket.reject(rejecterId, reason.trim(), clock.instant());
    log.info("Ticket {} rejected by {}", ticket.getTicketNumber(), rejecterId);

    notifyCustomer(
        findCustomer(ticket),
        ticket,
        messages.rejected(ticket, ticket.getRejectionReason()),
        TicketMessages.KIND_REJECTED);
    eventPublisher.publishEvent(
        TicketChangedEvent.of(
            "ticket.rejected",
            ticket,
            rejecterId,
            ticket.getUpdatedAt(),
            Map.of("reason", ticket.getRejectionReason())));
    return ticket;
  }

  /**
   * Moves an approved ticket along ASSIGNED to IN_PROGRESS, IN_PROGRESS to COMPLETED, or any
   * non-terminal status to CANCELLED. Technicians may only move tickets they are assigned to.
   */
  @Transactional
  public Ticket updateStatus(
      UUID ticketId,
      TicketStatus newStatus,
      String notes,
      String evidenceRef,
      UUID callerId,
      String callerRole) {
    if (newStatus == null) {
      throw new ValidationException("Missing status", "Target status is required");
    }
    var ticket = lockTicket(ticketId);
    requireAssignedOrStaff(ticket, callerId, callerRole);
    ticket.requireApproved("update");
    if (TicketStatus.isAssignmentOnly(newStatus)) {
      throw new InvalidTransitionException(
          "Invalid ticket transition",
          "Status " + newStatus + " can only be reached through assignment operations");
    }

    var previous = ticket.getStatus();
    var now = clock.instant();
    switch (newStatus) {
      case IN_PROGRESS -> ticket.start(now);
      case COMPLETED -> ticket.complete(callerId, evidenceRef, notes, now);
      case CANCELLED -> ticket.cancel(callerId, notes, now);
      default -> throw new IllegalStateException("Unhandled status " + newStatus);
    }
    if (ticket.getStatus().isTerminal()) {
      int removed = assignmentRepository.deleteAllByTicketId(ticketId);
      log.debug("Removed {} assignments of finished ticket {}", removed, ticketId);
    }
    log.info(
        "Ticket {} moved {} -> {} by {}",
        ticket.getTicketNumber(),
        previous,
        ticket.getStatus(),
        callerId);

    notifyCustomer(
        findCustomer(ticket),
        ticket,
        messages.statusChanged(ticket, previous),
        TicketMessages.KIND_STATUS_CHANGED);
    eventPublisher.publishEvent(
        TicketChangedEvent.of(
            "ticket.status_changed",
            ticket,
            callerId,
            now,
            Map.of("previousStatus", previous)));
    return ticket;
  }

  /**
   * Stores the uploaded evidence, then completes the ticket with the returned reference. The upload
   * runs outside any transaction; if the completion does not commit, the stored upload is deleted.
   */
  public Ticket complete(
      UUID ticketId,
      String filename,
      String contentType,
      InputStream content,
      long size,
      String notes,
      UUID callerId,
      String callerRole) {
    if (content == null || size <= 0) {
      throw new ValidationException(
          "Evidence required", "A non-empty evidence upload is required");
    }
    transactionTemplate.executeWithoutResult(
        status -> requireCompletable(lockTicket(ticketId), callerId, callerRole));

    String evidenceRef = evidenceStore.store(ticketId, filename, contentType, content, size);
    try {
      return transactionTemplate.execute(
          status ->
              updateStatus(
                  ticketId, TicketStatus.COMPLETED, notes, evidenceRef, callerId, callerRole));
    } catch (RuntimeException e) {
      log.warn(
          "Completion of ticket {} failed after evidence upload, deleting {}",
          ticketId,
          evidenceRef);
      evidenceStore.delete(evidenceRef);
      throw e;
    }
  }

  /** Removes the ticket and its assignments. Nothing is announced. */
  @Transactional
  public void delete(UUID ticketId, UUID callerId) {
    var ticket = lockTicket(ticketId);
    int removed = assignmentRepository.deleteAllByTicketId(ticketId);
    ticketRepository.delete(ticket);
    log.info(
        "Ticket {} deleted by {} ({} assignments removed)",
        ticket.getTicketNumber(),
        callerId,
        removed);
    eventPublisher.publishEvent(
        TicketChangedEvent.of("ticket.deleted", ticket, callerId, clock.instant(), null));
  }

  @Transactional(readOnly = true)
  public Ticket get(UUID ticketId) {
    return ticketRepository
        .findById(ticketId)
        .orElseThrow(() -> new ResourceNotFoundException("Ticket", ticketId));
  }

  @Transactional(readOnly = true)
  public Page<Ticket> list(
      TicketStatus status, ApprovalStatus approval, TicketCategory category, Pageable pageable) {
    return ticketRepository.findByFilters(status, approval, category, pageable);
  }

  @Transactional(readOnly = true)
  public List<Ticket> listPendingApproval() {
    return ticketRepository.findByApprovalOrderByCreatedAtAsc(ApprovalStatus.PENDING);
  }

  // --- Helpers ---

  private Ticket lockTicket(UUID ticketId) {
    return ticketRepository
        .findByIdForUpdate(ticketId)
        .orElseThrow(() -> new ResourceNotFoundException("Ticket", ticketId));
  }

  private Customer findCustomer(Ticket ticket) {
    return customerRepository.findById(ticket.getCustomerId()).orElse(null);
  }

  private void announceApproved(Ticket ticket, Customer customer, UUID actorId) {
    String announcement = messages.announcement(ticket, customer);
    var technicians = technicianService.listActive();
    for (var technician : technicians) {
      envelopeService.enqueue(
          technician.getContactAddress(),
          announcement,
          TicketMessages.KIND_ANNOUNCED,
          ticket.getId());
    }
    notifyCustomer(customer, ticket, messages.registered(ticket), TicketMessages.KIND_REGISTERED);
    log.debug(
        "Ticket {} announced to {} active technicians",
        ticket.getTicketNumber(),
        technicians.size());
    eventPublisher.publishEvent(
        TicketChangedEvent.of("ticket.created", ticket, actorId, ticket.getUpdatedAt(), null));
  }

  private void notifyCustomer(Customer customer, Ticket ticket, String body, String kind) {
    if (customer == null || !customer.hasContactAddress()) {
      log.debug("Ticket {} customer has no contact address, skipping {}", ticket.getId(), kind);
      return;
    }
    envelopeService.enqueue(customer.getContactAddress(), body, kind, ticket.getId());
  }

  private void requireCompletable(Ticket ticket, UUID callerId, String callerRole) {
    requireAssignedOrStaff(ticket, callerId, callerRole);
    ticket.requireApproved("complete");
    if (!ticket.getStatus().canTransitionTo(TicketStatus.COMPLETED)) {
      throw new InvalidTransitionException(
          "Invalid ticket transition",
          "Cannot complete ticket "
              + ticket.getTicketNumber()
              + " in status "
              + ticket.getStatus());
    }
  }

  private void requireAssignedOrStaff(Ticket ticket, UUID callerId, String callerRole) {
    if (!Roles.TECHNICIAN.equals(callerRole)) {
      return;
    }
    var technician = technicianService.requireByUserId(callerId);
    if (!assignmentRepository.existsByTicketIdAndTechnicianId(ticket.getId(), technician.getId())) {
      throw new ForbiddenException(
          "Not assigned", "Technician is not assigned to ticket " + ticket.getTicketNumber());
    }
  }
}
