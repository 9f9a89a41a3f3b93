package io.netfield.fieldops.assignment;

import io.netfield.fieldops.customer.Customer;
import io.netfield.fieldops.customer.CustomerRepository;
import io.netfield.fieldops.envelope.EnvelopeService;
import io.netfield.fieldops.exception.AlreadyAssignedException;
import io.netfield.fieldops.exception.ForbiddenException;
import io.netfield.fieldops.exception.ResourceNotFoundException;
import io.netfield.fieldops.exception.StateConflictException;
import io.netfield.fieldops.exception.TicketNotOpenException;
import io.netfield.fieldops.exception.ValidationException;
import io.netfield.fieldops.security.Roles;
import io.netfield.fieldops.technician.Technician;
import io.netfield.fieldops.technician.TechnicianService;
import io.netfield.fieldops.ticket.ApprovalStatus;
import io.netfield.fieldops.ticket.Ticket;
import io.netfield.fieldops.ticket.TicketCategory;
import io.netfield.fieldops.ticket.TicketChangedEvent;
import io.netfield.fieldops.ticket.TicketMessages;
import io.netfield.fieldops.ticket.TicketProperties;
import io.netfield.fieldops.ticket.TicketRepository;
import io.netfield.fieldops.ticket.TicketStatus;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Decides who works on a ticket. Admin assignment and confirmation serialize on the ticket row
 * lock; self-assignment is resolved by a single conditional update so that of two concurrent claims
 * only the first committer wins.
 */
@Service
public class AssignmentService {

  private static final Logger log = LoggerFactory.getLogger(AssignmentService.class);

  private final AssignmentRepository assignmentRepository;
  private final TicketRepository ticketRepository;
  private final TechnicianService technicianService;
  private final CustomerRepository customerRepository;
  private final EnvelopeService envelopeService;
  private final TicketMessages messages;
  private final TicketProperties ticketProperties;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;

  public AssignmentService(
      AssignmentRepository assignmentRepository,
      TicketRepository ticketRepository,
      TechnicianService technicianService,
      CustomerRepository customerRepository,
      EnvelopeService envelopeService,
      TicketMessages messages,
      TicketProperties ticketProperties,
      ApplicationEventPublisher eventPublisher,
      Clock clock) {
    this.assignmentRepository = assignmentRepository;
    this.ticketRepository = ticketRepository;
    this.technicianService = technicianService;
    this.customerRepository = customerRepository;
    this.envelopeService = envelopeService;
    this.messages = messages;
    this.ticketProperties = ticketProperties;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
  }

  /**
   * Replaces every assignment of an OPEN ticket with the given technician as PRIMARY.
   *
   * @param technicianIds must contain exactly one id
   * @param scheduledAt optional new schedule for the visit
   */
  @Transactional
  public Assignment adminAssign(
      UUID ticketId, List<UUID> technicianIds, Instant scheduledAt, UUID callerId) {
    if (technicianIds == null || technicianIds.size() != 1 || technicianIds.get(0) == null) {
      throw new ValidationException(
          "Invalid technician selection", "Exactly one technician must be assigned");
    }
    var technician = requireActiveTechnician(technicianIds.get(0));
    var ticket =
        ticketRepository
            .findByIdForUpdate(ticketId)
            .orElseThrow(() -> new ResourceNotFoundException("Ticket", ticketId));

    var now = clock.instant();
    ticket.assign(scheduledAt, now);
    int replaced = assignmentRepository.deleteAllByTicketId(ticketId);
    var assignment =
        assignmentRepository.save(
            new Assignment(ticketId, technician.getId(), AssignmentRole.PRIMARY, callerId, now));
    log.info(
        "Ticket {} assigned to technician {} by {} (replaced {})",
        ticket.getTicketNumber(),
        technician.getId(),
        callerId,
        replaced);

    announceAssignment(ticket, technician);
    eventPublisher.publishEvent(
        TicketChangedEvent.of(
            "ticket.assigned",
            ticket,
            callerId,
            now,
            Map.of("technicianId", technician.getId())));
    return assignment;
  }

  /**
   * Lets a technician claim an approved INSTALL ticket that nobody holds yet.
   *
   * @throws AlreadyAssignedException if the ticket already has an assignee, or another claim
   *     committed between reading the ticket and the conditional update
   */
  @Transactional
  public Assignment selfAssign(UUID ticketId, UUID technicianId) {
    var ticket =
        ticketRepository
            .findById(ticketId)
            .orElseThrow(() -> new ResourceNotFoundException("Ticket", ticketId));
    if (ticket.getCategory() != TicketCategory.INSTALL) {
      throw new ValidationException(
          "Self-assign not allowed", "Only INSTALL tickets can be claimed by technicians");
    }
    if (!ticketProperties.selfAssignEnabled()) {
      throw new ValidationException(
          "Self-assign disabled", "Technicians cannot claim tickets on this installation");
    }
    var technician = requireActiveTechnician(technicianId);
    if (!ticket.isApproved() || !TicketStatus.selfAssignable().contains(ticket.getStatus())) {
      throw new TicketNotOpenException(ticketId, ticket.describeState());
    }
    if (assignmentRepository.countByTicketId(ticketId) > 0) {
      throw new AlreadyAssignedException(ticketId);
    }

    var claimedAt = clock.instant();
    int claimed =
        ticketRepository.claimForSelfAssign(
            ticketId,
            ticket.getVersion(),
            TicketStatus.ASSIGNED,
            TicketStatus.selfAssignable(),
            ApprovalStatus.APPROVED,
            claimedAt);
    if (claimed == 0) {
      log.info("Self-assign of ticket {} by technician {} lost the race", ticketId, technicianId);
      throw new AlreadyAssignedException(ticketId);
    }

    var assignedBy = technician.getUserId() != null ? technician.getUserId() : technician.getId();
    var assignment =
        assignmentRepository.save(
            new Assignment(
                ticketId, technician.getId(), AssignmentRole.PRIMARY, assignedBy, claimedAt));
    // the conditional update cleared the persistence context; reload the committed view
    var claimedTicket =
        ticketRepository
            .findById(ticketId)
            .orElseThrow(() -> new ResourceNotFoundException("Ticket", ticketId));
    log.info(
        "Ticket {} self-assigned by technician {}", claimedTicket.getTicketNumber(), technicianId);

    announceAssignment(claimedTicket, technician);
    eventPublisher.publishEvent(
        TicketChangedEvent.of(
            "ticket.assigned",
            claimedTicket,
            assignedBy,
            claimedAt,
            Map.of("technicianId", technician.getId(), "selfAssigned", true)));
    return assignment;
  }

  /**
   * Records a technician's answer to an assignment. ACCEPT stamps the acceptance; DECLINE removes
   * the assignment and reopens the ticket once nobody is left on it.
   */
  @Transactional
  public Ticket confirm(
      UUID ticketId, UUID technicianId, ConfirmAction action, UUID callerId, String callerRole) {
    if (action == null) {
      throw new ValidationException("Missing action", "Confirm action must be ACCEPT or DECLINE");
    }
    var ticket =
        ticketRepository
            .findByIdForUpdate(ticketId)
            .orElseThrow(() -> new ResourceNotFoundException("Ticket", ticketId));
    if (ticket.getStatus() != TicketStatus.ASSIGNED) {
      throw new StateConflictException(
          "Ticket not awaiting confirmation",
          "Ticket " + ticket.getTicketNumber() + " is " + ticket.describeState());
    }
    var assignment =
        assignmentRepository
            .findByTicketIdAndTechnicianId(ticketId, technicianId)
            .orElseThrow(
                () ->
                    ResourceNotFoundException.withDetail(
                        "Assignment not found",
                        "Technician " + technicianId + " is not assigned to ticket " + ticketId));
    if (!Roles.isStaff(callerRole)) {
      var caller = technicianService.requireByUserId(callerId);
      if (!caller.getId().equals(technicianId)) {
        throw new ForbiddenException(
            "Not your assignment", "Technicians may only confirm their own assignments");
      }
    }
    var technician = technicianService.get(technicianId);

    return switch (action) {
      case ACCEPT -> accept(ticket, assignment, technician, callerId);
      case DECLINE -> decline(ticket, assignment, technician, callerId);
    };
  }

  @Transactional(readOnly = true)
  public List<Assignment> listAssignments(UUID ticketId) {
    if (!ticketRepository.existsById(ticketId)) {
      throw new ResourceNotFoundException("Ticket", ticketId);
    }
    return assignmentRepository.findByTicketIdOrderByCreatedAtAsc(ticketId);
  }

  // --- Helpers ---

  private Ticket accept(
      Ticket ticket, Assignment assignment, Technician technician, UUID callerId) {
    var now = clock.instant();
    boolean firstAcceptance = !assignment.isAccepted();
    assignment.accept(now);
    log.info("Technician {} accepted ticket {}", technician.getId(), ticket.getTicketNumber());
    if (firstAcceptance) {
      notifyCustomer(
          ticket,
          messages.acceptedToCustomer(ticket, technician.getName()),
          TicketMessages.KIND_ACCEPTED);
      eventPublisher.publishEvent(
          TicketChangedEvent.of(
              "ticket.accepted",
              ticket,
              callerId,
              now,
              Map.of("technicianId", technician.getId())));
    }
    return ticket;
  }

  private Ticket decline(
      Ticket ticket, Assignment assignment, Technician technician, UUID callerId) {
    var now = clock.instant();
    assignmentRepository.delete(assignment);
    assignmentRepository.flush();
    boolean reopened = assignmentRepository.countByTicketId(ticket.getId()) == 0;
    if (reopened) {
      ticket.revertToOpen(now);
    }
    log.info(
        "Technician {} declined ticket {}, status now {}",
        technician.getId(),
        ticket.getTicketNumber(),
        ticket.getStatus());

    String body = messages.declinedToStaff(ticket, technician.getName(), reopened);
    for (String staffAddress : ticketProperties.staffAddresses()) {
      envelopeService.enqueue(staffAddress, body, TicketMessages.KIND_DECLINED, ticket.getId());
    }
    eventPublisher.publishEvent(
        TicketChangedEvent.of(
            "ticket.declined",
            ticket,
            callerId,
            now,
            Map.of("technicianId", technician.getId(), "reopened", reopened)));
    return ticket;
  }

  private Technician requireActiveTechnician(UUID technicianId) {
    var technician = technicianService.get(technicianId);
    if (!technician.isActive()) {
      throw new ValidationException(
          "Technician inactive", "Technician " + technicianId + " is deactivated");
    }
    return technician;
  }

  private void announceAssignment(Ticket ticket, Technician technician) {
    Customer customer = customerRepository.findById(ticket.getCustomerId()).orElse(null);
    envelopeService.enqueue(
        technician.getContactAddress(),
        messages.assignmentDetail(ticket, customer, technician.getName()),
        TicketMessages.KIND_ASSIGNMENT,
        ticket.getId());
    notifyCustomer(
        ticket,
        messages.assignedToCustomer(ticket, technician.getName()),
        TicketMessages.KIND_ASSIGNED);
  }

  private void notifyCustomer(Ticket ticket, String body, String kind) {
    customerRepository
        .findById(ticket.getCustomerId())
        .filter(Customer::hasContactAddress)
        .ifPresent(
            customer ->
                envelopeService.enqueue(
                    customer.getContactAddress(), body, kind, ticket.getId()));
  }
}
