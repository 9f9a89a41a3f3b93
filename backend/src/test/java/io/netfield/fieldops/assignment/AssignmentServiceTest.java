package io.netfield.fieldops.assignment;

import static io.netfield.fieldops.EntityIds.withId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.AdditionalAnswers.returnsFirstArg;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.netfield.fieldops.customer.Customer;
import io.netfield.fieldops.customer.CustomerRepository;
import io.netfield.fieldops.envelope.EnvelopeService;
import io.netfield.fieldops.exception.AlreadyAssignedException;
import io.netfield.fieldops.exception.ForbiddenException;
import io.netfield.fieldops.exception.StateConflictException;
import io.netfield.fieldops.exception.TicketNotOpenException;
import io.netfield.fieldops.exception.ValidationException;
import io.netfield.fieldops.technician.Technician;
import io.netfield.fieldops.technician.TechnicianService;
import io.netfield.fieldops.ticket.ApprovalStatus;
import io.netfield.fieldops.ticket.Ticket;
import io.netfield.fieldops.ticket.TicketCategory;
import io.netfield.fieldops.ticket.TicketMessages;
import io.netfield.fieldops.ticket.TicketProperties;
import io.netfield.fieldops.ticket.TicketRepository;
import io.netfield.fieldops.ticket.TicketStatus;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

@ExtendWith(MockitoExtension.class)
class AssignmentServiceTest {

  private static final Instant NOW = Instant.parse("2026-01-10T08:00:00Z");
  private static final UUID ADMIN_ID = UUID.randomUUID();
  private static final UUID CUSTOMER_ID = UUID.randomUUID();
  private static final UUID TICKET_ID = UUID.randomUUID();
  private static final UUID TECH_ID = UUID.randomUUID();
  private static final UUID TECH_USER_ID = UUID.randomUUID();
  private static final String TECH_ADDRESS = "628222000111";
  private static final String CUSTOMER_ADDRESS = "628111222333";
  private static final String STAFF_ADDRESS = "628110000001";

  @Mock private AssignmentRepository assignmentRepository;
  @Mock private TicketRepository ticketRepository;
  @Mock private TechnicianService technicianService;
  @Mock private CustomerRepository customerRepository;
  @Mock private EnvelopeService envelopeService;
  @Mock private ApplicationEventPublisher eventPublisher;

  private AssignmentService service;
  private Technician technician;
  private Customer customer;

  @BeforeEach
  void setUp() {
    service = serviceWith(true);
    technician = withId(new Technician("Andi", TECH_ADDRESS, TECH_USER_ID), TECH_ID);
    customer = withId(new Customer("Budi", CUSTOMER_ADDRESS), CUSTOMER_ID);
  }

  private AssignmentService serviceWith(boolean selfAssignEnabled) {
    return new AssignmentService(
        assignmentRepository,
        ticketRepository,
        technicianService,
        customerRepository,
        envelopeService,
        new TicketMessages(),
        new TicketProperties(List.of("system"), selfAssignEnabled, List.of(STAFF_ADDRESS)),
        eventPublisher,
        Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private static Ticket openTicket(TicketCategory category) {
    var ticket =
        withId(
            new Ticket(
                "INS-1-0001",
                category,
                CUSTOMER_ID,
                ADMIN_ID,
                "Jl. Merdeka 10",
                "20 Mbps",
                null,
                NOW),
            TICKET_ID);
    ticket.approve(ADMIN_ID, NOW);
    return ticket;
  }

  private static Ticket assignedTicket() {
    var ticket = openTicket(TicketCategory.INSTALL);
    ticket.assign(null, NOW);
    return ticket;
  }

  // --- adminAssign ---

  @Test
  void adminAssign_requires_exactly_one_technician() {
    assertThatThrownBy(
            () ->
                service.adminAssign(
                    TICKET_ID, List.of(TECH_ID, UUID.randomUUID()), null, ADMIN_ID))
        .isInstanceOf(ValidationException.class);
    verify(ticketRepository, never()).findByIdForUpdate(any());
  }

  @Test
  void adminAssign_replaces_assignments_and_notifies_both_sides() {
    var ticket = openTicket(TicketCategory.REPAIR);
    when(technicianService.get(TECH_ID)).thenReturn(technician);
    when(ticketRepository.findByIdForUpdate(TICKET_ID)).thenReturn(Optional.of(ticket));
    when(assignmentRepository.save(any(Assignment.class))).thenAnswer(returnsFirstArg());
    when(customerRepository.findById(CUSTOMER_ID)).thenReturn(Optional.of(customer));

    var assignment = service.adminAssign(TICKET_ID, List.of(TECH_ID), null, ADMIN_ID);

    assertThat(ticket.getStatus()).isEqualTo(TicketStatus.ASSIGNED);
    assertThat(assignment.getTechnicianId()).isEqualTo(TECH_ID);
    assertThat(assignment.getRole()).isEqualTo(AssignmentRole.PRIMARY);
    assertThat(assignment.getAssignedBy()).isEqualTo(ADMIN_ID);
    verify(assignmentRepository).deleteAllByTicketId(TICKET_ID);
    verify(envelopeService)
        .enqueue(eq(TECH_ADDRESS), anyString(), eq(TicketMessages.KIND_ASSIGNMENT), eq(TICKET_ID));
    verify(envelopeService)
        .enqueue(
            eq(CUSTOMER_ADDRESS), anyString(), eq(TicketMessages.KIND_ASSIGNED), eq(TICKET_ID));
  }

  @Test
  void adminAssign_on_ticket_awaiting_approval_is_not_open() {
    var pending =
        withId(
            new Ticket(
                "INS-1-0002",
                TicketCategory.INSTALL,
                CUSTOMER_ID,
                ADMIN_ID,
                "Jl. A",
                null,
                null,
                NOW),
            TICKET_ID);
    when(technicianService.get(TECH_ID)).thenReturn(technician);
    when(ticketRepository.findByIdForUpdate(TICKET_ID)).thenReturn(Optional.of(pending));

    assertThatThrownBy(() -> service.adminAssign(TICKET_ID, List.of(TECH_ID), null, ADMIN_ID))
        .isInstanceOf(TicketNotOpenException.class);
    verify(assignmentRepository, never()).save(any());
  }

  @Test
  void adminAssign_rejects_inactive_technician() {
    technician.deactivate();
    when(technicianService.get(TECH_ID)).thenReturn(technician);

    assertThatThrownBy(() -> service.adminAssign(TICKET_ID, List.of(TECH_ID), null, ADMIN_ID))
        .isInstanceOf(ValidationException.class);
  }

  // --- selfAssign ---

  @Test
  void selfAssign_only_for_install_tickets() {
    when(ticketRepository.findById(TICKET_ID))
        .thenReturn(Optional.of(openTicket(TicketCategory.REPAIR)));

    assertThatThrownBy(() -> service.selfAssign(TICKET_ID, TECH_ID))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void selfAssign_can_be_switched_off() {
    var disabled = serviceWith(false);
    when(ticketRepository.findById(TICKET_ID))
        .thenReturn(Optional.of(openTicket(TicketCategory.INSTALL)));

    assertThatThrownBy(() -> disabled.selfAssign(TICKET_ID, TECH_ID))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void selfAssign_on_ticket_with_assignee_is_already_assigned() {
    when(ticketRepository.findById(TICKET_ID)).thenReturn(Optional.of(assignedTicket()));
    when(technicianService.get(TECH_ID)).thenReturn(technician);
    when(assignmentRepository.countByTicketId(TICKET_ID)).thenReturn(1L);

    assertThatThrownBy(() -> service.selfAssign(TICKET_ID, TECH_ID))
        .isInstanceOf(AlreadyAssignedException.class);
    verify(ticketRepository, never())
        .claimForSelfAssign(any(), anyInt(), any(), any(), any(), any());
  }

  @Test
  void selfAssign_losing_the_conditional_update_is_already_assigned() {
    when(ticketRepository.findById(TICKET_ID))
        .thenReturn(Optional.of(openTicket(TicketCategory.INSTALL)));
    when(technicianService.get(TECH_ID)).thenReturn(technician);
    when(assignmentRepository.countByTicketId(TICKET_ID)).thenReturn(0L);
    when(ticketRepository.claimForSelfAssign(
            eq(TICKET_ID),
            eq(0),
            eq(TicketStatus.ASSIGNED),
            any(),
            eq(ApprovalStatus.APPROVED),
            eq(NOW)))
        .thenReturn(0);

    assertThatThrownBy(() -> service.selfAssign(TICKET_ID, TECH_ID))
        .isInstanceOf(AlreadyAssignedException.class);
    verify(assignmentRepository, never()).save(any());
    verify(envelopeService, never()).enqueue(any(), any(), any(), any());
  }

  @Test
  void selfAssign_winner_gets_primary_assignment() {
    when(ticketRepository.findById(TICKET_ID))
        .thenReturn(Optional.of(openTicket(TicketCategory.INSTALL)), Optional.of(assignedTicket()));
    when(technicianService.get(TECH_ID)).thenReturn(technician);
    when(assignmentRepository.countByTicketId(TICKET_ID)).thenReturn(0L);
    when(ticketRepository.claimForSelfAssign(
            eq(TICKET_ID),
            eq(0),
            eq(TicketStatus.ASSIGNED),
            any(),
            eq(ApprovalStatus.APPROVED),
            eq(NOW)))
        .thenReturn(1);
    when(assignmentRepository.save(any(Assignment.class))).thenAnswer(returnsFirstArg());
    when(customerRepository.findById(CUSTOMER_ID)).thenReturn(Optional.of(customer));

    var assignment = service.selfAssign(TICKET_ID, TECH_ID);

    assertThat(assignment.getTechnicianId()).isEqualTo(TECH_ID);
    assertThat(assignment.getRole()).isEqualTo(AssignmentRole.PRIMARY);
    assertThat(assignment.getAssignedBy()).isEqualTo(TECH_USER_ID);
    verify(envelopeService)
        .enqueue(eq(TECH_ADDRESS), anyString(), eq(TicketMessages.KIND_ASSIGNMENT), eq(TICKET_ID));
  }

  // --- confirm ---

  @Test
  void decline_of_last_assignment_reopens_ticket_and_tells_staff() {
    var ticket = assignedTicket();
    var assignment = new Assignment(TICKET_ID, TECH_ID, AssignmentRole.PRIMARY, ADMIN_ID, NOW);
    when(ticketRepository.findByIdForUpdate(TICKET_ID)).thenReturn(Optional.of(ticket));
    when(assignmentRepository.findByTicketIdAndTechnicianId(TICKET_ID, TECH_ID))
        .thenReturn(Optional.of(assignment));
    when(technicianService.get(TECH_ID)).thenReturn(technician);
    when(assignmentRepository.countByTicketId(TICKET_ID)).thenReturn(0L);

    var result = service.confirm(TICKET_ID, TECH_ID, ConfirmAction.DECLINE, ADMIN_ID, "admin");

    assertThat(result.getStatus()).isEqualTo(TicketStatus.OPEN);
    verify(assignmentRepository).delete(assignment);
    verify(envelopeService)
        .enqueue(eq(STAFF_ADDRESS), anyString(), eq(TicketMessages.KIND_DECLINED), eq(TICKET_ID));
  }

  @Test
  void accept_notifies_customer_only_on_first_acceptance() {
    var ticket = assignedTicket();
    var assignment = new Assignment(TICKET_ID, TECH_ID, AssignmentRole.PRIMARY, ADMIN_ID, NOW);
    when(ticketRepository.findByIdForUpdate(TICKET_ID)).thenReturn(Optional.of(ticket));
    when(assignmentRepository.findByTicketIdAndTechnicianId(TICKET_ID, TECH_ID))
        .thenReturn(Optional.of(assignment));
    when(technicianService.requireByUserId(TECH_USER_ID)).thenReturn(technician);
    when(technicianService.get(TECH_ID)).thenReturn(technician);
    when(customerRepository.findById(CUSTOMER_ID)).thenReturn(Optional.of(customer));

    service.confirm(TICKET_ID, TECH_ID, ConfirmAction.ACCEPT, TECH_USER_ID, "technician");
    service.confirm(TICKET_ID, TECH_ID, ConfirmAction.ACCEPT, TECH_USER_ID, "technician");

    assertThat(assignment.isAccepted()).isTrue();
    assertThat(assignment.getAcceptedAt()).isEqualTo(NOW);
    assertThat(ticket.getStatus()).isEqualTo(TicketStatus.ASSIGNED);
    verify(envelopeService, times(1))
        .enqueue(eq(CUSTOMER_ADDRESS), anyString(), eq(TicketMessages.KIND_ACCEPTED), any());
  }

  @Test
  void technician_cannot_confirm_someone_elses_assignment() {
    var ticket = assignedTicket();
    var otherUser = UUID.randomUUID();
    var other = withId(new Technician("Dewi", "628222000333", otherUser), UUID.randomUUID());
    when(ticketRepository.findByIdForUpdate(TICKET_ID)).thenReturn(Optional.of(ticket));
    when(assignmentRepository.findByTicketIdAndTechnicianId(TICKET_ID, TECH_ID))
        .thenReturn(
            Optional.of(new Assignment(TICKET_ID, TECH_ID, AssignmentRole.PRIMARY, ADMIN_ID, NOW)));
    when(technicianService.requireByUserId(otherUser)).thenReturn(other);

    assertThatThrownBy(
            () ->
                service.confirm(
                    TICKET_ID, TECH_ID, ConfirmAction.DECLINE, otherUser, "technician"))
        .isInstanceOf(ForbiddenException.class);
    verify(assignmentRepository, never()).delete(any());
  }

  @Test
  void confirm_on_open_ticket_is_a_conflict() {
    when(ticketRepository.findByIdForUpdate(TICKET_ID))
        .thenReturn(Optional.of(openTicket(TicketCategory.INSTALL)));

    assertThatThrownBy(
            () -> service.confirm(TICKET_ID, TECH_ID, ConfirmAction.ACCEPT, ADMIN_ID, "admin"))
        .isInstanceOf(StateConflictException.class);
  }
}
