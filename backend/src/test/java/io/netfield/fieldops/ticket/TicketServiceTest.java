package io.netfield.fieldops.ticket;

import static io.netfield.fieldops.EntityIds.withId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.AdditionalAnswers.returnsFirstArg;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.netfield.fieldops.assignment.AssignmentRepository;
import io.netfield.fieldops.customer.Customer;
import io.netfield.fieldops.customer.CustomerRepository;
import io.netfield.fieldops.envelope.EnvelopeService;
import io.netfield.fieldops.evidence.EvidenceStore;
import io.netfield.fieldops.exception.ForbiddenException;
import io.netfield.fieldops.exception.InvalidTransitionException;
import io.netfield.fieldops.exception.StateConflictException;
import io.netfield.fieldops.exception.ValidationException;
import io.netfield.fieldops.technician.Technician;
import io.netfield.fieldops.technician.TechnicianService;
import java.io.ByteArrayInputStream;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@ExtendWith(MockitoExtension.class)
class TicketServiceTest {

  private static final UUID ADMIN_ID = UUID.randomUUID();
  private static final UUID CUSTOMER_ID = UUID.randomUUID();
  private static final UUID TICKET_ID = UUID.randomUUID();
  private static final UUID TECH_ID = UUID.randomUUID();
  private static final UUID TECH_USER_ID = UUID.randomUUID();
  private static final String CUSTOMER_ADDRESS = "628111222333";
  private static final Instant NOW = Instant.parse("2026-03-01T08:00:00Z");

  @Mock private TicketRepository ticketRepository;
  @Mock private AssignmentRepository assignmentRepository;
  @Mock private CustomerRepository customerRepository;
  @Mock private TechnicianService technicianService;
  @Mock private EnvelopeService envelopeService;
  @Mock private EvidenceStore evidenceStore;
  @Mock private TicketNumberGenerator numberGenerator;
  @Mock private ApplicationEventPublisher eventPublisher;
  @Mock private PlatformTransactionManager transactionManager;

  private TicketService service;
  private Customer customer;
  private Technician technician;

  @BeforeEach
  void setUp() {
    service =
        new TicketService(
            ticketRepository,
            assignmentRepository,
            customerRepository,
            technicianService,
            envelopeService,
            evidenceStore,
            new TicketMessages(),
            numberGenerator,
            new TicketProperties(List.of("system"), true, List.of("628110000001")),
            eventPublisher,
            new TransactionTemplate(transactionManager),
            Clock.fixed(NOW, ZoneOffset.UTC));
    customer = withId(new Customer("Budi", CUSTOMER_ADDRESS), CUSTOMER_ID);
    technician = withId(new Technician("Andi", "628222000111", TECH_USER_ID), TECH_ID);
  }

  private static Ticket pendingTicket() {
    return withId(
        new Ticket(
            "INS-1-0001",
            TicketCategory.INSTALL,
            CUSTOMER_ID,
            ADMIN_ID,
            "Jl. Merdeka 10",
            "20 Mbps",
            null,
            NOW),
        TICKET_ID);
  }

  private static Ticket approvedTicket() {
    var ticket = pendingTicket();
    ticket.approve(ADMIN_ID, NOW);
    return ticket;
  }

  private static Ticket inProgressTicket() {
    var ticket = approvedTicket();
    ticket.assign(null, NOW);
    ticket.start(NOW);
    return ticket;
  }

  @Test
  void create_by_admin_waits_for_approval_and_announces_nothing() {
    when(customerRepository.findById(CUSTOMER_ID)).thenReturn(Optional.of(customer));
    when(numberGenerator.next(TicketCategory.INSTALL)).thenReturn("INS-1-0001");
    when(ticketRepository.save(any(Ticket.class))).thenAnswer(returnsFirstArg());

    var ticket =
        service.create(
            TicketCategory.INSTALL, CUSTOMER_ID, " Jl. Merdeka 10 ", null, null, ADMIN_ID, "admin");

    assertThat(ticket.getApproval()).isEqualTo(ApprovalStatus.PENDING);
    assertThat(ticket.getAddress()).isEqualTo("Jl. Merdeka 10");
    assertThat(ticket.getCreatedAt()).isEqualTo(NOW);
    verifyNoInteractions(envelopeService, eventPublisher, technicianService);
  }

  @Test
  void create_by_system_is_approved_and_announced_to_technicians() {
    var second = withId(new Technician("Citra", "628222000222", null), UUID.randomUUID());
    when(customerRepository.findById(CUSTOMER_ID)).thenReturn(Optional.of(customer));
    when(numberGenerator.next(TicketCategory.REPAIR)).thenReturn("REP-1-0001");
    when(ticketRepository.save(any(Ticket.class))).thenAnswer(returnsFirstArg());
    when(technicianService.listActive()).thenReturn(List.of(technician, second));

    var ticket =
        service.create(
            TicketCategory.REPAIR,
            CUSTOMER_ID,
            "Jl. Sudirman 1",
            "No signal",
            null,
            ADMIN_ID,
            "system");

    assertThat(ticket.getApproval()).isEqualTo(ApprovalStatus.APPROVED);
    assertThat(ticket.getApprovedAt()).isEqualTo(NOW);
    verify(envelopeService)
        .enqueue(eq("628222000111"), anyString(), eq(TicketMessages.KIND_ANNOUNCED), any());
    verify(envelopeService)
        .enqueue(eq("628222000222"), anyString(), eq(TicketMessages.KIND_ANNOUNCED), any());
    verify(envelopeService)
        .enqueue(eq(CUSTOMER_ADDRESS), anyString(), eq(TicketMessages.KIND_REGISTERED), any());
  }

  @Test
  void create_for_unknown_customer_is_rejected() {
    when(customerRepository.findById(CUSTOMER_ID)).thenReturn(Optional.empty());

    assertThatThrownBy(
            () ->
                service.create(
                    TicketCategory.INSTALL, CUSTOMER_ID, "Jl. A", null, null, ADMIN_ID, "admin"))
        .isInstanceOf(ValidationException.class);
    verify(ticketRepository, never()).save(any());
  }

  @Test
  void approve_announces_ticket() {
    when(ticketRepository.findByIdForUpdate(TICKET_ID)).thenReturn(Optional.of(pendingTicket()));
    when(customerRepository.findById(CUSTOMER_ID)).thenReturn(Optional.of(customer));
    when(technicianService.listActive()).thenReturn(List.of(technician));

    var ticket = service.approve(TICKET_ID, ADMIN_ID);

    assertThat(ticket.isApproved()).isTrue();
    verify(envelopeService)
        .enqueue(
            eq("628222000111"), anyString(), eq(TicketMessages.KIND_ANNOUNCED), eq(TICKET_ID));
    var event = ArgumentCaptor.forClass(TicketChangedEvent.class);
    verify(eventPublisher).publishEvent(event.capture());
    assertThat(event.getValue().occurredAt()).isEqualTo(NOW);
  }

  @Test
  void reject_requires_reason() {
    assertThatThrownBy(() -> service.reject(TICKET_ID, ADMIN_ID, "  "))
        .isInstanceOf(ValidationException.class);
    verify(ticketRepository, never()).findByIdForUpdate(any());
  }

  @Test
  void reject_notifies_customer() {
    when(ticketRepository.findByIdForUpdate(TICKET_ID)).thenReturn(Optional.of(pendingTicket()));
    when(customerRepository.findById(CUSTOMER_ID)).thenReturn(Optional.of(customer));

    var ticket = service.reject(TICKET_ID, ADMIN_ID, "Outside coverage");

    assertThat(ticket.getStatus()).isEqualTo(TicketStatus.CANCELLED);
    verify(envelopeService)
        .enqueue(eq(CUSTOMER_ADDRESS), anyString(), eq(TicketMessages.KIND_REJECTED), any());
  }

  @Test
  void updateStatus_on_pending_ticket_is_a_conflict() {
    when(ticketRepository.findByIdForUpdate(TICKET_ID)).thenReturn(Optional.of(pendingTicket()));

    assertThatThrownBy(
            () ->
                service.updateStatus(
                    TICKET_ID, TicketStatus.CANCELLED, null, null, ADMIN_ID, "admin"))
        .isInstanceOf(StateConflictException.class);
  }

  @Test
  void updateStatus_to_assigned_is_reserved_for_assignment() {
    when(ticketRepository.findByIdForUpdate(TICKET_ID)).thenReturn(Optional.of(approvedTicket()));

    assertThatThrownBy(
            () ->
                service.updateStatus(
                    TICKET_ID, TicketStatus.ASSIGNED, null, null, ADMIN_ID, "admin"))
        .isInstanceOf(InvalidTransitionException.class);
  }

  @Test
  void technician_cannot_move_ticket_they_are_not_assigned_to() {
    when(ticketRepository.findByIdForUpdate(TICKET_ID))
        .thenReturn(Optional.of(inProgressTicket()));
    when(technicianService.requireByUserId(TECH_USER_ID)).thenReturn(technician);
    when(assignmentRepository.existsByTicketIdAndTechnicianId(TICKET_ID, TECH_ID))
        .thenReturn(false);

    assertThatThrownBy(
            () ->
                service.updateStatus(
                    TICKET_ID, TicketStatus.CANCELLED, null, null, TECH_USER_ID, "technician"))
        .isInstanceOf(ForbiddenException.class);
  }

  @Test
  void cancel_removes_assignments_and_notifies_customer() {
    var ticket = approvedTicket();
    ticket.assign(null, NOW);
    when(ticketRepository.findByIdForUpdate(TICKET_ID)).thenReturn(Optional.of(ticket));
    when(customerRepository.findById(CUSTOMER_ID)).thenReturn(Optional.of(customer));

    service.updateStatus(
        TICKET_ID, TicketStatus.CANCELLED, "customer moved", null, ADMIN_ID, "admin");

    assertThat(ticket.getStatus()).isEqualTo(TicketStatus.CANCELLED);
    verify(assignmentRepository).deleteAllByTicketId(TICKET_ID);
    verify(envelopeService)
        .enqueue(
            eq(CUSTOMER_ADDRESS), anyString(), eq(TicketMessages.KIND_STATUS_CHANGED), any());
  }

  @Test
  void complete_stores_evidence_then_completes() {
    var ticket = inProgressTicket();
    var upload = new ByteArrayInputStream(new byte[] {1, 2, 3});
    when(ticketRepository.findByIdForUpdate(TICKET_ID)).thenReturn(Optional.of(ticket));
    when(technicianService.requireByUserId(TECH_USER_ID)).thenReturn(technician);
    when(assignmentRepository.existsByTicketIdAndTechnicianId(TICKET_ID, TECH_ID))
        .thenReturn(true);
    when(evidenceStore.store(TICKET_ID, "photo.jpg", "image/jpeg", upload, 3))
        .thenReturn("noop://tickets/" + TICKET_ID + "/photo.jpg");
    when(customerRepository.findById(CUSTOMER_ID)).thenReturn(Optional.of(customer));

    service.complete(
        TICKET_ID, "photo.jpg", "image/jpeg", upload, 3, "done", TECH_USER_ID, "technician");

    assertThat(ticket.getStatus()).isEqualTo(TicketStatus.COMPLETED);
    assertThat(ticket.getEvidenceRef()).isEqualTo("noop://tickets/" + TICKET_ID + "/photo.jpg");
    verify(assignmentRepository).deleteAllByTicketId(TICKET_ID);
  }

  @Test
  void complete_deletes_stored_evidence_when_completion_fails() {
    var ticket = inProgressTicket();
    var upload = new ByteArrayInputStream(new byte[] {1, 2, 3});
    var evidenceRef = "noop://tickets/" + TICKET_ID + "/photo.jpg";
    when(ticketRepository.findByIdForUpdate(TICKET_ID)).thenReturn(Optional.of(ticket));
    when(evidenceStore.store(TICKET_ID, "photo.jpg", "image/jpeg", upload, 3))
        .thenReturn(evidenceRef);
    when(customerRepository.findById(CUSTOMER_ID)).thenReturn(Optional.of(customer));
    doThrow(new IllegalStateException("outbox unavailable"))
        .when(envelopeService)
        .enqueue(anyString(), anyString(), anyString(), any());

    assertThatThrownBy(
            () ->
                service.complete(
                    TICKET_ID, "photo.jpg", "image/jpeg", upload, 3, "done", ADMIN_ID, "admin"))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("outbox unavailable");
    verify(evidenceStore).delete(evidenceRef);
    verify(transactionManager).rollback(any());
  }

  @Test
  void complete_without_upload_is_rejected() {
    assertThatThrownBy(
            () ->
                service.complete(
                    TICKET_ID, "x.jpg", "image/jpeg", null, 0, null, ADMIN_ID, "admin"))
        .isInstanceOf(ValidationException.class);
    verifyNoInteractions(evidenceStore);
  }

  @Test
  void complete_from_assigned_does_not_store_evidence() {
    var ticket = approvedTicket();
    ticket.assign(null, NOW);
    when(ticketRepository.findByIdForUpdate(TICKET_ID)).thenReturn(Optional.of(ticket));

    assertThatThrownBy(
            () ->
                service.complete(
                    TICKET_ID,
                    "x.jpg",
                    "image/jpeg",
                    new ByteArrayInputStream(new byte[] {1}),
                    1,
                    null,
                    ADMIN_ID,
                    "admin"))
        .isInstanceOf(InvalidTransitionException.class);
    verifyNoInteractions(evidenceStore);
  }
}
