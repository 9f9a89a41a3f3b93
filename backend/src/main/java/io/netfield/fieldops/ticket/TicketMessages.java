package io.netfield.fieldops.ticket;

import io.netfield.fieldops.customer.Customer;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import org.springframework.stereotype.Component;

/** Message bodies for ticket envelopes. Plain text with WhatsApp-style bold markers. */
@Component
public class TicketMessages {

  // Envelope kinds, also used to filter the backlog
  public static final String KIND_ANNOUNCED = "ticket.announced";
  public static final String KIND_REGISTERED = "ticket.registered";
  public static final String KIND_REJECTED = "ticket.rejected";
  public static final String KIND_STATUS_CHANGED = "ticket.status_changed";
  public static final String KIND_ASSIGNMENT = "ticket.assignment";
  public static final String KIND_ASSIGNED = "ticket.assigned";
  public static final String KIND_ACCEPTED = "ticket.accepted";
  public static final String KIND_DECLINED = "ticket.declined";

  private static final DateTimeFormatter SCHEDULE_FORMAT =
      DateTimeFormatter.ofPattern("dd MMM yyyy HH:mm").withZone(ZoneId.of("Asia/Jakarta"));

  /** Sent to every active technician once a ticket is approved. */
  public String announcement(Ticket ticket, Customer customer) {
    return "*New %s ticket*\n\nTicket: %s\nCustomer: %s\nContact: %s\n%s: %s\nAddress: %s\n%s"
        .formatted(
            categoryLabel(ticket),
            ticket.getTicketNumber(),
            customerName(customer),
            customerContact(customer),
            detailLabel(ticket),
            orDash(ticket.getDetails()),
            ticket.getAddress(),
            scheduleLine(ticket.getScheduledAt()))
        .stripTrailing();
  }

  /** Full job sheet for the technician who got the ticket. */
  public String assignmentDetail(Ticket ticket, Customer customer, String technicianName) {
    return ("*%s ticket assigned*\n\nCustomer: %s\nContact: %s\n%s: %s\nAddress: %s\n%s"
            + "Assigned to: %s\nTicket: %s")
        .formatted(
            categoryLabel(ticket),
            customerName(customer),
            customerContact(customer),
            detailLabel(ticket),
            orDash(ticket.getDetails()),
            ticket.getAddress(),
            scheduleLine(ticket.getScheduledAt()).isEmpty()
                ? ""
                : scheduleLine(ticket.getScheduledAt()) + "\n",
            technicianName,
            ticket.getTicketNumber());
  }

  public String registered(Ticket ticket) {
    return ("*Ticket registered*\n\nYour %s request %s has been registered."
            + " We will contact you shortly.")
        .formatted(categoryLabel(ticket).toLowerCase(), ticket.getTicketNumber());
  }

  public String rejected(Ticket ticket, String reason) {
    return "*Ticket rejected*\n\nYour request %s could not be accepted.\nReason: %s"
        .formatted(ticket.getTicketNumber(), orDash(reason));
  }

  public String statusChanged(Ticket ticket, TicketStatus previous) {
    return "*Ticket update*\n\nTicket %s %s.\nStatus: %s -> %s"
        .formatted(
            ticket.getTicketNumber(),
            statusPhrase(ticket.getStatus()),
            previous,
            ticket.getStatus());
  }

  public String assignedToCustomer(Ticket ticket, String technicianName) {
    return "*Technician assigned*\n\nTicket %s has been assigned to %s.\n%s"
        .formatted(
            ticket.getTicketNumber(), technicianName, scheduleLine(ticket.getScheduledAt()))
        .stripTrailing();
  }

  public String acceptedToCustomer(Ticket ticket, String technicianName) {
    return "*Technician confirmed*\n\n%s confirmed ticket %s and will be on the way."
        .formatted(technicianName, ticket.getTicketNumber());
  }

  public String declinedToStaff(Ticket ticket, String technicianName, boolean reopened) {
    return "*Assignment declined*\n\n%s declined ticket %s.%s"
        .formatted(
            technicianName,
            ticket.getTicketNumber(),
            reopened ? "\nThe ticket is OPEN again and needs a technician." : "");
  }

  private static String statusPhrase(TicketStatus status) {
    return switch (status) {
      case OPEN -> "is waiting for a technician";
      case ASSIGNED -> "has been assigned to a technician";
      case IN_PROGRESS -> "is being worked on";
      case COMPLETED -> "has been completed";
      case CANCELLED -> "has been cancelled";
    };
  }

  private static String categoryLabel(Ticket ticket) {
    return ticket.getCategory() == TicketCategory.INSTALL ? "Installation" : "Repair";
  }

  private static String detailLabel(Ticket ticket) {
    return ticket.getCategory() == TicketCategory.INSTALL ? "Package" : "Problem";
  }

  private static String scheduleLine(Instant scheduledAt) {
    return scheduledAt == null ? "" : "Schedule: " + SCHEDULE_FORMAT.format(scheduledAt);
  }

  private static String customerName(Customer customer) {
    return customer == null ? "-" : customer.getName();
  }

  private static String customerContact(Customer customer) {
    return customer == null || !customer.hasContactAddress() ? "-" : customer.getContactAddress();
  }

  private static String orDash(String value) {
    return value == null || value.isBlank() ? "-" : value;
  }
}
