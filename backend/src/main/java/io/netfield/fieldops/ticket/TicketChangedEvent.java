package io.netfield.fieldops.ticket;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Published inside the transaction that changed a ticket. Listeners react after commit, so a
 * rolled-back change is never broadcast.
 */
public record TicketChangedEvent(
    String eventType,
    UUID ticketId,
    String ticketNumber,
    TicketCategory category,
    String state,
    UUID actorId,
    Instant occurredAt,
    Map<String, Object> details) {

  public static TicketChangedEvent of(
      String eventType,
      Ticket ticket,
      UUID actorId,
      Instant occurredAt,
      Map<String, Object> details) {
    return new TicketChangedEvent(
        eventType,
        ticket.getId(),
        ticket.getTicketNumber(),
        ticket.getCategory(),
        ticket.describeState(),
        actorId,
        occurredAt,
        details == null ? Map.of() : Map.copyOf(details));
  }

  /** Flat payload handed to the UI broadcast sink. */
  public Map<String, Object> toPayload() {
    var payload = new LinkedHashMap<String, Object>();
    payload.put("ticketId", ticketId);
    payload.put("ticketNumber", ticketNumber);
    payload.put("category", category);
    payload.put("state", state);
    if (actorId != null) {
      payload.put("actorId", actorId);
    }
    payload.put("occurredAt", occurredAt);
    payload.putAll(details);
    return payload;
  }
}
