package io.netfield.fieldops.broadcast;

import io.netfield.fieldops.ticket.TicketChangedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/** Forwards committed ticket changes to the UI feed. */
@Component
public class TicketBroadcastListener {

  private static final Logger log = LoggerFactory.getLogger(TicketBroadcastListener.class);

  private final BroadcastSink broadcastSink;

  public TicketBroadcastListener(BroadcastSink broadcastSink) {
    this.broadcastSink = broadcastSink;
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onTicketChanged(TicketChangedEvent event) {
    try {
      broadcastSink.broadcast(event.eventType(), event.toPayload());
    } catch (Exception e) {
      log.warn(
          "Broadcast of {} for ticket {} failed: {}",
          event.eventType(),
          event.ticketId(),
          e.getMessage());
    }
  }
}
