package io.netfield.fieldops.envelope;

import io.netfield.fieldops.transport.MessagingTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Best-effort immediate delivery. Once the producing transaction has committed the envelope, this
 * listener tries to send it right away if the transport reports a live session. Anything that does
 * not go out here is picked up by the {@link DispatchLoop}.
 */
@Component
public class InlineDeliveryListener {

  private static final Logger log = LoggerFactory.getLogger(InlineDeliveryListener.class);

  private final EnvelopeDeliveryService deliveryService;
  private final MessagingTransport transport;
  private final DispatchProperties properties;
  private final TaskExecutor inlineExecutor;

  public InlineDeliveryListener(
      EnvelopeDeliveryService deliveryService,
      MessagingTransport transport,
      DispatchProperties properties,
      @Qualifier("inlineDeliveryExecutor") TaskExecutor inlineExecutor) {
    this.deliveryService = deliveryService;
    this.transport = transport;
    this.properties = properties;
    this.inlineExecutor = inlineExecutor;
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onEnvelopeEnqueued(EnvelopeEnqueuedEvent event) {
    if (!properties.inlineEnabled()) {
      return;
    }
    try {
      inlineExecutor.execute(() -> deliverInline(event));
    } catch (TaskRejectedException e) {
      log.debug("Inline executor rejected envelope {}, leaving it to the loop", event.envelopeId());
    }
  }

  void deliverInline(EnvelopeEnqueuedEvent event) {
    try {
      if (!transport.isConnected()) {
        log.debug("Transport disconnected, envelope {} left to the loop", event.envelopeId());
        return;
      }
      var outcome = deliveryService.attemptDelivery(event.envelopeId());
      log.debug(
          "Inline delivery of envelope {} ({}): {}", event.envelopeId(), event.kind(), outcome);
    } catch (Exception e) {
      log.warn("Inline delivery of envelope {} failed: {}", event.envelopeId(), e.getMessage());
    }
  }
}
