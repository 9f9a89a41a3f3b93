package io.netfield.fieldops.envelope;

import io.netfield.fieldops.exception.ResourceNotFoundException;
import io.netfield.fieldops.exception.ValidationException;
import io.netfield.fieldops.transport.MessagingTransport;
import java.time.Clock;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Durable outbound message queue. Producers enqueue inside their own transaction so the message
 * commits together with the state change it announces; delivery happens later in {@link
 * EnvelopeDeliveryService}.
 */
@Service
public class EnvelopeService {

  private static final Logger log = LoggerFactory.getLogger(EnvelopeService.class);

  private final EnvelopeRepository envelopeRepository;
  private final MessagingTransport transport;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;

  public EnvelopeService(
      EnvelopeRepository envelopeRepository,
      MessagingTransport transport,
      ApplicationEventPublisher eventPublisher,
      Clock clock) {
    this.envelopeRepository = envelopeRepository;
    this.transport = transport;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
  }

  /**
   * Persists a PENDING envelope in the caller's transaction.
   *
   * @param ticketRef optional ticket the message is about, kept for lookup only
   */
  @Transactional
  public Envelope enqueue(String recipientAddress, String body, String kind, UUID ticketRef) {
    if (recipientAddress == null || recipientAddress.isBlank()) {
      throw new ValidationException("Missing recipient", "Envelope recipient address is required");
    }
    if (body == null || body.isBlank()) {
      throw new ValidationException("Missing body", "Envelope body is required");
    }
    var envelope =
        envelopeRepository.save(
            new Envelope(
                transport.channelId(), recipientAddress, body, kind, ticketRef, clock.instant()));
    log.debug(
        "Enqueued envelope {} kind={} recipient={} ticket={}",
        envelope.getId(),
        kind,
        recipientAddress,
        ticketRef);
    eventPublisher.publishEvent(
        new EnvelopeEnqueuedEvent(envelope.getId(), recipientAddress, kind));
    return envelope;
  }

  @Transactional(readOnly = true)
  public Envelope get(UUID envelopeId) {
    return envelopeRepository
        .findById(envelopeId)
        .orElseThrow(() -> new ResourceNotFoundException("Envelope", envelopeId));
  }

  @Transactional(readOnly = true)
  public Page<Envelope> list(EnvelopeStatus status, UUID ticketRef, Pageable pageable) {
    return envelopeRepository.findByFilters(status, ticketRef, pageable);
  }

  /** Resets a FAILED envelope to PENDING with zero attempts. Other states are a conflict. */
  @Transactional
  public Envelope retry(UUID envelopeId) {
    var envelope =
        envelopeRepository
            .findByIdForUpdate(envelopeId)
            .orElseThrow(() -> new ResourceNotFoundException("Envelope", envelopeId));
    envelope.resetForRetry(clock.instant());
    log.info("Envelope {} reset to PENDING for retry", envelopeId);
    return envelope;
  }

  @Transactional(readOnly = true)
  public EnvelopeStats stats() {
    return new EnvelopeStats(
        envelopeRepository.countByStatus(EnvelopeStatus.PENDING),
        envelopeRepository.countByStatus(EnvelopeStatus.SENT),
        envelopeRepository.countByStatus(EnvelopeStatus.FAILED),
        transport.channelId(),
        transport.isConnected());
  }
}
