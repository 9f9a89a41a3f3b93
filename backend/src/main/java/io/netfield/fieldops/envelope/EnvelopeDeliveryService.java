package io.netfield.fieldops.envelope;

import io.netfield.fieldops.transport.DeliveryResult;
import io.netfield.fieldops.transport.MessagingTransport;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Performs one delivery attempt for one envelope. Both the dispatch loop and the inline
 * after-commit path go through here; the row lock taken on the envelope means the two never update
 * the same row at once.
 */
@Service
public class EnvelopeDeliveryService {

  private static final Logger log = LoggerFactory.getLogger(EnvelopeDeliveryService.class);

  private final EnvelopeRepository envelopeRepository;
  private final MessagingTransport transport;
  private final DispatchProperties properties;
  private final Clock clock;
  private final AsyncTaskExecutor transportExecutor;

  public EnvelopeDeliveryService(
      EnvelopeRepository envelopeRepository,
      MessagingTransport transport,
      DispatchProperties properties,
      Clock clock,
      @Qualifier("transportExecutor") AsyncTaskExecutor transportExecutor) {
    this.envelopeRepository = envelopeRepository;
    this.transport = transport;
    this.properties = properties;
    this.clock = clock;
    this.transportExecutor = transportExecutor;
  }

  /**
   * Locks the envelope, sends it if it is still PENDING and records the outcome. Runs in its own
   * transaction so that each attempt commits independently of the caller.
   */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public DeliveryAttempt attemptDelivery(UUID envelopeId) {
    var envelope = envelopeRepository.findByIdForUpdate(envelopeId).orElse(null);
    if (envelope == null) {
      log.debug("Envelope {} vanished before delivery", envelopeId);
      return DeliveryAttempt.SKIPPED;
    }
    if (!envelope.isPending()) {
      log.debug("Envelope {} is {}, skipping", envelopeId, envelope.getStatus());
      return DeliveryAttempt.SKIPPED;
    }

    DeliveryResult result = sendWithTimeout(envelope);
    envelope.recordAttempt(
        result.delivered(),
        result.providerMessageId(),
        result.errorMessage(),
        properties.maxAttempts(),
        properties.backoffBase(),
        clock.instant());

    switch (envelope.getStatus()) {
      case SENT -> {
        log.debug(
            "Envelope {} sent to {} on attempt {}",
            envelopeId,
            envelope.getRecipientAddress(),
            envelope.getAttempts());
        return DeliveryAttempt.SENT;
      }
      case FAILED -> {
        log.warn(
            "Envelope {} to {} FAILED after {} attempts: {}",
            envelopeId,
            envelope.getRecipientAddress(),
            envelope.getAttempts(),
            envelope.getLastError());
        return DeliveryAttempt.FAILED;
      }
      default -> {
        log.warn(
            "Envelope {} attempt {} failed, next attempt at {}: {}",
            envelopeId,
            envelope.getAttempts(),
            envelope.getNextAttemptAt(),
            envelope.getLastError());
        return DeliveryAttempt.RETRY_SCHEDULED;
      }
    }
  }

  /**
   * Pushes a still-PENDING envelope's next attempt out to {@code until} without counting an
   * attempt. Returns false if the envelope is gone or no longer PENDING.
   */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public boolean defer(UUID envelopeId, Instant until) {
    var envelope = envelopeRepository.findByIdForUpdate(envelopeId).orElse(null);
    if (envelope == null || !envelope.isPending()) {
      return false;
    }
    envelope.deferUntil(until, clock.instant());
    return true;
  }

  /**
   * Calls the transport on the dedicated executor and waits at most {@code transportTimeout}. A
   * call that times out is cancelled without interrupting it and counts as unreachable; a send
   * still queued at that point never reaches the transport.
   *
   * @throws org.springframework.core.task.TaskRejectedException if the executor queue is full
   */
  private DeliveryResult sendWithTimeout(Envelope envelope) {
    Future<DeliveryResult> future =
        transportExecutor.submit(
            () -> transport.send(envelope.getRecipientAddress(), envelope.getBody()));
    try {
      DeliveryResult result =
          future.get(properties.transportTimeout().toMillis(), TimeUnit.MILLISECONDS);
      return result != null ? result : DeliveryResult.unreachable("transport returned no result");
    } catch (TimeoutException e) {
      future.cancel(false);
      return DeliveryResult.unreachable(
          "transport timed out after " + properties.transportTimeout().toMillis() + "ms");
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      log.debug("Transport threw for envelope {}", envelope.getId(), cause);
      return DeliveryResult.unreachable(
          cause.getClass().getSimpleName() + ": " + cause.getMessage());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return DeliveryResult.unreachable("interrupted while waiting for transport");
    }
  }
}
