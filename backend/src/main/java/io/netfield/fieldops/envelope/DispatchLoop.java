package io.netfield.fieldops.envelope;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

/**
 * Drains due PENDING envelopes against the transport, oldest first. Envelopes of a recipient over
 * its per-minute limit are deferred to the end of the window so they do not hold the head of the
 * queue. Cycles never overlap: a call made while another cycle is still running returns
 * immediately. Delivery is attempted even while the transport reports itself disconnected, so a
 * dead channel surfaces as FAILED envelopes.
 */
@Component
public class DispatchLoop {

  private static final Logger log = LoggerFactory.getLogger(DispatchLoop.class);

  private final EnvelopeRepository envelopeRepository;
  private final EnvelopeDeliveryService deliveryService;
  private final RecipientRateLimiter rateLimiter;
  private final DispatchProperties properties;
  private final Clock clock;
  private final AtomicBoolean running = new AtomicBoolean(false);

  public DispatchLoop(
      EnvelopeRepository envelopeRepository,
      EnvelopeDeliveryService deliveryService,
      RecipientRateLimiter rateLimiter,
      DispatchProperties properties,
      Clock clock) {
    this.envelopeRepository = envelopeRepository;
    this.deliveryService = deliveryService;
    this.rateLimiter = rateLimiter;
    this.properties = properties;
    this.clock = clock;
  }

  public DispatchCycleResult runCycle() {
    if (!running.compareAndSet(false, true)) {
      log.debug("Dispatch cycle already running, skipping");
      return DispatchCycleResult.empty();
    }
    try {
      return drainBatch();
    } finally {
      running.set(false);
    }
  }

  private DispatchCycleResult drainBatch() {
    var batch =
        envelopeRepository.findDueBatch(
            EnvelopeStatus.PENDING, clock.instant(), PageRequest.of(0, properties.batchSize()));
    int sent = 0;
    int retryScheduled = 0;
    int failed = 0;
    int rateLimited = 0;

    for (var envelope : batch) {
      String recipient = envelope.getRecipientAddress();
      try {
        if (!rateLimiter.tryAcquire(recipient)) {
          var until = clock.instant().plus(rateLimiter.retryAfter(recipient));
          deliveryService.defer(envelope.getId(), until);
          log.debug(
              "Recipient {} over per-minute limit, envelope {} deferred until {}",
              recipient,
              envelope.getId(),
              until);
          rateLimited++;
          continue;
        }
        switch (deliveryService.attemptDelivery(envelope.getId())) {
          case SENT -> sent++;
          case RETRY_SCHEDULED -> retryScheduled++;
          case FAILED -> failed++;
          case SKIPPED -> {}
        }
      } catch (RuntimeException e) {
        // the row stays PENDING and is picked up again next cycle
        log.error("Delivery attempt for envelope {} aborted", envelope.getId(), e);
      }
    }

    var result = new DispatchCycleResult(batch.size(), sent, retryScheduled, failed, rateLimited);
    if (result.didWork()) {
      log.info(
          "Dispatch cycle: selected={}, sent={}, retrying={}, failed={}, rateLimited={}",
          result.selected(),
          sent,
          retryScheduled,
          failed,
          rateLimited);
    }
    return result;
  }
}
