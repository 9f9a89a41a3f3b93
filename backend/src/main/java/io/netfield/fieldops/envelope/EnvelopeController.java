package io.netfield.fieldops.envelope;

import java.time.Instant;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Staff view of the outbound message backlog, with single-envelope retry. */
@RestController
@RequestMapping("/api/envelopes")
@PreAuthorize("hasAnyRole('ADMIN', 'SUPERADMIN')")
public class EnvelopeController {

  static final String OTP_KIND_PREFIX = "otp.";
  static final String REDACTED_BODY = "[redacted one-time code]";

  private final EnvelopeService envelopeService;

  public EnvelopeController(EnvelopeService envelopeService) {
    this.envelopeService = envelopeService;
  }

  @GetMapping
  public ResponseEntity<Page<EnvelopeResponse>> listEnvelopes(
      @RequestParam(required = false) EnvelopeStatus status,
      @RequestParam(required = false) UUID ticketRef,
      Pageable pageable) {
    return ResponseEntity.ok(
        envelopeService.list(status, ticketRef, pageable).map(EnvelopeResponse::from));
  }

  @GetMapping("/stats")
  public ResponseEntity<EnvelopeStats> getStats() {
    return ResponseEntity.ok(envelopeService.stats());
  }

  @GetMapping("/{id}")
  public ResponseEntity<EnvelopeResponse> getEnvelope(@PathVariable UUID id) {
    return ResponseEntity.ok(EnvelopeResponse.from(envelopeService.get(id)));
  }

  @PostMapping("/{id}/retry")
  public ResponseEntity<EnvelopeResponse> retryEnvelope(@PathVariable UUID id) {
    return ResponseEntity.ok(EnvelopeResponse.from(envelopeService.retry(id)));
  }

  public record EnvelopeResponse(
      UUID id,
      String channel,
      String recipientAddress,
      String body,
      String kind,
      EnvelopeStatus status,
      int attempts,
      UUID ticketRef,
      String providerMessageId,
      String lastError,
      Instant lastAttemptAt,
      Instant nextAttemptAt,
      Instant sentAt,
      Instant createdAt,
      Instant updatedAt) {

    public static EnvelopeResponse from(Envelope envelope) {
      return new EnvelopeResponse(
          envelope.getId(),
          envelope.getChannel(),
          envelope.getRecipientAddress(),
          visibleBody(envelope),
          envelope.getKind(),
          envelope.getStatus(),
          envelope.getAttempts(),
          envelope.getTicketRef(),
          envelope.getProviderMessageId(),
          envelope.getLastError(),
          envelope.getLastAttemptAt(),
          envelope.getNextAttemptAt(),
          envelope.getSentAt(),
          envelope.getCreatedAt(),
          envelope.getUpdatedAt());
    }

    // one-time code bodies carry the plaintext code
    private static String visibleBody(Envelope envelope) {
      return envelope.getKind().startsWith(OTP_KIND_PREFIX) ? REDACTED_BODY : envelope.getBody();
    }
  }
}
