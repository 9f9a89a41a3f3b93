package io.netfield.fieldops.envelope;

import io.netfield.fieldops.exception.StateConflictException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * One outbound message and its delivery state. Rows are created PENDING in the producer's
 * transaction and only ever move to SENT or FAILED through {@link #recordAttempt}.
 */
@Entity
@Table(name = "envelopes")
public class Envelope {

  private static final int MAX_ERROR_LENGTH = 1000;

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "channel", nullable = false, length = 30)
  private String channel;

  @Column(name = "recipient_address", nullable = false, length = 32)
  private String recipientAddress;

  @Column(name = "body", nullable = false, columnDefinition = "TEXT")
  private String body;

  @Column(name = "kind", nullable = false, length = 50)
  private String kind;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private EnvelopeStatus status;

  @Column(name = "attempts", nullable = false)
  private int attempts;

  @Column(name = "ticket_ref")
  private UUID ticketRef;

  @Column(name = "provider_message_id", length = 200)
  private String providerMessageId;

  @Column(name = "last_error", columnDefinition = "TEXT")
  private String lastError;

  @Column(name = "last_attempt_at")
  private Instant lastAttemptAt;

  @Column(name = "next_attempt_at", nullable = false)
  private Instant nextAttemptAt;

  @Column(name = "sent_at")
  private Instant sentAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Envelope() {}

  public Envelope(
      String channel,
      String recipientAddress,
      String body,
      String kind,
      UUID ticketRef,
      Instant now) {
    this.channel = channel;
    this.recipientAddress = recipientAddress;
    this.body = body;
    this.kind = kind;
    this.ticketRef = ticketRef;
    this.status = EnvelopeStatus.PENDING;
    this.attempts = 0;
    this.nextAttemptAt = now;
    this.createdAt = now;
    this.updatedAt = now;
  }

  /**
   * Records one delivery attempt. Every attempt counts, successful or not. A failed attempt leaves
   * the envelope PENDING with {@code nextAttemptAt} pushed out by {@code backoffBase *
   * 2^(attempts-1)} until {@code maxAttempts} is reached, then it becomes FAILED.
   *
   * @throws IllegalStateException if the envelope is not PENDING
   */
  public void recordAttempt(
      boolean delivered,
      String providerMessageId,
      String error,
      int maxAttempts,
      Duration backoffBase,
      Instant now) {
    if (status != EnvelopeStatus.PENDING) {
      throw new IllegalStateException(
          "Envelope " + id + " is " + status + ", attempts are only recorded while PENDING");
    }
    this.attempts++;
    this.lastAttemptAt = now;
    this.updatedAt = now;
    if (delivered) {
      this.status = EnvelopeStatus.SENT;
      this.sentAt = now;
      this.providerMessageId = providerMessageId;
      this.lastError = null;
      return;
    }
    this.lastError = truncate(error);
    if (attempts >= maxAttempts) {
      this.status = EnvelopeStatus.FAILED;
    } else {
      this.nextAttemptAt = now.plus(backoffFor(attempts, backoffBase));
    }
  }

  /** Staff retry: FAILED goes back to PENDING with a fresh attempt budget, due immediately. */
  public void resetForRetry(Instant now) {
    if (status != EnvelopeStatus.FAILED) {
      throw new StateConflictException(
          "Envelope not retryable",
          "Only FAILED envelopes can be retried. Current status: " + status);
    }
    this.status = EnvelopeStatus.PENDING;
    this.attempts = 0;
    this.lastError = null;
    this.nextAttemptAt = now;
    this.updatedAt = now;
  }

  /**
   * Pushes the next attempt of a PENDING envelope out to {@code until} without spending an
   * attempt. An envelope already due later is left alone.
   *
   * @throws IllegalStateException if the envelope is not PENDING
   */
  public void deferUntil(Instant until, Instant now) {
    if (status != EnvelopeStatus.PENDING) {
      throw new IllegalStateException(
          "Envelope " + id + " is " + status + ", only PENDING envelopes can be deferred");
    }
    if (until.isAfter(nextAttemptAt)) {
      this.nextAttemptAt = until;
      this.updatedAt = now;
    }
  }

  public boolean isPending() {
    return status == EnvelopeStatus.PENDING;
  }

  static Duration backoffFor(int attempts, Duration base) {
    if (base.isZero() || attempts <= 0) {
      return Duration.ZERO;
    }
    // cap the exponent so a misconfigured max-attempts cannot overflow
    int exponent = Math.min(attempts - 1, 16);
    return base.multipliedBy(1L << exponent);
  }

  private static String truncate(String error) {
    if (error == null) {
      return "unreachable";
    }
    return error.length() > MAX_ERROR_LENGTH ? error.substring(0, MAX_ERROR_LENGTH) : error;
  }

  public UUID getId() {
    return id;
  }

  public String getChannel() {
    return channel;
  }

  public String getRecipientAddress() {
    return recipientAddress;
  }

  public String getBody() {
    return body;
  }

  public String getKind() {
    return kind;
  }

  public EnvelopeStatus getStatus() {
    return status;
  }

  public int getAttempts() {
    return attempts;
  }

  public UUID getTicketRef() {
    return ticketRef;
  }

  public String getProviderMessageId() {
    return providerMessageId;
  }

  public String getLastError() {
    return lastError;
  }

  public Instant getLastAttemptAt() {
    return lastAttemptAt;
  }

  public Instant getNextAttemptAt() {
    return nextAttemptAt;
  }

  public Instant getSentAt() {
    return sentAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
