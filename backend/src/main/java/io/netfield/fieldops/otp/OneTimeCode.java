package io.netfield.fieldops.otp;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * A short-lived verification code. Only the SHA-256 hash is stored; the plaintext leaves the
 * system once, inside an envelope. At most one non-superseded code exists per (subject, purpose).
 */
@Entity
@Table(name = "one_time_codes")
public class OneTimeCode {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "subject_address", nullable = false, length = 32)
  private String subjectAddress;

  @Enumerated(EnumType.STRING)
  @Column(name = "purpose", nullable = false, length = 30)
  private CodePurpose purpose;

  @Column(name = "code_hash", nullable = false, length = 64)
  private String codeHash;

  @Column(name = "expires_at", nullable = false)
  private Instant expiresAt;

  @Column(name = "consumed_at")
  private Instant consumedAt;

  @Column(name = "superseded_at")
  private Instant supersededAt;

  @Column(name = "attempts", nullable = false)
  private int attempts;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected OneTimeCode() {}

  public OneTimeCode(
      String subjectAddress, CodePurpose purpose, String codeHash, Instant expiresAt, Instant now) {
    this.subjectAddress = subjectAddress;
    this.purpose = purpose;
    this.codeHash = codeHash;
    this.expiresAt = expiresAt;
    this.attempts = 0;
    this.createdAt = now;
  }

  /** Counts one verification call, whatever its outcome. Returns the new count. */
  public int registerAttempt() {
    return ++attempts;
  }

  public void markConsumed(Instant now) {
    this.consumedAt = now;
  }

  public boolean isConsumed() {
    return consumedAt != null;
  }

  /** Expired once {@code now} has reached {@code expiresAt}. */
  public boolean isExpired(Instant now) {
    return !now.isBefore(expiresAt);
  }

  public UUID getId() {
    return id;
  }

  public String getSubjectAddress() {
    return subjectAddress;
  }

  public CodePurpose getPurpose() {
    return purpose;
  }

  public String getCodeHash() {
    return codeHash;
  }

  public Instant getExpiresAt() {
    return expiresAt;
  }

  public Instant getConsumedAt() {
    return consumedAt;
  }

  public Instant getSupersededAt() {
    return supersededAt;
  }

  public int getAttempts() {
    return attempts;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
