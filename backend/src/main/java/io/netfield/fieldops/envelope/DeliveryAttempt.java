package io.netfield.fieldops.envelope;

/** What a single call to {@link EnvelopeDeliveryService#attemptDelivery} did. */
public enum DeliveryAttempt {
  /** The transport accepted the message; the envelope is SENT. */
  SENT,
  /** The transport failed; the envelope stays PENDING until its next backoff slot. */
  RETRY_SCHEDULED,
  /** The transport failed and the attempt budget is spent; the envelope is FAILED. */
  FAILED,
  /** The envelope was missing or no longer PENDING, so nothing was sent. */
  SKIPPED
}
