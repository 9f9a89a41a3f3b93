package io.netfield.fieldops.envelope;

/** Delivery state of an outbound envelope. SENT and FAILED are only left by an explicit retry. */
public enum EnvelopeStatus {
  PENDING,
  SENT,
  FAILED
}
