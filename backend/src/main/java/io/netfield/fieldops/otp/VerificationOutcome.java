package io.netfield.fieldops.otp;

/**
 * Result of a verification call. Rejections are values rather than exceptions so that the attempt
 * counter increment commits with the call.
 */
public record VerificationOutcome(boolean accepted, Rejection rejection, int attempts) {

  public enum Rejection {
    NOT_FOUND,
    ALREADY_CONSUMED,
    EXPIRED,
    TOO_MANY_ATTEMPTS,
    MISMATCH
  }

  public static VerificationOutcome accepted(int attempts) {
    return new VerificationOutcome(true, null, attempts);
  }

  public static VerificationOutcome rejected(Rejection rejection, int attempts) {
    return new VerificationOutcome(false, rejection, attempts);
  }
}
