package io.netfield.fieldops.transport;

import io.netfield.fieldops.exception.ValidationException;

/**
 * Normalizes Indonesian mobile numbers to the international digits-only form the messaging channel
 * addresses by ({@code 62...}). Accepts {@code 0812...}, {@code 812...}, {@code +62812...} and
 * {@code 62812...}, with spaces, dashes or dots in between.
 */
public final class PhoneNumbers {

  private static final int MIN_DIGITS = 10;
  private static final int MAX_DIGITS = 15;

  private PhoneNumbers() {}

  /**
   * @throws ValidationException if the input is blank or does not normalize to 10-15 digits
   */
  public static String normalize(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new ValidationException("Invalid phone number", "Phone number is required");
    }
    String digits = raw.replaceAll("\\D", "");
    if (digits.startsWith("0")) {
      digits = "62" + digits.substring(1);
    } else if (digits.startsWith("8")) {
      digits = "62" + digits;
    }
    if (digits.length() < MIN_DIGITS || digits.length() > MAX_DIGITS) {
      throw new ValidationException(
          "Invalid phone number",
          "Phone number must have " + MIN_DIGITS + " to " + MAX_DIGITS + " digits");
    }
    return digits;
  }
}
