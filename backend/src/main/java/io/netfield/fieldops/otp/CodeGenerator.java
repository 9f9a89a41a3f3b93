package io.netfield.fieldops.otp;

/** Source of plaintext codes. */
public interface CodeGenerator {

  /** Returns a string of exactly {@code length} decimal digits. */
  String generate(int length);
}
