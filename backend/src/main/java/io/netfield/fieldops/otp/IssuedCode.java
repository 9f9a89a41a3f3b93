package io.netfield.fieldops.otp;

import java.time.Instant;

/** A freshly issued code. {@code plaintext} goes into the envelope and nowhere else. */
public record IssuedCode(
    String subjectAddress, CodePurpose purpose, String plaintext, Instant expiresAt) {}
