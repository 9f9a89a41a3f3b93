package io.netfield.fieldops.exception;

/** The security context holds no usable caller id. Mapped to 401 by the exception handler. */
public class MissingCallerIdentityException extends RuntimeException {

  public MissingCallerIdentityException(String message) {
    super(message);
  }
}
