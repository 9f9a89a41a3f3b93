package io.netfield.fieldops.otp;

public enum CodePurpose {
  REGISTER,
  RESET_PASSWORD
}
