package io.netfield.fieldops.otp;

import java.security.SecureRandom;
import org.springframework.stereotype.Component;

@Component
public class NumericCodeGenerator implements CodeGenerator {

  private final SecureRandom secureRandom = new SecureRandom();

  @Override
  public String generate(int length) {
    if (length <= 0) {
      throw new IllegalArgumentException("Code length must be positive");
    }
    var code = new StringBuilder(length);
    for (int i = 0; i < length; i++) {
      code.append(secureRandom.nextInt(10));
    }
    return code.toString();
  }
}
