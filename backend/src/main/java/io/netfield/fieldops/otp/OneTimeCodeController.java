package io.netfield.fieldops.otp;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import java.time.Instant;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Public one-time code endpoints used during registration and password reset. The plaintext code is
 * only ever delivered over the messaging channel, never in a response.
 */
@RestController
@RequestMapping("/api/auth/codes")
public class OneTimeCodeController {

  private final CodeIssuerService codeIssuerService;

  public OneTimeCodeController(CodeIssuerService codeIssuerService) {
    this.codeIssuerService = codeIssuerService;
  }

  @PostMapping
  public ResponseEntity<CodeIssuedResponse> issueCode(
      @Valid @RequestBody IssueCodeRequest request) {
    var issued = codeIssuerService.issue(request.address(), request.purpose());
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(CodeIssuedResponse.from(issued));
  }

  @PostMapping("/resend")
  public ResponseEntity<CodeIssuedResponse> resendCode(
      @Valid @RequestBody IssueCodeRequest request) {
    var issued = codeIssuerService.resend(request.address(), request.purpose());
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(CodeIssuedResponse.from(issued));
  }

  @PostMapping("/verify")
  public ResponseEntity<CodeVerifiedResponse> verifyCode(
      @Valid @RequestBody VerifyCodeRequest request) {
    var outcome = codeIssuerService.verify(request.address(), request.purpose(), request.code());
    if (!outcome.accepted()) {
      throw new CodeRejectedException(outcome);
    }
    return ResponseEntity.ok(new CodeVerifiedResponse(true, request.purpose()));
  }

  public record IssueCodeRequest(
      @NotBlank(message = "address is required") String address,
      @NotNull(message = "purpose is required") CodePurpose purpose) {}

  public record VerifyCodeRequest(
      @NotBlank(message = "address is required") String address,
      @NotNull(message = "purpose is required") CodePurpose purpose,
      @NotBlank(message = "code is required")
          @Pattern(regexp = "\\d{4,10}", message = "code must be numeric")
          String code) {}

  public record CodeIssuedResponse(String address, CodePurpose purpose, Instant expiresAt) {

    static CodeIssuedResponse from(IssuedCode issued) {
      return new CodeIssuedResponse(
          issued.subjectAddress(), issued.purpose(), issued.expiresAt());
    }
  }

  public record CodeVerifiedResponse(boolean verified, CodePurpose purpose) {}
}
