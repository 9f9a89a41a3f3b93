package io.netfield.fieldops.otp;

import io.netfield.fieldops.envelope.EnvelopeService;
import io.netfield.fieldops.exception.RateLimitExceededException;
import io.netfield.fieldops.exception.StateConflictException;
import io.netfield.fieldops.exception.ValidationException;
import io.netfield.fieldops.otp.VerificationOutcome.Rejection;
import io.netfield.fieldops.transport.PhoneNumbers;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Issues and verifies one-time codes delivered over the messaging channel. Codes are stored as
 * SHA-256 hashes bound to subject and purpose; the newest issued code for a (subject, purpose) pair
 * is the only valid one. Rate limited to {@code issue-limit} codes per {@code issue-window}.
 */
@Service
public class CodeIssuerService {

  private static final Logger log = LoggerFactory.getLogger(CodeIssuerService.class);
  static final String KIND_PREFIX = "otp.";

  private final OneTimeCodeRepository codeRepository;
  private final EnvelopeService envelopeService;
  private final CodeGenerator codeGenerator;
  private final OneTimeCodeProperties properties;
  private final Clock clock;

  public CodeIssuerService(
      OneTimeCodeRepository codeRepository,
      EnvelopeService envelopeService,
      CodeGenerator codeGenerator,
      OneTimeCodeProperties properties,
      Clock clock) {
    this.codeRepository = codeRepository;
    this.envelopeService = envelopeService;
    this.codeGenerator = codeGenerator;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Supersedes any live code for the pair, stores a fresh one and enqueues it for delivery.
   *
   * @throws ValidationException if the address is not a valid mobile number
   * @throws RateLimitExceededException if too many codes were issued recently
   */
  @Transactional
  public IssuedCode issue(String subjectAddress, CodePurpose purpose) {
    if (purpose == null) {
      throw new ValidationException("Missing purpose", "Code purpose is required");
    }
    String subject = PhoneNumbers.normalize(subjectAddress);
    Instant now = clock.instant();

    long recent =
        codeRepository.countBySubjectAddressAndPurposeAndCreatedAtAfter(
            subject, purpose, now.minus(properties.issueWindow()));
    if (recent >= properties.issueLimit()) {
      log.warn("Code issue rate limit hit for {} ({})", subject, purpose);
      throw new RateLimitExceededException(
          "Too many codes requested, try again later", properties.issueWindow());
    }

    int superseded = codeRepository.supersedeCurrent(subject, purpose, now);
    String plaintext = codeGenerator.generate(properties.length());
    Instant expiresAt = now.plus(properties.ttl());
    try {
      codeRepository.saveAndFlush(
          new OneTimeCode(subject, purpose, hash(subject, purpose, plaintext), expiresAt, now));
    } catch (DataIntegrityViolationException e) {
      // a concurrent issue for the same pair inserted its live code first
      throw new StateConflictException(
          "Code issue in progress", "Another code for this number is being issued, retry shortly");
    }

    envelopeService.enqueue(subject, messageFor(plaintext, purpose), KIND_PREFIX + purpose, null);
    log.info("Issued {} code for {} (superseded {})", purpose, subject, superseded);
    return new IssuedCode(subject, purpose, plaintext, expiresAt);
  }

  /** Same as {@link #issue}: the previous code stops being valid. */
  @Transactional
  public IssuedCode resend(String subjectAddress, CodePurpose purpose) {
    return issue(subjectAddress, purpose);
  }

  /**
   * Checks a candidate against the live code. Every call on an existing code counts as an attempt,
   * accepted or not, and the count is committed even when the outcome is a rejection.
   */
  @Transactional
  public VerificationOutcome verify(String subjectAddress, CodePurpose purpose, String candidate) {
    if (purpose == null) {
      throw new ValidationException("Missing purpose", "Code purpose is required");
    }
    String subject = PhoneNumbers.normalize(subjectAddress);
    var current = codeRepository.findCurrentForUpdate(subject, purpose).orElse(null);
    if (current == null) {
      return VerificationOutcome.rejected(Rejection.NOT_FOUND, 0);
    }

    Instant now = clock.instant();
    int attempts = current.registerAttempt();
    VerificationOutcome outcome;
    if (current.isConsumed()) {
      outcome = VerificationOutcome.rejected(Rejection.ALREADY_CONSUMED, attempts);
    } else if (current.isExpired(now)) {
      outcome = VerificationOutcome.rejected(Rejection.EXPIRED, attempts);
    } else if (attempts > properties.maxAttempts()) {
      outcome = VerificationOutcome.rejected(Rejection.TOO_MANY_ATTEMPTS, attempts);
    } else if (!matches(current, candidate)) {
      outcome = VerificationOutcome.rejected(Rejection.MISMATCH, attempts);
    } else {
      current.markConsumed(now);
      outcome = VerificationOutcome.accepted(attempts);
    }

    if (outcome.accepted()) {
      log.info("Verified {} code for {}", purpose, subject);
    } else {
      log.info(
          "Rejected {} code for {}: {} (attempt {})",
          purpose,
          subject,
          outcome.rejection(),
          attempts);
    }
    return outcome;
  }

  private boolean matches(OneTimeCode code, String candidate) {
    if (candidate == null || candidate.isBlank()) {
      return false;
    }
    String candidateHash = hash(code.getSubjectAddress(), code.getPurpose(), candidate.trim());
    return MessageDigest.isEqual(
        candidateHash.getBytes(StandardCharsets.US_ASCII),
        code.getCodeHash().getBytes(StandardCharsets.US_ASCII));
  }

  private String messageFor(String plaintext, CodePurpose purpose) {
    String action = purpose == CodePurpose.REGISTER ? "registration" : "password reset";
    return "Your %s code is *%s*.\nIt expires in %d minutes. Do not share this code with anyone."
        .formatted(action, plaintext, properties.ttl().toMinutes());
  }

  /** SHA-256 over subject, purpose and code, hex-encoded. */
  static String hash(String subject, CodePurpose purpose, String code) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hashBytes =
          digest.digest((subject + "|" + purpose + "|" + code).getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(hashBytes);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
