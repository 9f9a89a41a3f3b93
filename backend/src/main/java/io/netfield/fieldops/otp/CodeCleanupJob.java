package io.netfield.fieldops.otp;

import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

/** Hourly removal of superseded one-time codes that expired more than a day ago. */
@Component
public class CodeCleanupJob {

  private static final Logger log = LoggerFactory.getLogger(CodeCleanupJob.class);
  private static final Duration RETENTION = Duration.ofDays(1);

  private final OneTimeCodeRepository codeRepository;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;

  public CodeCleanupJob(
      OneTimeCodeRepository codeRepository, TransactionTemplate transactionTemplate, Clock clock) {
    this.codeRepository = codeRepository;
    this.transactionTemplate = transactionTemplate;
    this.clock = clock;
  }

  @Scheduled(fixedRate = 3600000) // hourly
  public void cleanupExpiredCodes() {
    var cutoff = clock.instant().minus(RETENTION);
    try {
      Integer deleted =
          transactionTemplate.execute(
              status -> codeRepository.deleteSupersededExpiredBefore(cutoff));
      if (deleted != null && deleted > 0) {
        log.info("Cleaned up {} superseded one-time codes", deleted);
      }
    } catch (Exception e) {
      log.warn("Failed to clean up expired one-time codes: {}", e.getMessage());
    }
  }
}
