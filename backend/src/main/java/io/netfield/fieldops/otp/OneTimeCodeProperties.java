package io.netfield.fieldops.otp;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * One-time code policy.
 *
 * @param maxAttempts verification calls allowed per code; the next one is rejected
 * @param issueLimit codes that may be issued per subject and purpose within {@code issueWindow}
 */
@ConfigurationProperties("fieldops.otp")
public record OneTimeCodeProperties(
    @DefaultValue("6") int length,
    @DefaultValue("10m") Duration ttl,
    @DefaultValue("5") int maxAttempts,
    @DefaultValue("3") int issueLimit,
    @DefaultValue("5m") Duration issueWindow) {}
