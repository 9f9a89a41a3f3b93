package io.netfield.fieldops.envelope;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Dispatch loop tuning. {@code backoffBase} of zero disables exponential backoff so that every
 * cycle retries a failed envelope.
 */
@ConfigurationProperties("fieldops.dispatch")
public record DispatchProperties(
    @DefaultValue("true") boolean schedulerEnabled,
    @DefaultValue("5s") Duration pollInterval,
    @DefaultValue("10") int batchSize,
    @DefaultValue("3") int maxAttempts,
    @DefaultValue("2s") Duration backoffBase,
    @DefaultValue("10s") Duration transportTimeout,
    @DefaultValue("true") boolean inlineEnabled,
    @DefaultValue("30") int recipientLimitPerMinute) {}
