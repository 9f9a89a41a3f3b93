package io.netfield.fieldops.config;

import io.netfield.fieldops.envelope.DispatchProperties;
import io.netfield.fieldops.otp.OneTimeCodeProperties;
import io.netfield.fieldops.ticket.TicketProperties;
import io.netfield.fieldops.transport.TransportProperties;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({
  DispatchProperties.class,
  OneTimeCodeProperties.class,
  TicketProperties.class,
  TransportProperties.class
})
public class FieldOpsConfig {

  /** Time source for expiry and backoff decisions. Tests replace it with a fixed clock. */
  @Bean
  @ConditionalOnMissingBean
  Clock clock() {
    return Clock.systemUTC();
  }
}
