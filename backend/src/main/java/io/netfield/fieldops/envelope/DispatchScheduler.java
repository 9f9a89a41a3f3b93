package io.netfield.fieldops.envelope;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Runs the dispatch loop on a fixed delay. Switched off by {@code scheduler-enabled=false}. */
@Component
@ConditionalOnProperty(
    name = "fieldops.dispatch.scheduler-enabled",
    havingValue = "true",
    matchIfMissing = true)
public class DispatchScheduler {

  private static final Logger log = LoggerFactory.getLogger(DispatchScheduler.class);

  private final DispatchLoop dispatchLoop;

  public DispatchScheduler(DispatchLoop dispatchLoop) {
    this.dispatchLoop = dispatchLoop;
  }

  @Scheduled(
      fixedDelayString = "${fieldops.dispatch.poll-interval:5s}",
      initialDelayString = "${fieldops.dispatch.poll-interval:5s}")
  public void poll() {
    try {
      dispatchLoop.runCycle();
    } catch (Exception e) {
      log.error("Dispatch cycle failed", e);
    }
  }
}
