package io.netfield.fieldops.broadcast;

import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Default sink until a push channel (websocket gateway) is wired in. */
@Component
public class LoggingBroadcastSink implements BroadcastSink {

  private static final Logger log = LoggerFactory.getLogger(LoggingBroadcastSink.class);

  @Override
  public void broadcast(String event, Map<String, Object> payload) {
    log.info("Broadcast {}: {}", event, payload);
  }
}
