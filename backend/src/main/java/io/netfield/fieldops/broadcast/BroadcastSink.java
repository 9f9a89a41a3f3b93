package io.netfield.fieldops.broadcast;

import java.util.Map;

/** Real-time UI feed. Fire-and-forget: callers never look at the outcome. */
public interface BroadcastSink {

  void broadcast(String event, Map<String, Object> payload);
}
