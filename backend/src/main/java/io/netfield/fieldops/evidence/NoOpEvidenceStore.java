package io.netfield.fieldops.evidence;

import java.io.InputStream;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Discards uploads and hands back a synthetic reference. Default when no store is configured. */
@Component
@ConditionalOnProperty(
    name = "fieldops.evidence.provider",
    havingValue = "noop",
    matchIfMissing = true)
public class NoOpEvidenceStore implements EvidenceStore {

  private static final Logger log = LoggerFactory.getLogger(NoOpEvidenceStore.class);

  @Override
  public String store(
      UUID ticketId, String filename, String contentType, InputStream content, long size) {
    String reference = "noop://" + EvidenceKeys.keyFor(ticketId, filename);
    log.info("NoOp evidence store: discarded {} bytes for ticket {}", size, ticketId);
    return reference;
  }

  @Override
  public void delete(String reference) {
    log.info("NoOp evidence store: nothing to delete for {}", reference);
  }
}
