package io.netfield.fieldops.evidence;

import java.io.InputStream;
import java.util.UUID;

/**
 * Storage for completion evidence (photos of the finished installation or repair). The returned
 * reference is opaque to the rest of the system and is stored on the ticket as-is.
 */
public interface EvidenceStore {

  String store(
      UUID ticketId, String filename, String contentType, InputStream content, long size);

  /** Best-effort removal of a stored upload. Unknown references are ignored. */
  void delete(String reference);
}
