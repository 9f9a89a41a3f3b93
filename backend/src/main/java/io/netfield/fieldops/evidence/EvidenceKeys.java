package io.netfield.fieldops.evidence;

import java.util.UUID;

final class EvidenceKeys {

  private EvidenceKeys() {}

  static String keyFor(UUID ticketId, String filename) {
    return "tickets/" + ticketId + "/evidence/" + UUID.randomUUID() + "-" + safeName(filename);
  }

  static String safeName(String filename) {
    if (filename == null || filename.isBlank()) {
      return "evidence";
    }
    String cleaned = filename.replaceAll("[^A-Za-z0-9._-]", "_");
    return cleaned.length() > 100 ? cleaned.substring(cleaned.length() - 100) : cleaned;
  }
}
