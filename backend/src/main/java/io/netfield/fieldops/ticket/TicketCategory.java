package io.netfield.fieldops.ticket;

public enum TicketCategory {
  INSTALL("INS"),
  REPAIR("REP");

  private final String numberPrefix;

  TicketCategory(String numberPrefix) {
    this.numberPrefix = numberPrefix;
  }

  /** Prefix of the human-readable ticket number, e.g. {@code INS-1718000000000-0042}. */
  public String numberPrefix() {
    return numberPrefix;
  }
}
