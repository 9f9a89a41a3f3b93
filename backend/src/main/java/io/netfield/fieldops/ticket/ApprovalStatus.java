package io.netfield.fieldops.ticket;

/** Approval gate in front of the ticket lifecycle. Only APPROVED tickets are actionable. */
public enum ApprovalStatus {
  PENDING,
  APPROVED,
  REJECTED
}
