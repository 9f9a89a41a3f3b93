package io.netfield.fieldops.assignment;

/** A technician's answer to an assignment. */
public enum ConfirmAction {
  ACCEPT,
  DECLINE
}
