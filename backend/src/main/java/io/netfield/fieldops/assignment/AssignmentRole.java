package io.netfield.fieldops.assignment;

public enum AssignmentRole {
  PRIMARY,
  SECONDARY
}
