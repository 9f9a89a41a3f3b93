package io.netfield.fieldops.ticket;

import java.util.Map;
import java.util.Set;

/**
 * Ticket execution status with validated transitions. OPEN to ASSIGNED and ASSIGNED back to OPEN
 * are driven by assignment operations only; the remaining edges are reachable through status
 * updates.
 */
public enum TicketStatus {
  OPEN,
  ASSIGNED,
  IN_PROGRESS,
  COMPLETED,
  CANCELLED;

  private static final Map<TicketStatus, Set<TicketStatus>> ALLOWED_TRANSITIONS =
      Map.of(
          OPEN, Set.of(ASSIGNED, CANCELLED),
          ASSIGNED, Set.of(OPEN, IN_PROGRESS, CANCELLED),
          IN_PROGRESS, Set.of(COMPLETED, CANCELLED),
          COMPLETED, Set.of(),
          CANCELLED, Set.of());

  private static final Set<TicketStatus> ASSIGNMENT_ONLY_TARGETS = Set.of(OPEN, ASSIGNED);

  /** Returns the set of statuses this status can transition to. */
  public Set<TicketStatus> allowedTransitions() {
    return ALLOWED_TRANSITIONS.getOrDefault(this, Set.of());
  }

  /** Returns true if transitioning from this status to the target is allowed. */
  public boolean canTransitionTo(TicketStatus target) {
    return allowedTransitions().contains(target);
  }

  /** Returns true if this is a terminal state (COMPLETED or CANCELLED). */
  public boolean isTerminal() {
    return this == COMPLETED || this == CANCELLED;
  }

  /** Targets that a plain status update may never request. */
  public static boolean isAssignmentOnly(TicketStatus target) {
    return ASSIGNMENT_ONLY_TARGETS.contains(target);
  }

  /** Statuses from which a technician may claim the ticket. */
  public static Set<TicketStatus> selfAssignable() {
    return Set.of(OPEN, ASSIGNED);
  }
}
