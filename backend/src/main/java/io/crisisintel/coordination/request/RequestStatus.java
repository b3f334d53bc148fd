package io.crisisintel.coordination.request;

import java.util.Map;
import java.util.Set;

/** Shared request lifecycle with validated transitions. */
public enum RequestStatus {
  PENDING,
  ACCEPTED,
  REJECTED,
  CANCELLED,
  COMPLETED;

  private static final Map<RequestStatus, Set<RequestStatus>> ALLOWED_TRANSITIONS =
      Map.of(
          PENDING, Set.of(ACCEPTED, REJECTED, CANCELLED),
          ACCEPTED, Set.of(COMPLETED, CANCELLED));

  /** Returns the set of statuses this status can transition to. */
  public Set<RequestStatus> allowedTransitions() {
    return ALLOWED_TRANSITIONS.getOrDefault(this, Set.of());
  }

  /** Returns true if transitioning from this status to the target is allowed. */
  public boolean canTransitionTo(RequestStatus target) {
    return allowedTransitions().contains(target);
  }

  /** Rejected, cancelled and completed requests never change again. */
  public boolean isTerminal() {
    return allowedTransitions().isEmpty();
  }
}
