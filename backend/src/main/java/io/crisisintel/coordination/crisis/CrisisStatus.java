package io.crisisintel.coordination.crisis;

import java.util.Map;
import java.util.Set;

/** Crisis lifecycle. Closed and cancelled crises only serve read-only summaries. */
public enum CrisisStatus {
  ACTIVE,
  CLOSED,
  CANCELLED;

  private static final Map<CrisisStatus, Set<CrisisStatus>> ALLOWED_TRANSITIONS =
      Map.of(ACTIVE, Set.of(CLOSED, CANCELLED));

  public Set<CrisisStatus> allowedTransitions() {
    return ALLOWED_TRANSITIONS.getOrDefault(this, Set.of());
  }

  public boolean canTransitionTo(CrisisStatus target) {
    return allowedTransitions().contains(target);
  }

  public boolean isTerminal() {
    return this != ACTIVE;
  }
}
