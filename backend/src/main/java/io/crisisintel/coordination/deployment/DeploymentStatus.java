package io.crisisintel.coordination.deployment;

import java.util.Map;
import java.util.Set;

/** Lifecycle of a deployed unit: active until completed or withdrawn. */
public enum DeploymentStatus {
  ACTIVE,
  COMPLETED,
  WITHDRAWN;

  private static final Map<DeploymentStatus, Set<DeploymentStatus>> ALLOWED_TRANSITIONS =
      Map.of(ACTIVE, Set.of(COMPLETED, WITHDRAWN));

  public boolean canTransitionTo(DeploymentStatus target) {
    return ALLOWED_TRANSITIONS.getOrDefault(this, Set.of()).contains(target);
  }

  public boolean isTerminal() {
    return this != ACTIVE;
  }
}
